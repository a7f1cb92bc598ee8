package com.example.handoff.service;

import com.example.handoff.config.ChatSecurityProperties;
import com.example.handoff.domain.OperatorRole;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class ConfiguredOperatorDirectory implements OperatorDirectory {

    private final ChatSecurityProperties securityProperties;

    @Override
    public Optional<OperatorAccount> findByCredential(String credential) {
        if (!StringUtils.hasText(credential)) {
            return Optional.empty();
        }
        return securityProperties.getOperators().stream()
                .filter(operator -> credential.equals(operator.getToken()))
                .findFirst()
                .map(operator -> new OperatorAccount(
                        operator.getId(),
                        operator.getRole() != null ? operator.getRole() : OperatorRole.NONE,
                        operator.isActive()));
    }
}
