package com.example.handoff.service;

import com.example.handoff.domain.OperatorContext;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class OperatorIdentityService {

    private final OperatorDirectory operatorDirectory;

    /**
     * Resolves a credential into the caller identity passed to every operator operation.
     */
    public OperatorContext authenticate(String credential) {
        if (!StringUtils.hasText(credential)) {
            throw new ServiceException(ErrorKind.UNAUTHENTICATED, "Operator credential is required");
        }
        OperatorAccount account = operatorDirectory.findByCredential(credential)
                .orElseThrow(() -> new ServiceException(ErrorKind.UNAUTHENTICATED, "Unknown operator credential"));
        if (!account.active()) {
            log.warn("Rejected inactive operator {}", account.operatorId());
            throw new ServiceException(ErrorKind.FORBIDDEN, "Operator account is inactive");
        }
        if (account.role() == null || !account.role().isPrivileged()) {
            throw new ServiceException(ErrorKind.FORBIDDEN, "Operator is not allowed to handle conversations");
        }
        return new OperatorContext(account.operatorId(), account.role());
    }
}
