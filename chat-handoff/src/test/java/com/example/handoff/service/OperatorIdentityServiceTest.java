package com.example.handoff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.example.handoff.config.ChatSecurityProperties;
import com.example.handoff.domain.OperatorContext;
import com.example.handoff.domain.OperatorRole;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OperatorIdentityServiceTest {

    private OperatorIdentityService identityService;

    @BeforeEach
    void setUp() {
        ChatSecurityProperties properties = new ChatSecurityProperties();
        properties.setOperators(List.of(
                operator("op-ani", "token-ani", OperatorRole.ADMIN, true),
                operator("op-root", "token-root", OperatorRole.SUPERADMIN, true),
                operator("op-retired", "token-retired", OperatorRole.ADMIN, false),
                operator("op-viewer", "token-viewer", OperatorRole.NONE, true)));
        identityService = new OperatorIdentityService(new ConfiguredOperatorDirectory(properties));
    }

    @Test
    void resolvesPrivilegedOperators() {
        assertThat(identityService.authenticate("token-ani"))
                .isEqualTo(new OperatorContext("op-ani", OperatorRole.ADMIN));
        assertThat(identityService.authenticate("token-root").isSuperadmin()).isTrue();
    }

    @Test
    void missingOrUnknownCredentialIsUnauthenticated() {
        assertThat(kindOf("")).isEqualTo(ErrorKind.UNAUTHENTICATED);
        assertThat(kindOf(null)).isEqualTo(ErrorKind.UNAUTHENTICATED);
        assertThat(kindOf("token-nobody")).isEqualTo(ErrorKind.UNAUTHENTICATED);
    }

    @Test
    void inactiveOrUnprivilegedOperatorIsForbidden() {
        assertThat(kindOf("token-retired")).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(kindOf("token-viewer")).isEqualTo(ErrorKind.FORBIDDEN);
    }

    private ErrorKind kindOf(String credential) {
        ServiceException ex = catchThrowableOfType(
                () -> identityService.authenticate(credential), ServiceException.class);
        assertThat(ex).isNotNull();
        return ex.getKind();
    }

    private static ChatSecurityProperties.Operator operator(String id, String token, OperatorRole role, boolean active) {
        ChatSecurityProperties.Operator operator = new ChatSecurityProperties.Operator();
        operator.setId(id);
        operator.setToken(token);
        operator.setRole(role);
        operator.setActive(active);
        return operator;
    }
}
