package com.example.handoff.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String OPERATOR_TOKEN_SCHEME = "operatorToken";

    @Bean
    public OpenAPI handoffOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Live Chat Handoff API")
                        .version("v1")
                        .description("Customer polling, escalation queue and operator handoff."))
                .components(new Components().addSecuritySchemes(OPERATOR_TOKEN_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name("X-Operator-Token")));
    }

    @Bean
    public GroupedOpenApi conversationGroup() {
        return GroupedOpenApi.builder()
                .group("conversations")
                .pathsToMatch("/api/conversations", "/api/conversations/**")
                .build();
    }

    /**
     * Operator endpoints require the token header, so the group marks every operation with the scheme.
     */
    @Bean
    public GroupedOpenApi operatorGroup() {
        return GroupedOpenApi.builder()
                .group("operator")
                .pathsToMatch("/api/operator/**")
                .addOperationCustomizer((operation, handlerMethod) ->
                        operation.addSecurityItem(new SecurityRequirement().addList(OPERATOR_TOKEN_SCHEME)))
                .build();
    }
}
