package com.example.handoff.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    /**
     * Client for the answer endpoint that drafts recommendations.
     */
    @Bean
    public RestTemplate recommendationRestTemplate(RestTemplateBuilder builder, ChatProperties chatProperties) {
        ChatProperties.Recommendation recommendation = chatProperties.getRecommendation();
        return builder
                .setConnectTimeout(recommendation.getConnectTimeout())
                .setReadTimeout(recommendation.getReadTimeout())
                .build();
    }
}
