package com.example.handoff.support;

import java.time.Instant;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class TestHandoffConfiguration {

    public static final Instant START = Instant.parse("2024-05-01T08:00:00Z");

    @Bean
    @Primary
    public MutableClock mutableClock() {
        return new MutableClock(START);
    }

    @Bean
    @Primary
    public StubRecommendationGenerator stubRecommendationGenerator() {
        return new StubRecommendationGenerator();
    }
}
