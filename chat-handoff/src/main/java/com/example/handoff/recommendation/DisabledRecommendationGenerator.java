package com.example.handoff.recommendation;

import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "chat.recommendation", name = "enabled", havingValue = "false", matchIfMissing = true)
public class DisabledRecommendationGenerator implements RecommendationGenerator {

    @Override
    public Optional<Recommendation> generate(RecommendationRequest request) {
        return Optional.empty();
    }
}
