package com.example.handoff.recommendation;

import java.util.Optional;

/**
 * Source of draft replies for operator review. Implementations may call remote services and may fail; callers
 * treat any failure as "no recommendation".
 */
public interface RecommendationGenerator {

    Optional<Recommendation> generate(RecommendationRequest request);
}
