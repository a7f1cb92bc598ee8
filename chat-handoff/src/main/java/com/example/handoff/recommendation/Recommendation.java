package com.example.handoff.recommendation;

/**
 * @param confidence between 0 and 1, or {@code null} when the generator does not score its answers
 */
public record Recommendation(String content, Double confidence) {
}
