package com.example.handoff.recommendation;

public record RecommendationRequest(String conversationId, String sessionToken, String question) {
}
