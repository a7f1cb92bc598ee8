package com.example.handoff.recommendation;

import com.example.handoff.config.ChatProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * Asks the retrieval-augmented answer endpoint for a reply to the customer's latest turn.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chat.recommendation", name = "enabled", havingValue = "true")
public class RagHttpRecommendationGenerator implements RecommendationGenerator {

    private final RestTemplate restTemplate;
    private final ChatProperties chatProperties;

    public RagHttpRecommendationGenerator(
            @Qualifier("recommendationRestTemplate") RestTemplate restTemplate, ChatProperties chatProperties) {
        this.restTemplate = restTemplate;
        this.chatProperties = chatProperties;
    }

    @Override
    public Optional<Recommendation> generate(RecommendationRequest request) {
        ChatProperties.Recommendation config = chatProperties.getRecommendation();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("question", request.question());
        body.put("session_id", request.sessionToken());
        body.put("language", config.getLanguage());
        body.put("max_sources", config.getMaxSources());
        body.put("similarity_threshold", config.getSimilarityThreshold());

        RagAnswer answer = restTemplate.postForObject(config.getEndpoint(), body, RagAnswer.class);
        if (answer == null || !StringUtils.hasText(answer.answer())) {
            log.debug("Answer endpoint returned nothing for conversation {}", request.conversationId());
            return Optional.empty();
        }
        return Optional.of(new Recommendation(answer.answer().trim(), clamp(answer.confidence())));
    }

    private static Double clamp(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return null;
        }
        return Math.min(1.0, Math.max(0.0, confidence));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RagAnswer(@JsonProperty("answer") String answer, @JsonProperty("confidence") Double confidence) {
    }
}
