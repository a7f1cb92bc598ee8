package com.example.handoff.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class GenerateRecommendationRequest {

    @NotNull
    private Long parentMessageId;
}
