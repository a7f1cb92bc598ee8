package com.example.handoff.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ProposeRecommendationRequest {

    @NotNull
    private Long parentMessageId;

    @NotBlank
    @Size(max = 10_000)
    private String content;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;
}
