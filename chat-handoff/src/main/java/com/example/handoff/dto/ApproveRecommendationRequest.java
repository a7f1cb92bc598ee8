package com.example.handoff.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ApproveRecommendationRequest {

    /** Replacement text; the newest draft is sent verbatim when blank. */
    @Size(max = 10_000)
    private String content;

    private boolean keepOpen;
}
