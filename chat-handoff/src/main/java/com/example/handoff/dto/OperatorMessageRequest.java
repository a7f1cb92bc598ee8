package com.example.handoff.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class OperatorMessageRequest {

    @NotBlank
    @Size(max = 10_000)
    private String content;
}
