package com.example.handoff.dto;

import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.MessageType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {

    private MessageType type = MessageType.USER;

    @NotBlank
    @Size(max = 10_000)
    private String content;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    private InputMethod inputMethod = InputMethod.TEXT;
}
