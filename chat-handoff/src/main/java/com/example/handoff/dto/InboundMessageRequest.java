package com.example.handoff.dto;

import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.ServiceMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class InboundMessageRequest {

    @NotBlank
    @Size(max = 255)
    private String sessionToken;

    @NotBlank
    @Size(max = 10_000)
    private String content;

    private InputMethod inputMethod = InputMethod.TEXT;

    private ServiceMode serviceMode;
}
