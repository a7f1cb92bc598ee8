package com.example.handoff.dto;

import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.MessageType;
import com.example.handoff.domain.ServiceMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class TranscriptRequest {

    @NotBlank
    @Size(max = 255)
    private String sessionToken;

    private ServiceMode serviceMode = ServiceMode.FULL_LLM_BOT;

    @NotEmpty
    @Valid
    private List<Message> messages = new ArrayList<>();

    @Data
    public static class Message {

        @NotNull
        private MessageType type;

        @NotBlank
        @Size(max = 10_000)
        private String content;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double confidence;

        private InputMethod inputMethod;

        /** Client-side time of the turn; defaults to the import time. */
        private Instant timestamp;
    }
}
