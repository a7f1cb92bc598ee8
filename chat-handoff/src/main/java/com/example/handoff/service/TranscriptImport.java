package com.example.handoff.service;

import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.MessageType;
import com.example.handoff.domain.ServiceMode;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TranscriptImport {

    String sessionToken;
    ServiceMode serviceMode;
    String userAgent;
    String ipAddress;

    @Singular
    List<Turn> turns;

    @Value
    @Builder
    public static class Turn {
        MessageType type;
        String content;
        Double confidence;
        InputMethod inputMethod;
        Instant createdAt;
    }
}
