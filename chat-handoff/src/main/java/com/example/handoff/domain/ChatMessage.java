package com.example.handoff.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    private Long id;
    private String conversationId;
    private MessageType type;
    private String content;
    private Double confidence;
    private String authorOperatorId;
    private Long parentMessageId;
    private InputMethod inputMethod;
    private Instant createdAt;
}
