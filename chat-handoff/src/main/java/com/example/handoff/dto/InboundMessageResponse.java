package com.example.handoff.dto;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.ConversationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessageResponse {

    private String conversationId;
    private ConversationStatus status;
    private ChatMessage message;
}
