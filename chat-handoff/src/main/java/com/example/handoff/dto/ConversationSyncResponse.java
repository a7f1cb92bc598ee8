package com.example.handoff.dto;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.ConversationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Poll result. A full fetch fills {@code messages}, an incremental fetch fills {@code newMessages}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationSyncResponse {

    private String conversationId;
    private ConversationStatus status;
    private String assignedOperatorId;
    private List<ChatMessage> messages;
    private List<ChatMessage> newMessages;

    /** Largest message id the client has now seen; pass it back as {@code lastMessageId}. */
    private long cursor;
}
