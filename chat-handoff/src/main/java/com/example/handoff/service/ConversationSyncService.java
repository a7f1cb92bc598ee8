package com.example.handoff.service;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.dto.ConversationSyncResponse;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side for polling clients. Every call is a single read-only snapshot and never touches queue state.
 */
@Service
@RequiredArgsConstructor
public class ConversationSyncService {

    private final ConversationService conversationService;
    private final MessageService messageService;

    @Transactional(readOnly = true)
    public ConversationSyncResponse fetchFull(String conversationId, SyncAudience audience) {
        Conversation conversation = conversationService.getConversation(conversationId);
        List<ChatMessage> messages = visible(messageService.readAll(conversationId), audience);
        return ConversationSyncResponse.builder()
                .conversationId(conversationId)
                .status(conversation.getStatus())
                .assignedOperatorId(conversation.getAssignedOperatorId())
                .messages(messages)
                .cursor(maxId(messages, 0L))
                .build();
    }

    /**
     * Messages with an id greater than {@code lastMessageId}. An empty result is valid; the status is always
     * current.
     */
    @Transactional(readOnly = true)
    public ConversationSyncResponse fetchSince(String conversationId, long lastMessageId, SyncAudience audience) {
        if (lastMessageId < 0) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "lastMessageId must not be negative");
        }
        Conversation conversation = conversationService.getConversation(conversationId);
        List<ChatMessage> messages = visible(messageService.readSince(conversationId, lastMessageId), audience);
        return ConversationSyncResponse.builder()
                .conversationId(conversationId)
                .status(conversation.getStatus())
                .assignedOperatorId(conversation.getAssignedOperatorId())
                .newMessages(messages)
                .cursor(maxId(messages, lastMessageId))
                .build();
    }

    private static List<ChatMessage> visible(List<ChatMessage> messages, SyncAudience audience) {
        if (audience == SyncAudience.OPERATOR) {
            return messages;
        }
        return messages.stream().filter(message -> !message.getType().isDraft()).toList();
    }

    private static long maxId(List<ChatMessage> messages, long floor) {
        long max = floor;
        for (ChatMessage message : messages) {
            max = Math.max(max, message.getId());
        }
        return max;
    }
}
