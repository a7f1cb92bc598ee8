package com.example.handoff.service;

import com.example.handoff.config.ChatProperties;
import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.MessageType;
import com.example.handoff.event.ChatEventPublisher;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Append-only message log. Rows are never edited; only drafts are ever deleted.
 */
@Service
@RequiredArgsConstructor
public class MessageService {

    private final MessageRepository messageRepository;
    private final ConversationService conversationService;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;
    private final Clock clock;

    /**
     * Inserts the message and advances the conversation's last activity in the same transaction.
     * A missing {@code createdAt} is stamped with the current time.
     *
     * <p>The conversation row stays locked from before the insert until commit. Appends to one conversation are
     * therefore serialized, and an id is only ever visible to readers after every smaller id of that
     * conversation is, which is what makes {@link #readSince} a gap-free cursor.
     */
    @Transactional
    public ChatMessage append(ChatMessage message) {
        validate(message);
        Conversation conversation = conversationService.lockConversation(message.getConversationId());
        if (conversation.getStatus() == ConversationStatus.RESOLVED) {
            throw new ServiceException(
                    ErrorKind.INVALID_TRANSITION, "Conversation already resolved", conversation.getStatus());
        }
        if (message.getParentMessageId() != null) {
            requireMessage(message.getConversationId(), message.getParentMessageId());
        }

        Instant createdAt = message.getCreatedAt() != null ? message.getCreatedAt() : Instant.now(clock);
        ChatMessage saved = messageRepository.insert(ChatMessage.builder()
                .conversationId(message.getConversationId())
                .type(message.getType())
                .content(message.getContent())
                .confidence(message.getConfidence())
                .authorOperatorId(message.getAuthorOperatorId())
                .parentMessageId(message.getParentMessageId())
                .inputMethod(message.getInputMethod() != null ? message.getInputMethod() : InputMethod.TEXT)
                .createdAt(createdAt)
                .build());

        if (!saved.getType().isDraft()) {
            conversationService.touchLastMessage(saved.getConversationId(), createdAt);
        }
        eventPublisher.publishMessageAppended(saved);
        return saved;
    }

    public List<ChatMessage> readAll(String conversationId) {
        return messageRepository.findAll(conversationId);
    }

    /**
     * Messages with an id strictly greater than {@code cursor}.
     */
    public List<ChatMessage> readSince(String conversationId, long cursor) {
        return messageRepository.findSince(conversationId, cursor);
    }

    /**
     * Pending recommendation drafts, newest first.
     */
    public List<ChatMessage> findDrafts(String conversationId) {
        return messageRepository.findByType(conversationId, MessageType.LLM_RECOMMENDATION);
    }

    public ChatMessage requireMessage(String conversationId, long messageId) {
        return messageRepository.findById(conversationId, messageId)
                .orElseThrow(() -> new ServiceException(ErrorKind.NOT_FOUND, "Message not found"));
    }

    public Optional<ChatMessage> findLatestHistory(String conversationId) {
        return messageRepository.findLatestHistory(conversationId);
    }

    @Transactional
    public int deleteByType(String conversationId, MessageType type) {
        return messageRepository.deleteByType(conversationId, type);
    }

    private void validate(ChatMessage message) {
        if (message == null || !StringUtils.hasText(message.getConversationId())) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "Conversation id is required");
        }
        if (message.getType() == null) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "Message type is required");
        }
        if (!StringUtils.hasText(message.getContent())) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "Message content must not be blank");
        }
        int maxLength = chatProperties.getConversation().getMaxMessageLength();
        if (message.getContent().length() > maxLength) {
            throw new ServiceException(
                    ErrorKind.INVALID_REQUEST, "Message content exceeds %d characters".formatted(maxLength));
        }
        Double confidence = message.getConfidence();
        if (confidence != null) {
            if (!message.getType().carriesConfidence()) {
                throw new ServiceException(
                        ErrorKind.INVALID_REQUEST, "%s messages do not carry a confidence".formatted(message.getType()));
            }
            if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
                throw new ServiceException(ErrorKind.INVALID_REQUEST, "Confidence must be between 0 and 1");
            }
        }
        if (message.getAuthorOperatorId() != null && !message.getType().carriesAuthor()) {
            throw new ServiceException(
                    ErrorKind.INVALID_REQUEST, "%s messages do not carry an author".formatted(message.getType()));
        }
    }
}
