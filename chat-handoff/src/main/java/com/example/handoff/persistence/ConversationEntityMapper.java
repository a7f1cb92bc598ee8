package com.example.handoff.persistence;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.QueueEntry;
import com.example.handoff.domain.ServiceMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationEntityMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ConversationEntity toEntity(Conversation conversation) {
        ConversationEntity entity = new ConversationEntity();
        entity.setId(conversation.getId());
        entity.setSessionToken(conversation.getSessionToken());
        entity.setServiceMode(conversation.getServiceMode());
        entity.setStatus(conversation.getStatus());
        entity.setPriority(conversation.getPriority());
        entity.setAssignedOperatorId(conversation.getAssignedOperatorId());
        entity.setUserAgent(conversation.getUserAgent());
        entity.setIpAddress(conversation.getIpAddress());
        entity.setAttributes(writeJson(conversation.getAttributes()));
        entity.setCreatedAt(conversation.getCreatedAt());
        entity.setUpdatedAt(conversation.getUpdatedAt());
        entity.setLastMessageAt(conversation.getLastMessageAt());
        entity.setResolvedAt(conversation.getResolvedAt());
        entity.setVersion(conversation.getVersion());
        return entity;
    }

    public Conversation toConversation(ConversationEntity entity) {
        if (entity == null) {
            return null;
        }
        return Conversation.builder()
                .id(entity.getId())
                .sessionToken(entity.getSessionToken())
                .serviceMode(entity.getServiceMode() != null ? entity.getServiceMode() : ServiceMode.FULL_LLM_BOT)
                .status(entity.getStatus())
                .priority(entity.getPriority() != null ? entity.getPriority() : ConversationPriority.NORMAL)
                .assignedOperatorId(entity.getAssignedOperatorId())
                .userAgent(entity.getUserAgent())
                .ipAddress(entity.getIpAddress())
                .attributes(readMap(entity.getAttributes()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .lastMessageAt(entity.getLastMessageAt())
                .resolvedAt(entity.getResolvedAt())
                .version(entity.getVersion())
                .build();
    }

    public MessageEntity toEntity(ChatMessage message) {
        MessageEntity entity = new MessageEntity();
        entity.setConversationId(message.getConversationId());
        entity.setType(message.getType());
        entity.setContent(message.getContent());
        entity.setConfidence(message.getConfidence());
        entity.setAuthorOperatorId(message.getAuthorOperatorId());
        entity.setParentMessageId(message.getParentMessageId());
        entity.setInputMethod(message.getInputMethod());
        entity.setCreatedAt(message.getCreatedAt());
        return entity;
    }

    public ChatMessage toMessage(MessageEntity entity) {
        return ChatMessage.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .type(entity.getType())
                .content(entity.getContent())
                .confidence(entity.getConfidence())
                .authorOperatorId(entity.getAuthorOperatorId())
                .parentMessageId(entity.getParentMessageId())
                .inputMethod(entity.getInputMethod() != null ? entity.getInputMethod() : InputMethod.TEXT)
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public QueueEntryEntity toEntity(QueueEntry entry) {
        QueueEntryEntity entity = new QueueEntryEntity();
        entity.setConversationId(entry.getConversationId());
        entity.setPriority(entry.getPriority());
        entity.setPriorityWeight(entry.getPriority().getWeight());
        entity.setStatus(entry.getStatus());
        entity.setAssignedOperatorId(entry.getAssignedOperatorId());
        entity.setQueuedAt(entry.getQueuedAt());
        entity.setClaimedAt(entry.getClaimedAt());
        entity.setResolvedAt(entry.getResolvedAt());
        return entity;
    }

    public QueueEntry toQueueEntry(QueueEntryEntity entity) {
        return QueueEntry.builder()
                .conversationId(entity.getConversationId())
                .priority(entity.getPriority())
                .status(entity.getStatus())
                .assignedOperatorId(entity.getAssignedOperatorId())
                .queuedAt(entity.getQueuedAt())
                .claimedAt(entity.getClaimedAt())
                .resolvedAt(entity.getResolvedAt())
                .build();
    }

    private String writeJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize conversation attributes", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable conversation attributes: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
