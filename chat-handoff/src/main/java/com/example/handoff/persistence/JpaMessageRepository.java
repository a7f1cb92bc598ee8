package com.example.handoff.persistence;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.MessageType;
import com.example.handoff.service.MessageRepository;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaMessageRepository implements MessageRepository {

    private final MessageJpaRepository messageJpaRepository;
    private final ConversationEntityMapper mapper;

    @Override
    @Transactional
    public ChatMessage insert(ChatMessage message) {
        MessageEntity saved = messageJpaRepository.saveAndFlush(mapper.toEntity(message));
        return mapper.toMessage(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findById(String conversationId, long messageId) {
        return messageJpaRepository.findByIdAndConversationId(messageId, conversationId).map(mapper::toMessage);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findAll(String conversationId) {
        return messageJpaRepository.findByConversationIdOrderByCreatedAtAscIdAsc(conversationId).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findSince(String conversationId, long cursor) {
        return messageJpaRepository
                .findByConversationIdAndIdGreaterThanOrderByCreatedAtAscIdAsc(conversationId, cursor).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findByType(String conversationId, MessageType type) {
        return messageJpaRepository.findByConversationIdAndTypeOrderByCreatedAtDescIdDesc(conversationId, type).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional
    public int deleteByType(String conversationId, MessageType type) {
        return messageJpaRepository.deleteByConversationIdAndType(conversationId, type);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countHistory(Collection<String> conversationIds) {
        if (conversationIds == null || conversationIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return messageJpaRepository.countByConversation(conversationIds, MessageType.LLM_RECOMMENDATION).stream()
                .collect(Collectors.toMap(MessageCount::conversationId, MessageCount::count));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findLatestHistory(String conversationId) {
        return messageJpaRepository
                .findFirstByConversationIdAndTypeNotOrderByCreatedAtDescIdDesc(conversationId, MessageType.LLM_RECOMMENDATION)
                .map(mapper::toMessage);
    }
}
