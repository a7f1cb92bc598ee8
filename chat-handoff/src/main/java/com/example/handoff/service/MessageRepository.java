package com.example.handoff.service;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.MessageType;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface MessageRepository {

    ChatMessage insert(ChatMessage message);

    Optional<ChatMessage> findById(String conversationId, long messageId);

    List<ChatMessage> findAll(String conversationId);

    List<ChatMessage> findSince(String conversationId, long cursor);

    /**
     * Messages of one type, newest first.
     */
    List<ChatMessage> findByType(String conversationId, MessageType type);

    int deleteByType(String conversationId, MessageType type);

    /**
     * Number of history messages per conversation. Drafts are not counted.
     */
    Map<String, Long> countHistory(Collection<String> conversationIds);

    Optional<ChatMessage> findLatestHistory(String conversationId);
}
