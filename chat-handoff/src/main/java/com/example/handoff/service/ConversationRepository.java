package com.example.handoff.service;

import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ConversationRepository {

    void saveConversation(Conversation conversation);

    Optional<Conversation> getConversation(String conversationId);

    /**
     * Reads the conversation and holds its row lock until the surrounding transaction ends.
     */
    Optional<Conversation> lockConversation(String conversationId);

    Optional<Conversation> findOpenForSession(String sessionToken);

    List<Conversation> findByStatuses(Set<ConversationStatus> statuses);

    List<Conversation> findIdle(Instant cutoff);

    /**
     * Applies {@code change} only while the stored status still equals {@code expected}.
     *
     * @return {@code false} when another writer moved the conversation first
     */
    boolean compareAndSetStatus(String conversationId, ConversationStatus expected, StatusChange change);

    /**
     * WAITING and unassigned to IN_PROGRESS for {@code operatorId}, as one conditional update.
     */
    boolean claim(String conversationId, String operatorId, Instant at);

    boolean resolve(String conversationId, Instant at);

    boolean touchLastMessage(String conversationId, Instant at, Instant now);

    long countByStatus(ConversationStatus status);

    long countResolvedSince(Instant since);

    long countAssigned(String operatorId);

    record StatusChange(
            ConversationStatus target,
            String assignedOperatorId,
            ConversationPriority priority,
            Instant resolvedAt,
            Instant at) {
    }
}
