package com.example.handoff.service;

import com.example.handoff.domain.QueueEntry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface QueueRepository {

    Optional<QueueEntry> find(String conversationId);

    void save(QueueEntry entry);

    /**
     * WAITING entries by priority weight desc, queued time asc, conversation id asc.
     */
    List<QueueEntry> findWaiting();

    /**
     * WAITING and IN_PROGRESS entries in queue order.
     */
    List<QueueEntry> findOpen();

    List<QueueEntry> findQueuedSince(Instant since);

    boolean markClaimed(String conversationId, String operatorId, Instant at);

    boolean markResolved(String conversationId, Instant at);
}
