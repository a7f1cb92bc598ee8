package com.example.handoff.persistence;

import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.QueueEntry;
import com.example.handoff.service.QueueRepository;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaQueueRepository implements QueueRepository {

    private final QueueEntryJpaRepository queueEntryJpaRepository;
    private final ConversationEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<QueueEntry> find(String conversationId) {
        return queueEntryJpaRepository.findById(conversationId).map(mapper::toQueueEntry);
    }

    @Override
    @Transactional
    public void save(QueueEntry entry) {
        queueEntryJpaRepository.saveAndFlush(mapper.toEntity(entry));
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueueEntry> findWaiting() {
        return queueEntryJpaRepository
                .findByStatusOrderByPriorityWeightDescQueuedAtAscConversationIdAsc(ConversationStatus.WAITING).stream()
                .map(mapper::toQueueEntry)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueueEntry> findOpen() {
        return queueEntryJpaRepository
                .findByStatusInOrderByPriorityWeightDescQueuedAtAscConversationIdAsc(
                        EnumSet.of(ConversationStatus.WAITING, ConversationStatus.IN_PROGRESS)).stream()
                .map(mapper::toQueueEntry)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueueEntry> findQueuedSince(Instant since) {
        return queueEntryJpaRepository.findByQueuedAtGreaterThanEqual(since).stream()
                .map(mapper::toQueueEntry)
                .toList();
    }

    @Override
    @Transactional
    public boolean markClaimed(String conversationId, String operatorId, Instant at) {
        return queueEntryJpaRepository.markClaimed(
                conversationId, operatorId, ConversationStatus.WAITING, ConversationStatus.IN_PROGRESS, at) == 1;
    }

    @Override
    @Transactional
    public boolean markResolved(String conversationId, Instant at) {
        return queueEntryJpaRepository.markResolved(conversationId, ConversationStatus.RESOLVED, at) == 1;
    }
}
