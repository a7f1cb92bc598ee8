package com.example.handoff.persistence;

import com.example.handoff.domain.ConversationStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface QueueEntryJpaRepository extends JpaRepository<QueueEntryEntity, String> {

    List<QueueEntryEntity> findByStatusOrderByPriorityWeightDescQueuedAtAscConversationIdAsc(
            ConversationStatus status);

    List<QueueEntryEntity> findByStatusInOrderByPriorityWeightDescQueuedAtAscConversationIdAsc(
            Collection<ConversationStatus> statuses);

    List<QueueEntryEntity> findByQueuedAtGreaterThanEqual(Instant since);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update QueueEntryEntity q "
                    + "set q.status = :inProgress, q.assignedOperatorId = :operatorId, q.claimedAt = :now "
                    + "where q.conversationId = :conversationId and q.status = :waiting")
    int markClaimed(
            @Param("conversationId") String conversationId,
            @Param("operatorId") String operatorId,
            @Param("waiting") ConversationStatus waiting,
            @Param("inProgress") ConversationStatus inProgress,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update QueueEntryEntity q "
                    + "set q.status = :resolved, q.assignedOperatorId = null, q.resolvedAt = :now "
                    + "where q.conversationId = :conversationId and q.status <> :resolved")
    int markResolved(
            @Param("conversationId") String conversationId,
            @Param("resolved") ConversationStatus resolved,
            @Param("now") Instant now);
}
