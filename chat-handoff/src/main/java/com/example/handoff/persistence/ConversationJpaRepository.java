package com.example.handoff.persistence;

import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findFirstBySessionTokenAndStatusNotOrderByCreatedAtDesc(
            String sessionToken, ConversationStatus status);

    List<ConversationEntity> findByStatusIn(Collection<ConversationStatus> statuses);

    long countByStatus(ConversationStatus status);

    long countByStatusAndResolvedAtGreaterThanEqual(ConversationStatus status, Instant since);

    long countByAssignedOperatorIdAndStatus(String assignedOperatorId, ConversationStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ConversationEntity c where c.id = :id")
    Optional<ConversationEntity> lockById(@Param("id") String id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c "
                    + "set c.status = :target, c.assignedOperatorId = :assignee, c.priority = :priority, "
                    + "c.resolvedAt = :resolvedAt, c.updatedAt = :now, c.version = c.version + 1 "
                    + "where c.id = :id and c.status = :expected")
    int compareAndSetStatus(
            @Param("id") String id,
            @Param("expected") ConversationStatus expected,
            @Param("target") ConversationStatus target,
            @Param("assignee") String assignee,
            @Param("priority") ConversationPriority priority,
            @Param("resolvedAt") Instant resolvedAt,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c "
                    + "set c.status = :inProgress, c.assignedOperatorId = :operatorId, "
                    + "c.updatedAt = :now, c.version = c.version + 1 "
                    + "where c.id = :id and c.status = :waiting and c.assignedOperatorId is null")
    int claim(
            @Param("id") String id,
            @Param("operatorId") String operatorId,
            @Param("waiting") ConversationStatus waiting,
            @Param("inProgress") ConversationStatus inProgress,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c "
                    + "set c.status = :resolved, c.assignedOperatorId = null, c.resolvedAt = :now, "
                    + "c.updatedAt = :now, c.version = c.version + 1 "
                    + "where c.id = :id and c.status <> :resolved")
    int resolve(
            @Param("id") String id,
            @Param("resolved") ConversationStatus resolved,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c "
                    + "set c.lastMessageAt = :at, c.updatedAt = :now "
                    + "where c.id = :id and (c.lastMessageAt is null or c.lastMessageAt < :at)")
    int touchLastMessage(@Param("id") String id, @Param("at") Instant at, @Param("now") Instant now);
}
