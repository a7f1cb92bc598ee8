package com.example.handoff.persistence;

import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.service.ConversationRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.Predicate;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaConversationRepository implements ConversationRepository {

    private static final Comparator<Conversation> NEWEST_ACTIVITY_FIRST = Comparator
            .comparing(JpaConversationRepository::lastActivity, Comparator.reverseOrder())
            .thenComparing(Conversation::getId);

    private final ConversationJpaRepository conversationJpaRepository;
    private final ConversationEntityMapper mapper;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public void saveConversation(Conversation conversation) {
        ConversationEntity entity = conversationJpaRepository.saveAndFlush(mapper.toEntity(conversation));
        conversation.setVersion(entity.getVersion());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> getConversation(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return conversationJpaRepository.findById(conversationId).map(mapper::toConversation);
    }

    @Override
    @Transactional
    public Optional<Conversation> lockConversation(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return conversationJpaRepository.lockById(conversationId).map(mapper::toConversation);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findOpenForSession(String sessionToken) {
        if (!StringUtils.hasText(sessionToken)) {
            return Optional.empty();
        }
        return conversationJpaRepository
                .findFirstBySessionTokenAndStatusNotOrderByCreatedAtDesc(sessionToken, ConversationStatus.RESOLVED)
                .map(mapper::toConversation);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Conversation> findByStatuses(Set<ConversationStatus> statuses) {
        List<ConversationEntity> entities = CollectionUtils.isEmpty(statuses)
                ? conversationJpaRepository.findAll()
                : conversationJpaRepository.findByStatusIn(statuses);
        return entities.stream()
                .map(mapper::toConversation)
                .sorted(NEWEST_ACTIVITY_FIRST)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Conversation> findIdle(Instant cutoff) {
        if (cutoff == null) {
            return Collections.emptyList();
        }

        var cb = entityManager.getCriteriaBuilder();
        var cq = cb.createQuery(ConversationEntity.class);
        var root = cq.from(ConversationEntity.class);

        Predicate active = cb.equal(root.get("status"), ConversationStatus.ACTIVE);
        Predicate idle = cb.lessThan(
                cb.<Instant>coalesce(root.get("lastMessageAt"), root.get("createdAt")), cutoff);
        cq.where(cb.and(active, idle));
        cq.orderBy(cb.asc(root.get("createdAt")));

        TypedQuery<ConversationEntity> query = entityManager.createQuery(cq);
        return query.getResultList().stream().map(mapper::toConversation).toList();
    }

    @Override
    @Transactional
    public boolean compareAndSetStatus(String conversationId, ConversationStatus expected, StatusChange change) {
        return conversationJpaRepository.compareAndSetStatus(
                conversationId,
                expected,
                change.target(),
                change.assignedOperatorId(),
                change.priority(),
                change.resolvedAt(),
                change.at()) == 1;
    }

    @Override
    @Transactional
    public boolean claim(String conversationId, String operatorId, Instant at) {
        return conversationJpaRepository.claim(
                conversationId, operatorId, ConversationStatus.WAITING, ConversationStatus.IN_PROGRESS, at) == 1;
    }

    @Override
    @Transactional
    public boolean resolve(String conversationId, Instant at) {
        return conversationJpaRepository.resolve(conversationId, ConversationStatus.RESOLVED, at) == 1;
    }

    @Override
    @Transactional
    public boolean touchLastMessage(String conversationId, Instant at, Instant now) {
        return conversationJpaRepository.touchLastMessage(conversationId, at, now) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(ConversationStatus status) {
        return conversationJpaRepository.countByStatus(status);
    }

    @Override
    @Transactional(readOnly = true)
    public long countResolvedSince(Instant since) {
        return conversationJpaRepository.countByStatusAndResolvedAtGreaterThanEqual(ConversationStatus.RESOLVED, since);
    }

    @Override
    @Transactional(readOnly = true)
    public long countAssigned(String operatorId) {
        return conversationJpaRepository.countByAssignedOperatorIdAndStatus(operatorId, ConversationStatus.IN_PROGRESS);
    }

    private static Instant lastActivity(Conversation conversation) {
        return conversation.getLastMessageAt() != null ? conversation.getLastMessageAt() : conversation.getCreatedAt();
    }
}
