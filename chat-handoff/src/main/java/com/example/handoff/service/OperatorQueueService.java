package com.example.handoff.service;

import com.example.handoff.config.ChatProperties;
import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.OperatorContext;
import com.example.handoff.domain.QueueEntry;
import com.example.handoff.domain.QueueStats;
import com.example.handoff.dto.QueueOverviewItem;
import com.example.handoff.event.ChatEventPublisher;
import com.example.handoff.event.ChatEventType;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Operator queue over the conversation registry. A conversation is held by at most one operator; the claim is a
 * single conditional update on the conversation row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperatorQueueService {

    private static final int PREVIEW_LENGTH = 140;

    private final ConversationService conversationService;
    private final ConversationRepository conversationRepository;
    private final QueueRepository queueRepository;
    private final MessageRepository messageRepository;
    private final QueueStatsCache statsCache;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public enum ClaimStatus {
        CLAIMED,
        OWNED
    }

    public record ClaimResult(ClaimStatus status, Conversation conversation) {
    }

    @Transactional
    public Conversation enqueue(String conversationId, ConversationPriority priority) {
        Conversation conversation = conversationService.getConversation(conversationId);
        boolean entryOpen = queueRepository.find(conversationId)
                .filter(entry -> entry.getStatus() != ConversationStatus.RESOLVED)
                .isPresent();
        if (entryOpen || conversation.getStatus().isQueued()) {
            throw new ServiceException(
                    ErrorKind.ALREADY_QUEUED, "Conversation is already queued", conversation.getStatus());
        }

        ConversationPriority effective = priority != null ? priority : conversation.getPriority();
        Conversation waiting;
        try {
            waiting = conversationService.setStatus(conversationId, ConversationStatus.WAITING, null, effective);
        } catch (ServiceException ex) {
            if (ex.getKind() == ErrorKind.INVALID_TRANSITION
                    && ex.getCurrentStatus() != null
                    && ex.getCurrentStatus().isQueued()) {
                throw new ServiceException(
                        ErrorKind.ALREADY_QUEUED, "Conversation is already queued", ex.getCurrentStatus(), ex);
            }
            throw ex;
        }

        queueRepository.save(QueueEntry.builder()
                .conversationId(conversationId)
                .priority(effective)
                .status(ConversationStatus.WAITING)
                .queuedAt(Instant.now(clock))
                .build());

        eventPublisher.publishConversationEvent(
                ChatEventType.CONVERSATION_ESCALATED,
                conversationId,
                ConversationStatus.WAITING,
                null,
                Map.of("priority", effective.name()));
        log.info("Conversation {} queued with priority {}", conversationId, effective);
        return waiting;
    }

    public Conversation claim(String conversationId, OperatorContext operator) {
        return claimForOperator(conversationId, operator).conversation();
    }

    /**
     * Claims a waiting conversation for {@code operator}. Re-claiming a conversation the operator already holds
     * returns {@link ClaimStatus#OWNED}.
     */
    public ClaimResult claimForOperator(String conversationId, OperatorContext operator) {
        if (!StringUtils.hasText(conversationId)) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "Conversation id is required");
        }
        ensureCapacity(operator);

        boolean claimed;
        try {
            claimed = Boolean.TRUE.equals(transactionTemplate.execute(tx -> {
                Instant now = Instant.now(clock);
                if (!conversationRepository.claim(conversationId, operator.operatorId(), now)) {
                    return false;
                }
                queueRepository.markClaimed(conversationId, operator.operatorId(), now);
                eventPublisher.publishConversationEvent(
                        ChatEventType.CONVERSATION_CLAIMED,
                        conversationId,
                        ConversationStatus.IN_PROGRESS,
                        operator.operatorId(),
                        Map.of());
                return true;
            }));
        } catch (ConcurrencyFailureException ex) {
            log.debug("Lock conflict while claiming {} for {}", conversationId, operator.operatorId());
            throw new ServiceException(
                    ErrorKind.ALREADY_CLAIMED, "Conversation no longer available", ConversationStatus.IN_PROGRESS, ex);
        } catch (DataAccessException ex) {
            Conversation current = conversationService.getConversation(conversationId);
            if (current.getStatus() != ConversationStatus.WAITING) {
                throw new ServiceException(
                        ErrorKind.ALREADY_CLAIMED, "Conversation no longer available", current.getStatus(), ex);
            }
            throw ex;
        }

        Conversation current = conversationService.getConversation(conversationId);
        if (claimed) {
            log.info("Conversation {} claimed by {}", conversationId, operator.operatorId());
            return new ClaimResult(ClaimStatus.CLAIMED, current);
        }
        if (current.getStatus() == ConversationStatus.IN_PROGRESS) {
            if (operator.owns(current)) {
                return new ClaimResult(ClaimStatus.OWNED, current);
            }
            throw new ServiceException(
                    ErrorKind.ALREADY_CLAIMED, "Conversation no longer available", current.getStatus());
        }
        throw new ServiceException(
                ErrorKind.INVALID_TRANSITION, "Conversation is not waiting for an operator", current.getStatus());
    }

    /**
     * Claims the first conversation in queue order that this operator wins.
     */
    public Optional<Conversation> claimNext(OperatorContext operator) {
        ensureCapacity(operator);
        for (QueueEntry entry : waitingEntries()) {
            try {
                ClaimResult result = claimForOperator(entry.getConversationId(), operator);
                if (result.status() == ClaimStatus.CLAIMED) {
                    return Optional.of(result.conversation());
                }
            } catch (ServiceException ex) {
                if (ex.getKind() == ErrorKind.OPERATOR_AT_CAPACITY) {
                    throw ex;
                }
                log.debug("Skipping {} for {}: {}", entry.getConversationId(), operator.operatorId(), ex.getKind());
            }
        }
        return Optional.empty();
    }

    /**
     * Hands a claimed conversation back to the queue. Its wait starts over.
     */
    @Transactional
    public Conversation release(String conversationId, OperatorContext operator) {
        Conversation conversation = conversationService.getConversation(conversationId);
        if (conversation.getStatus() != ConversationStatus.IN_PROGRESS) {
            throw new ServiceException(
                    ErrorKind.INVALID_TRANSITION, "Only a claimed conversation can be released", conversation.getStatus());
        }
        if (!operator.owns(conversation) && !operator.isSuperadmin()) {
            throw new ServiceException(ErrorKind.FORBIDDEN, "Conversation is held by another operator");
        }

        Conversation waiting = conversationService.setStatus(conversationId, ConversationStatus.WAITING);
        queueRepository.save(QueueEntry.builder()
                .conversationId(conversationId)
                .priority(waiting.getPriority())
                .status(ConversationStatus.WAITING)
                .queuedAt(Instant.now(clock))
                .build());

        eventPublisher.publishConversationEvent(
                ChatEventType.CONVERSATION_RELEASED,
                conversationId,
                ConversationStatus.WAITING,
                operator.operatorId(),
                Map.of("previousOperatorId", conversation.getAssignedOperatorId()));
        return waiting;
    }

    /**
     * Resolves from any state. Resolving a resolved conversation returns it unchanged.
     */
    @Transactional
    public Conversation resolve(String conversationId) {
        Conversation conversation = conversationService.getConversation(conversationId);
        if (conversation.getStatus() == ConversationStatus.RESOLVED) {
            return conversation;
        }

        Instant now = Instant.now(clock);
        if (conversationRepository.resolve(conversationId, now)) {
            queueRepository.markResolved(conversationId, now);
            eventPublisher.publishConversationEvent(
                    ChatEventType.CONVERSATION_RESOLVED,
                    conversationId,
                    ConversationStatus.RESOLVED,
                    null,
                    Map.of("previousStatus", conversation.getStatus().name()));
            log.info("Conversation {} resolved from {}", conversationId, conversation.getStatus());
        }
        return conversationService.getConversation(conversationId);
    }

    /**
     * WAITING conversations in claim order: priority weight, then time queued.
     */
    public List<Conversation> listWaiting() {
        Map<String, Conversation> waiting = conversationService
                .listConversations(EnumSet.of(ConversationStatus.WAITING))
                .stream()
                .collect(Collectors.toMap(Conversation::getId, Function.identity()));
        return waitingEntries().stream()
                .map(entry -> waiting.get(entry.getConversationId()))
                .filter(conversation -> conversation != null)
                .toList();
    }

    List<QueueEntry> waitingEntries() {
        return queueRepository.findWaiting();
    }

    public QueueStats listStats() {
        Duration ttl = chatProperties.getQueue().getStatsTtl();
        boolean cacheable = ttl != null && !ttl.isZero() && !ttl.isNegative();
        if (cacheable) {
            Optional<QueueStats> cached = statsCache.get();
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        QueueStats stats = computeStats();
        if (cacheable) {
            statsCache.put(stats, ttl);
        }
        return stats;
    }

    /**
     * Waiting and in-progress conversations in queue order, with the details an operator needs to pick one.
     */
    @Transactional(readOnly = true)
    public List<QueueOverviewItem> overview() {
        List<QueueEntry> entries = queueRepository.findOpen();
        if (entries.isEmpty()) {
            return List.of();
        }
        Map<String, Conversation> conversations = conversationService
                .listConversations(EnumSet.of(ConversationStatus.WAITING, ConversationStatus.IN_PROGRESS)).stream()
                .collect(Collectors.toMap(Conversation::getId, Function.identity()));
        Map<String, Long> counts = messageRepository.countHistory(
                entries.stream().map(QueueEntry::getConversationId).toList());
        Instant now = Instant.now(clock);

        List<QueueOverviewItem> items = new ArrayList<>(entries.size());
        for (QueueEntry entry : entries) {
            Conversation conversation = conversations.get(entry.getConversationId());
            if (conversation == null) {
                continue;
            }
            Optional<ChatMessage> last = messageRepository.findLatestHistory(entry.getConversationId());
            Instant waitEnd = entry.getClaimedAt() != null ? entry.getClaimedAt() : now;
            items.add(QueueOverviewItem.builder()
                    .conversationId(conversation.getId())
                    .displayName(displayName(conversation.getSessionToken()))
                    .status(conversation.getStatus())
                    .priority(conversation.getPriority())
                    .serviceMode(conversation.getServiceMode())
                    .assignedOperatorId(conversation.getAssignedOperatorId())
                    .queuedAt(entry.getQueuedAt())
                    .waitMinutes(Math.max(0, Duration.between(entry.getQueuedAt(), waitEnd).toMinutes()))
                    .messageCount(counts.getOrDefault(conversation.getId(), 0L))
                    .lastMessage(last.map(message -> preview(message.getContent())).orElse(null))
                    .lastMessageAt(conversation.getLastMessageAt())
                    .build());
        }
        return items;
    }

    private QueueStats computeStats() {
        Instant now = Instant.now(clock);
        ZoneId zone = chatProperties.getQueue().getStatsZone();
        Instant startOfDay = LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();

        long active = conversationRepository.countByStatus(ConversationStatus.ACTIVE);
        long waiting = conversationRepository.countByStatus(ConversationStatus.WAITING);
        long inProgress = conversationRepository.countByStatus(ConversationStatus.IN_PROGRESS);
        long resolved = conversationRepository.countByStatus(ConversationStatus.RESOLVED);

        List<QueueEntry> recent = queueRepository.findQueuedSince(now.minus(chatProperties.getQueue().getStatsWindow()));

        return QueueStats.builder()
                .totalConversations(active + waiting + inProgress + resolved)
                .active(active)
                .waiting(waiting)
                .inProgress(inProgress)
                .openTotal(waiting + inProgress)
                .resolvedToday(conversationRepository.countResolvedSince(startOfDay))
                .averageResponseSeconds(averageSeconds(recent, QueueEntry::getClaimedAt))
                .averageResolutionSeconds(averageSeconds(recent, QueueEntry::getResolvedAt))
                .computedAt(now)
                .build();
    }

    private static Double averageSeconds(List<QueueEntry> entries, Function<QueueEntry, Instant> end) {
        long samples = 0;
        long totalMillis = 0;
        for (QueueEntry entry : entries) {
            Instant finishedAt = end.apply(entry);
            if (finishedAt == null || entry.getQueuedAt() == null) {
                continue;
            }
            totalMillis += Duration.between(entry.getQueuedAt(), finishedAt).toMillis();
            samples++;
        }
        return samples == 0 ? null : totalMillis / 1000.0 / samples;
    }

    private void ensureCapacity(OperatorContext operator) {
        if (operator == null || !StringUtils.hasText(operator.operatorId())) {
            throw new ServiceException(ErrorKind.UNAUTHENTICATED, "Operator identity is required");
        }
        int max = chatProperties.getQueue().getMaxConcurrentByOperator();
        if (max > 0 && conversationRepository.countAssigned(operator.operatorId()) >= max) {
            throw new ServiceException(
                    ErrorKind.OPERATOR_AT_CAPACITY, "Operator reached maximum concurrent conversations");
        }
    }

    static String displayName(String sessionToken) {
        if (!StringUtils.hasText(sessionToken)) {
            return "User";
        }
        int start = Math.max(0, sessionToken.length() - 8);
        return "User-" + sessionToken.substring(start);
    }

    private static String preview(String content) {
        if (content == null || content.length() <= PREVIEW_LENGTH) {
            return content;
        }
        return content.substring(0, PREVIEW_LENGTH) + "...";
    }
}
