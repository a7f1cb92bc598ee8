package com.example.handoff.service;

import com.example.handoff.config.ChatProperties;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.ServiceMode;
import com.example.handoff.event.ChatEventPublisher;
import com.example.handoff.event.ChatEventType;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Conversation registry. Owns the status column and applies every transition as a compare-and-set on it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationRepository conversationRepository;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;
    private final Clock clock;

    @Transactional
    public Conversation createConversation(NewConversation request) {
        if (request == null || !StringUtils.hasText(request.getSessionToken())) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "Session token is required");
        }
        Instant now = Instant.now(clock);

        if (request.isExclusiveSession()) {
            Instant windowStart = now.minus(chatProperties.getConversation().getSessionWindow());
            conversationRepository.findOpenForSession(request.getSessionToken())
                    .filter(open -> lastActivity(open).isAfter(windowStart))
                    .ifPresent(open -> {
                        throw new ServiceException(
                                ErrorKind.DUPLICATE_SESSION,
                                "Session already has an open conversation",
                                open.getStatus());
                    });
        }

        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .sessionToken(request.getSessionToken())
                .serviceMode(request.getServiceMode() != null ? request.getServiceMode() : ServiceMode.FULL_LLM_BOT)
                .status(ConversationStatus.ACTIVE)
                .priority(request.getPriority() != null ? request.getPriority() : ConversationPriority.NORMAL)
                .userAgent(request.getUserAgent())
                .ipAddress(request.getIpAddress())
                .attributes(request.getAttributes() != null
                        ? new HashMap<>(request.getAttributes())
                        : Collections.emptyMap())
                .createdAt(now)
                .updatedAt(now)
                .build();
        conversationRepository.saveConversation(conversation);

        eventPublisher.publishConversationEvent(
                ChatEventType.CONVERSATION_CREATED,
                conversation.getId(),
                ConversationStatus.ACTIVE,
                null,
                Map.of("serviceMode", conversation.getServiceMode().name()));
        log.debug("Created conversation {} for session {}", conversation.getId(), conversation.getSessionToken());
        return conversation;
    }

    public Conversation getConversation(String conversationId) {
        return conversationRepository.getConversation(conversationId)
                .orElseThrow(() -> new ServiceException(ErrorKind.NOT_FOUND, "Conversation not found"));
    }

    /**
     * Same as {@link #getConversation} but keeps the row locked until the caller's transaction commits.
     * Message appends go through here so ids are handed out in commit order per conversation.
     */
    @Transactional
    public Conversation lockConversation(String conversationId) {
        return conversationRepository.lockConversation(conversationId)
                .orElseThrow(() -> new ServiceException(ErrorKind.NOT_FOUND, "Conversation not found"));
    }

    public Optional<Conversation> findOpenForSession(String sessionToken) {
        return conversationRepository.findOpenForSession(sessionToken);
    }

    public List<Conversation> listConversations(Set<ConversationStatus> statuses) {
        return conversationRepository.findByStatuses(statuses);
    }

    public List<Conversation> findIdle(Instant cutoff) {
        return conversationRepository.findIdle(cutoff);
    }

    @Transactional
    public Conversation setStatus(String conversationId, ConversationStatus target) {
        return setStatus(conversationId, target, null, null);
    }

    /**
     * Moves the conversation to {@code target} if the transition table allows it from the status observed now.
     *
     * @param assignedOperatorId required for IN_PROGRESS, ignored otherwise
     * @param priority new priority, or {@code null} to keep the current one
     */
    @Transactional
    public Conversation setStatus(
            String conversationId,
            ConversationStatus target,
            String assignedOperatorId,
            ConversationPriority priority) {
        Conversation current = getConversation(conversationId);
        ConversationStatus observed = current.getStatus();
        if (observed == ConversationStatus.RESOLVED && target == ConversationStatus.RESOLVED) {
            return current;
        }
        if (!observed.canTransitionTo(target)) {
            throw new ServiceException(
                    ErrorKind.INVALID_TRANSITION,
                    "Cannot move conversation from %s to %s".formatted(observed, target),
                    observed);
        }
        if (target == ConversationStatus.IN_PROGRESS && !StringUtils.hasText(assignedOperatorId)) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "An operator is required to start handling");
        }

        Instant now = Instant.now(clock);
        ConversationRepository.StatusChange change = new ConversationRepository.StatusChange(
                target,
                target == ConversationStatus.IN_PROGRESS ? assignedOperatorId : null,
                priority != null ? priority : current.getPriority(),
                target == ConversationStatus.RESOLVED ? now : null,
                now);
        if (!conversationRepository.compareAndSetStatus(conversationId, observed, change)) {
            ConversationStatus latest = getConversation(conversationId).getStatus();
            throw new ServiceException(
                    ErrorKind.INVALID_TRANSITION,
                    "Conversation changed concurrently, now %s".formatted(latest),
                    latest);
        }
        return getConversation(conversationId);
    }

    /**
     * Advances {@code lastMessageAt}. An instant older than the stored one leaves it unchanged.
     */
    @Transactional
    public void touchLastMessage(String conversationId, Instant at) {
        if (!conversationRepository.touchLastMessage(conversationId, at, Instant.now(clock))) {
            getConversation(conversationId);
        }
    }

    static Instant lastActivity(Conversation conversation) {
        return conversation.getLastMessageAt() != null ? conversation.getLastMessageAt() : conversation.getCreatedAt();
    }
}
