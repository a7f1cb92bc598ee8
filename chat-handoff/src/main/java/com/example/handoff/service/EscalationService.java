package com.example.handoff.service;

import com.example.handoff.config.ChatProperties;
import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.MessageType;
import com.example.handoff.domain.OperatorContext;
import com.example.handoff.domain.ServiceMode;
import com.example.handoff.event.ChatEventPublisher;
import com.example.handoff.event.ChatEventType;
import com.example.handoff.recommendation.Recommendation;
import com.example.handoff.recommendation.RecommendationGenerator;
import com.example.handoff.recommendation.RecommendationRequest;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Bot to human handoff: escalation, recommendation drafts and the operator side of a conversation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationService {

    private static final Set<MessageType> PARTICIPANT_TYPES =
            EnumSet.of(MessageType.USER, MessageType.ASSISTANT, MessageType.SYSTEM);

    private static final Set<MessageType> TRANSCRIPT_TYPES =
            EnumSet.of(MessageType.USER, MessageType.ASSISTANT, MessageType.ADMIN, MessageType.SYSTEM);

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final OperatorQueueService queueService;
    private final RecommendationGenerator recommendationGenerator;
    private final ChatEventPublisher eventPublisher;
    private final ChatProperties chatProperties;
    private final Clock clock;

    public Conversation escalate(String conversationId, ConversationPriority priority) {
        return queueService.enqueue(conversationId, priority);
    }

    /**
     * Records a customer turn for the session's open conversation, starting one when none is open, then applies
     * the service mode: escalation to the queue and, with operator validation, a drafted reply.
     */
    public InboundResult handleInboundMessage(InboundMessage inbound) {
        if (inbound == null || !StringUtils.hasText(inbound.getSessionToken())) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "Session token is required");
        }
        Conversation conversation = conversationService.findOpenForSession(inbound.getSessionToken())
                .orElseGet(() -> startConversation(inbound));

        ChatMessage message;
        try {
            message = messageService.append(userTurn(conversation.getId(), inbound));
        } catch (ServiceException ex) {
            if (ex.getKind() != ErrorKind.INVALID_TRANSITION || ex.getCurrentStatus() != ConversationStatus.RESOLVED) {
                throw ex;
            }
            log.debug("Conversation {} resolved concurrently, starting a new one", conversation.getId());
            conversation = startConversation(inbound);
            message = messageService.append(userTurn(conversation.getId(), inbound));
        }

        ServiceMode mode = inbound.getServiceMode() != null ? inbound.getServiceMode() : conversation.getServiceMode();
        if (mode.escalatesInbound() && conversation.getStatus() == ConversationStatus.ACTIVE) {
            try {
                queueService.enqueue(conversation.getId(), ConversationPriority.NORMAL);
            } catch (ServiceException ex) {
                if (ex.getKind() != ErrorKind.ALREADY_QUEUED) {
                    throw ex;
                }
                log.debug("Conversation {} was queued concurrently", conversation.getId());
            }
        }

        ChatMessage recommendation = null;
        if (mode.draftsRecommendations()) {
            recommendation = generateRecommendation(conversation.getId(), message.getId()).orElse(null);
        }
        return new InboundResult(conversationService.getConversation(conversation.getId()), message, recommendation);
    }

    /**
     * Appends a customer, assistant or system turn.
     */
    public ChatMessage appendParticipantMessage(ChatMessage message) {
        if (message.getType() == null || !PARTICIPANT_TYPES.contains(message.getType())) {
            throw new ServiceException(
                    ErrorKind.INVALID_REQUEST, "Only USER, ASSISTANT or SYSTEM messages can be posted here");
        }
        return messageService.append(message);
    }

    @Transactional
    public ChatMessage proposeRecommendation(
            String conversationId, long parentMessageId, String content, Double confidence) {
        conversationService.getConversation(conversationId);
        messageService.requireMessage(conversationId, parentMessageId);
        ChatMessage draft = messageService.append(ChatMessage.builder()
                .conversationId(conversationId)
                .type(MessageType.LLM_RECOMMENDATION)
                .content(content)
                .confidence(confidence)
                .parentMessageId(parentMessageId)
                .inputMethod(InputMethod.LLM_GENERATED)
                .build());
        eventPublisher.publishConversationEvent(
                ChatEventType.RECOMMENDATION_PROPOSED,
                conversationId,
                null,
                null,
                Map.of("messageId", draft.getId(), "parentMessageId", parentMessageId));
        return draft;
    }

    /**
     * Drafts a reply to {@code parentMessageId}. Generator failures are logged and produce no draft.
     */
    public Optional<ChatMessage> generateRecommendation(String conversationId, long parentMessageId) {
        Conversation conversation = conversationService.getConversation(conversationId);
        ChatMessage parent = messageService.requireMessage(conversationId, parentMessageId);
        try {
            Optional<Recommendation> generated = recommendationGenerator.generate(
                    new RecommendationRequest(conversationId, conversation.getSessionToken(), parent.getContent()));
            if (generated.isEmpty() || !StringUtils.hasText(generated.get().content())) {
                return Optional.empty();
            }
            return Optional.of(proposeRecommendation(
                    conversationId, parentMessageId, generated.get().content(), generated.get().confidence()));
        } catch (RuntimeException ex) {
            log.warn("Recommendation generation failed for conversation {}: {}", conversationId, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    /**
     * Publishes the newest draft, or {@code editedContent} in its place, as an operator reply and drops every
     * pending draft. The conversation is resolved unless {@code keepOpen}.
     */
    @Transactional
    public ApprovalResult approveRecommendation(
            String conversationId, OperatorContext operator, String editedContent, boolean keepOpen) {
        Conversation conversation = conversationService.getConversation(conversationId);
        if (conversation.getStatus() == ConversationStatus.RESOLVED) {
            throw new ServiceException(
                    ErrorKind.INVALID_TRANSITION, "Conversation already resolved", conversation.getStatus());
        }
        requireHandler(conversation, operator);

        List<ChatMessage> drafts = messageService.findDrafts(conversationId);
        if (drafts.isEmpty()) {
            throw new ServiceException(ErrorKind.NOT_FOUND, "No pending recommendation");
        }
        ChatMessage newest = drafts.get(0);
        boolean edited = StringUtils.hasText(editedContent);

        ChatMessage reply = messageService.append(ChatMessage.builder()
                .conversationId(conversationId)
                .type(MessageType.ADMIN)
                .content(edited ? editedContent : newest.getContent())
                .authorOperatorId(operator.operatorId())
                .parentMessageId(newest.getParentMessageId())
                .inputMethod(InputMethod.TEXT)
                .build());
        int discarded = messageService.deleteByType(conversationId, MessageType.LLM_RECOMMENDATION);

        eventPublisher.publishConversationEvent(
                ChatEventType.RECOMMENDATION_APPROVED,
                conversationId,
                null,
                operator.operatorId(),
                Map.of("messageId", reply.getId(), "edited", edited, "discarded", discarded));

        Conversation after = keepOpen
                ? conversationService.getConversation(conversationId)
                : queueService.resolve(conversationId);
        return new ApprovalResult(after, reply, discarded);
    }

    @Transactional
    public int discardRecommendations(String conversationId, OperatorContext operator) {
        Conversation conversation = conversationService.getConversation(conversationId);
        requireHandler(conversation, operator);
        int discarded = messageService.deleteByType(conversationId, MessageType.LLM_RECOMMENDATION);
        if (discarded > 0) {
            eventPublisher.publishConversationEvent(
                    ChatEventType.RECOMMENDATION_DISCARDED,
                    conversationId,
                    null,
                    operator.operatorId(),
                    Map.of("discarded", discarded));
        }
        return discarded;
    }

    /**
     * Operator reply. Never changes the conversation status.
     */
    @Transactional
    public ChatMessage appendOperatorMessage(String conversationId, OperatorContext operator, String content) {
        Conversation conversation = conversationService.getConversation(conversationId);
        requireHandler(conversation, operator);
        return messageService.append(ChatMessage.builder()
                .conversationId(conversationId)
                .type(MessageType.ADMIN)
                .content(content)
                .authorOperatorId(operator.operatorId())
                .inputMethod(InputMethod.TEXT)
                .build());
    }

    public Conversation closeConversation(String conversationId) {
        return queueService.resolve(conversationId);
    }

    /**
     * Resolves every active conversation idle for longer than the configured inactivity timeout.
     *
     * @return ids of the conversations this call resolved
     */
    public List<String> closeIdleConversations() {
        Instant cutoff = Instant.now(clock).minus(chatProperties.getConversation().getInactivityTimeout());
        List<String> closed = new ArrayList<>();
        for (Conversation idle : conversationService.findIdle(cutoff)) {
            Conversation resolved = queueService.resolve(idle.getId());
            if (resolved.getStatus() == ConversationStatus.RESOLVED) {
                closed.add(idle.getId());
            }
        }
        if (!closed.isEmpty()) {
            log.info("Closed {} idle conversations", closed.size());
        }
        return closed;
    }

    /**
     * Stores a complete bot-served exchange as a new active conversation.
     */
    @Transactional
    public Conversation importTranscript(TranscriptImport transcript) {
        if (transcript == null || transcript.getTurns().isEmpty()) {
            throw new ServiceException(ErrorKind.INVALID_REQUEST, "Transcript must contain at least one message");
        }
        for (TranscriptImport.Turn turn : transcript.getTurns()) {
            if (turn.getType() == null || !TRANSCRIPT_TYPES.contains(turn.getType())) {
                throw new ServiceException(
                        ErrorKind.INVALID_REQUEST, "Unsupported transcript message type " + turn.getType());
            }
        }

        Conversation conversation = conversationService.createConversation(NewConversation.builder()
                .sessionToken(transcript.getSessionToken())
                .serviceMode(transcript.getServiceMode())
                .userAgent(transcript.getUserAgent())
                .ipAddress(transcript.getIpAddress())
                .build());
        for (TranscriptImport.Turn turn : transcript.getTurns()) {
            messageService.append(ChatMessage.builder()
                    .conversationId(conversation.getId())
                    .type(turn.getType())
                    .content(turn.getContent())
                    .confidence(turn.getConfidence())
                    .inputMethod(turn.getInputMethod())
                    .createdAt(turn.getCreatedAt())
                    .build());
        }
        return conversationService.getConversation(conversation.getId());
    }

    private Conversation startConversation(InboundMessage inbound) {
        return conversationService.createConversation(NewConversation.builder()
                .sessionToken(inbound.getSessionToken())
                .serviceMode(inbound.getServiceMode())
                .userAgent(inbound.getUserAgent())
                .ipAddress(inbound.getIpAddress())
                .build());
    }

    private static ChatMessage userTurn(String conversationId, InboundMessage inbound) {
        return ChatMessage.builder()
                .conversationId(conversationId)
                .type(MessageType.USER)
                .content(inbound.getContent())
                .inputMethod(inbound.getInputMethod())
                .build();
    }

    private static void requireHandler(Conversation conversation, OperatorContext operator) {
        if (conversation.getStatus() == ConversationStatus.IN_PROGRESS
                && !operator.owns(conversation)
                && !operator.isSuperadmin()) {
            throw new ServiceException(ErrorKind.FORBIDDEN, "Conversation is held by another operator");
        }
    }
}
