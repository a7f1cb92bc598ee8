package com.example.handoff.controller;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.OperatorContext;
import com.example.handoff.domain.QueueStats;
import com.example.handoff.dto.ApproveRecommendationRequest;
import com.example.handoff.dto.ConversationSyncResponse;
import com.example.handoff.dto.GenerateRecommendationRequest;
import com.example.handoff.dto.IdleSweepResponse;
import com.example.handoff.dto.OperatorMessageRequest;
import com.example.handoff.dto.QueueOverviewItem;
import com.example.handoff.service.ApprovalResult;
import com.example.handoff.service.ConversationService;
import com.example.handoff.service.ConversationSyncService;
import com.example.handoff.service.EscalationService;
import com.example.handoff.service.OperatorIdentityService;
import com.example.handoff.service.OperatorQueueService;
import com.example.handoff.service.SyncAudience;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import jakarta.validation.Valid;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/operator")
public class OperatorController {

    static final String OPERATOR_TOKEN_HEADER = "X-Operator-Token";

    private final OperatorIdentityService identityService;
    private final OperatorQueueService queueService;
    private final ConversationService conversationService;
    private final EscalationService escalationService;
    private final ConversationSyncService syncService;

    public OperatorController(
            OperatorIdentityService identityService,
            OperatorQueueService queueService,
            ConversationService conversationService,
            EscalationService escalationService,
            ConversationSyncService syncService) {
        this.identityService = identityService;
        this.queueService = queueService;
        this.conversationService = conversationService;
        this.escalationService = escalationService;
        this.syncService = syncService;
    }

    @GetMapping("/queue")
    public ResponseEntity<List<QueueOverviewItem>> queue(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token) {
        identityService.authenticate(token);
        return ResponseEntity.ok(queueService.overview());
    }

    @GetMapping("/queue/waiting")
    public ResponseEntity<List<Conversation>> waiting(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token) {
        identityService.authenticate(token);
        return ResponseEntity.ok(queueService.listWaiting());
    }

    @GetMapping("/queue/stats")
    public ResponseEntity<QueueStats> stats(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token) {
        identityService.authenticate(token);
        return ResponseEntity.ok(queueService.listStats());
    }

    @PostMapping("/queue/claim-next")
    public ResponseEntity<Conversation> claimNext(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token) {
        OperatorContext operator = identityService.authenticate(token);
        return queueService.claimNext(operator)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/conversations")
    public ResponseEntity<List<Conversation>> conversations(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @RequestParam(name = "status", required = false) List<String> statuses) {
        identityService.authenticate(token);
        return ResponseEntity.ok(conversationService.listConversations(parseStatuses(statuses)));
    }

    @PostMapping("/conversations/{conversationId}/claim")
    public ResponseEntity<Conversation> claim(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId) {
        OperatorContext operator = identityService.authenticate(token);
        return ResponseEntity.ok(queueService.claim(conversationId, operator));
    }

    @PostMapping("/conversations/{conversationId}/release")
    public ResponseEntity<Conversation> release(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId) {
        OperatorContext operator = identityService.authenticate(token);
        return ResponseEntity.ok(queueService.release(conversationId, operator));
    }

    @PostMapping("/conversations/{conversationId}/resolve")
    public ResponseEntity<Conversation> resolve(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId) {
        identityService.authenticate(token);
        return ResponseEntity.ok(queueService.resolve(conversationId));
    }

    @PostMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<ChatMessage> postMessage(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId,
            @Valid @RequestBody OperatorMessageRequest request) {
        OperatorContext operator = identityService.authenticate(token);
        return ResponseEntity.ok(escalationService.appendOperatorMessage(conversationId, operator, request.getContent()));
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<ConversationSyncResponse> getMessages(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId,
            @RequestParam(name = "lastMessageId", required = false) Long lastMessageId) {
        identityService.authenticate(token);
        ConversationSyncResponse response = lastMessageId == null
                ? syncService.fetchFull(conversationId, SyncAudience.OPERATOR)
                : syncService.fetchSince(conversationId, lastMessageId, SyncAudience.OPERATOR);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/conversations/{conversationId}/recommendations/generate")
    public ResponseEntity<ChatMessage> generateRecommendation(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId,
            @Valid @RequestBody GenerateRecommendationRequest request) {
        identityService.authenticate(token);
        return escalationService.generateRecommendation(conversationId, request.getParentMessageId())
                .map(draft -> ResponseEntity.status(HttpStatus.CREATED).body(draft))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/conversations/{conversationId}/recommendations/approve")
    public ResponseEntity<ApprovalResult> approveRecommendation(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId,
            @Valid @RequestBody(required = false) ApproveRecommendationRequest request) {
        OperatorContext operator = identityService.authenticate(token);
        ApproveRecommendationRequest approval = request != null ? request : new ApproveRecommendationRequest();
        return ResponseEntity.ok(escalationService.approveRecommendation(
                conversationId, operator, approval.getContent(), approval.isKeepOpen()));
    }

    @DeleteMapping("/conversations/{conversationId}/recommendations")
    public ResponseEntity<Map<String, Object>> discardRecommendations(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token,
            @PathVariable String conversationId) {
        OperatorContext operator = identityService.authenticate(token);
        int discarded = escalationService.discardRecommendations(conversationId, operator);
        return ResponseEntity.ok(Map.of("conversationId", conversationId, "discarded", discarded));
    }

    @PostMapping("/housekeeping/close-idle")
    public ResponseEntity<IdleSweepResponse> closeIdle(
            @RequestHeader(name = OPERATOR_TOKEN_HEADER, required = false) String token) {
        identityService.authenticate(token);
        List<String> closed = escalationService.closeIdleConversations();
        return ResponseEntity.ok(new IdleSweepResponse(closed.size(), closed));
    }

    private Set<ConversationStatus> parseStatuses(List<String> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Set.of();
        }
        Set<ConversationStatus> parsed = EnumSet.noneOf(ConversationStatus.class);
        for (String status : statuses) {
            if (!StringUtils.hasText(status)) {
                continue;
            }
            try {
                parsed.add(ConversationStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                throw new ServiceException(ErrorKind.INVALID_REQUEST, "Unknown status: " + status, ex);
            }
        }
        return parsed;
    }
}
