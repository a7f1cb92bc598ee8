package com.example.handoff.controller;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.dto.ConversationSyncResponse;
import com.example.handoff.dto.CreateConversationRequest;
import com.example.handoff.dto.EscalateRequest;
import com.example.handoff.dto.InboundMessageRequest;
import com.example.handoff.dto.InboundMessageResponse;
import com.example.handoff.dto.ProposeRecommendationRequest;
import com.example.handoff.dto.SendMessageRequest;
import com.example.handoff.dto.TranscriptRequest;
import com.example.handoff.service.ConversationService;
import com.example.handoff.service.ConversationSyncService;
import com.example.handoff.service.EscalationService;
import com.example.handoff.service.InboundMessage;
import com.example.handoff.service.InboundResult;
import com.example.handoff.service.NewConversation;
import com.example.handoff.service.SyncAudience;
import com.example.handoff.service.TranscriptImport;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Customer and bot facing endpoints. Clients poll {@code GET /{id}/messages} for updates.
 */
@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;
    private final EscalationService escalationService;
    private final ConversationSyncService syncService;

    public ConversationController(
            ConversationService conversationService,
            EscalationService escalationService,
            ConversationSyncService syncService) {
        this.conversationService = conversationService;
        this.escalationService = escalationService;
        this.syncService = syncService;
    }

    @PostMapping
    public ResponseEntity<Conversation> createConversation(
            @Valid @RequestBody CreateConversationRequest request, HttpServletRequest servletRequest) {
        Conversation conversation = conversationService.createConversation(NewConversation.builder()
                .sessionToken(request.getSessionToken())
                .serviceMode(request.getServiceMode())
                .priority(request.getPriority())
                .exclusiveSession(request.isExclusiveSession())
                .attributes(request.getAttributes())
                .userAgent(servletRequest.getHeader(HttpHeaders.USER_AGENT))
                .ipAddress(ClientAddress.resolve(servletRequest))
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(conversation);
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<Conversation> getConversation(@PathVariable String conversationId) {
        return ResponseEntity.ok(conversationService.getConversation(conversationId));
    }

    @PostMapping("/inbound")
    public ResponseEntity<InboundMessageResponse> inbound(
            @Valid @RequestBody InboundMessageRequest request, HttpServletRequest servletRequest) {
        InboundResult result = escalationService.handleInboundMessage(InboundMessage.builder()
                .sessionToken(request.getSessionToken())
                .content(request.getContent())
                .inputMethod(request.getInputMethod())
                .serviceMode(request.getServiceMode())
                .userAgent(servletRequest.getHeader(HttpHeaders.USER_AGENT))
                .ipAddress(ClientAddress.resolve(servletRequest))
                .build());
        return ResponseEntity.ok(InboundMessageResponse.builder()
                .conversationId(result.conversation().getId())
                .status(result.conversation().getStatus())
                .message(result.message())
                .build());
    }

    @PostMapping("/transcripts")
    public ResponseEntity<Conversation> importTranscript(
            @Valid @RequestBody TranscriptRequest request, HttpServletRequest servletRequest) {
        TranscriptImport.TranscriptImportBuilder transcript = TranscriptImport.builder()
                .sessionToken(request.getSessionToken())
                .serviceMode(request.getServiceMode())
                .userAgent(servletRequest.getHeader(HttpHeaders.USER_AGENT))
                .ipAddress(ClientAddress.resolve(servletRequest));
        for (TranscriptRequest.Message message : request.getMessages()) {
            transcript.turn(TranscriptImport.Turn.builder()
                    .type(message.getType())
                    .content(message.getContent())
                    .confidence(message.getConfidence())
                    .inputMethod(message.getInputMethod())
                    .createdAt(message.getTimestamp())
                    .build());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(escalationService.importTranscript(transcript.build()));
    }

    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<ChatMessage> postMessage(
            @PathVariable String conversationId, @Valid @RequestBody SendMessageRequest request) {
        ChatMessage message = escalationService.appendParticipantMessage(ChatMessage.builder()
                .conversationId(conversationId)
                .type(request.getType())
                .content(request.getContent())
                .confidence(request.getConfidence())
                .inputMethod(request.getInputMethod())
                .build());
        return ResponseEntity.ok(message);
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<ConversationSyncResponse> getMessages(
            @PathVariable String conversationId,
            @RequestParam(name = "lastMessageId", required = false) Long lastMessageId) {
        ConversationSyncResponse response = lastMessageId == null
                ? syncService.fetchFull(conversationId, SyncAudience.CUSTOMER)
                : syncService.fetchSince(conversationId, lastMessageId, SyncAudience.CUSTOMER);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{conversationId}/escalate")
    public ResponseEntity<Conversation> escalate(
            @PathVariable String conversationId, @RequestBody(required = false) EscalateRequest request) {
        return ResponseEntity.ok(escalationService.escalate(
                conversationId, request != null ? request.getPriority() : null));
    }

    @PostMapping("/{conversationId}/close")
    public ResponseEntity<Conversation> close(@PathVariable String conversationId) {
        return ResponseEntity.ok(escalationService.closeConversation(conversationId));
    }

    @PostMapping("/{conversationId}/recommendations")
    public ResponseEntity<ChatMessage> proposeRecommendation(
            @PathVariable String conversationId, @Valid @RequestBody ProposeRecommendationRequest request) {
        ChatMessage draft = escalationService.proposeRecommendation(
                conversationId, request.getParentMessageId(), request.getContent(), request.getConfidence());
        return ResponseEntity.status(HttpStatus.CREATED).body(draft);
    }
}
