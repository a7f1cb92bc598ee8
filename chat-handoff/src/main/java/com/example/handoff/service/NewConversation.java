package com.example.handoff.service;

import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ServiceMode;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NewConversation {

    String sessionToken;

    @Builder.Default
    ServiceMode serviceMode = ServiceMode.FULL_LLM_BOT;

    @Builder.Default
    ConversationPriority priority = ConversationPriority.NORMAL;

    String userAgent;

    String ipAddress;

    Map<String, Object> attributes;

    /**
     * Reject creation while another conversation for the same session is still open and recently active.
     */
    boolean exclusiveSession;
}
