package com.example.handoff.service;

import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.ServiceMode;
import lombok.Builder;
import lombok.Value;

/**
 * A customer turn addressed by session rather than by conversation.
 */
@Value
@Builder
public class InboundMessage {

    String sessionToken;
    String content;
    InputMethod inputMethod;

    /** Mode requested by the client; {@code null} keeps the conversation's mode. */
    ServiceMode serviceMode;

    String userAgent;
    String ipAddress;
}
