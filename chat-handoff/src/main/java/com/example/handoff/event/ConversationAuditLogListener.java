package com.example.handoff.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one audit line per lifecycle change.
 */
@Slf4j
@Component
public class ConversationAuditLogListener implements ChatEventListener {

    @Override
    public void onConversationEvent(ConversationEvent event) {
        if (event.getOperatorId() != null) {
            log.info("[audit] conversation={} event={} status={} operator={} details={}",
                    event.getConversationId(), event.getType(), event.getStatus(), event.getOperatorId(),
                    event.getDetails());
        } else {
            log.info("[audit] conversation={} event={} status={} details={}",
                    event.getConversationId(), event.getType(), event.getStatus(), event.getDetails());
        }
    }

    @Override
    public void onMessageAppended(MessageAppendedEvent event) {
        log.debug("[audit] conversation={} message={} type={}",
                event.getConversationId(), event.getMessageId(), event.getMessageType());
    }
}
