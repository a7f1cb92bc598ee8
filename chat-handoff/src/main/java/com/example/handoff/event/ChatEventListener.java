package com.example.handoff.event;

/**
 * Receives committed conversation changes. Failures are logged by the publisher and never reach the caller.
 */
public interface ChatEventListener {

    void onConversationEvent(ConversationEvent event);

    default void onMessageAppended(MessageAppendedEvent event) {
    }
}
