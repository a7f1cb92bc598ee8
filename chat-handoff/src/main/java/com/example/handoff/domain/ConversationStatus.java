package com.example.handoff.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a conversation. {@link #ACTIVE} is the initial state and {@link #RESOLVED} is terminal.
 */
public enum ConversationStatus {

    /** Served by the assistant only. */
    ACTIVE,

    /** Escalated and waiting in the operator queue. */
    WAITING,

    /** Claimed by exactly one operator. */
    IN_PROGRESS,

    /** Closed; never reopened. */
    RESOLVED;

    private static final Map<ConversationStatus, Set<ConversationStatus>> TRANSITIONS = new EnumMap<>(ConversationStatus.class);

    static {
        TRANSITIONS.put(ACTIVE, EnumSet.of(WAITING, RESOLVED));
        TRANSITIONS.put(WAITING, EnumSet.of(IN_PROGRESS, RESOLVED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(WAITING, RESOLVED));
        TRANSITIONS.put(RESOLVED, EnumSet.of(RESOLVED));
    }

    public boolean canTransitionTo(ConversationStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<ConversationStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isQueued() {
        return this == WAITING || this == IN_PROGRESS;
    }
}
