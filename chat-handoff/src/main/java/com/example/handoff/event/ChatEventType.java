package com.example.handoff.event;

public enum ChatEventType {
    CONVERSATION_CREATED,
    CONVERSATION_ESCALATED,
    CONVERSATION_CLAIMED,
    CONVERSATION_RELEASED,
    CONVERSATION_RESOLVED,
    RECOMMENDATION_PROPOSED,
    RECOMMENDATION_APPROVED,
    RECOMMENDATION_DISCARDED
}
