package com.example.handoff.domain;

public enum MessageType {
    USER,
    ASSISTANT,
    ADMIN,
    SYSTEM,
    LLM_RECOMMENDATION;

    public boolean carriesConfidence() {
        return this == ASSISTANT || this == LLM_RECOMMENDATION;
    }

    public boolean carriesAuthor() {
        return this == ADMIN || this == LLM_RECOMMENDATION;
    }

    /**
     * Drafts are operator-only guidance and never shown to the customer.
     */
    public boolean isDraft() {
        return this == LLM_RECOMMENDATION;
    }
}
