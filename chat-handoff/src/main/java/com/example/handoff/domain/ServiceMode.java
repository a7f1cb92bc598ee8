package com.example.handoff.domain;

/**
 * How a chat session is served.
 */
public enum ServiceMode {

    /** The assistant answers on its own; nothing is queued unless escalated explicitly. */
    FULL_LLM_BOT,

    /** Every user turn is queued and the assistant only drafts replies for an operator to approve. */
    BOT_WITH_ADMIN_VALIDATION,

    /** Every user turn is queued for a human operator. */
    HUMAN_CS_SUPPORT;

    public boolean escalatesInbound() {
        return this != FULL_LLM_BOT;
    }

    public boolean draftsRecommendations() {
        return this == BOT_WITH_ADMIN_VALIDATION;
    }
}
