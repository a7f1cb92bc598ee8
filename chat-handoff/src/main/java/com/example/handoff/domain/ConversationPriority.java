package com.example.handoff.domain;

public enum ConversationPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    URGENT(3);

    private final int weight;

    ConversationPriority(int weight) {
        this.weight = weight;
    }

    /**
     * Queue ordering weight, higher is served first.
     */
    public int getWeight() {
        return weight;
    }
}
