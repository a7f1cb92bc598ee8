package com.example.handoff.domain;

/**
 * Caller identity handed explicitly to every operator-facing core call.
 */
public record OperatorContext(String operatorId, OperatorRole role) {

    public boolean isSuperadmin() {
        return role == OperatorRole.SUPERADMIN;
    }

    public boolean owns(Conversation conversation) {
        return conversation != null && operatorId.equals(conversation.getAssignedOperatorId());
    }
}
