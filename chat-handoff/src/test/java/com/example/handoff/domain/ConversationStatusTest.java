package com.example.handoff.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConversationStatusTest {

    @Test
    void activeEscalatesOrCloses() {
        assertThat(ConversationStatus.ACTIVE.allowedTargets())
                .containsExactlyInAnyOrder(ConversationStatus.WAITING, ConversationStatus.RESOLVED);
        assertThat(ConversationStatus.ACTIVE.canTransitionTo(ConversationStatus.IN_PROGRESS)).isFalse();
    }

    @Test
    void waitingIsClaimedOrResolved() {
        assertThat(ConversationStatus.WAITING.canTransitionTo(ConversationStatus.IN_PROGRESS)).isTrue();
        assertThat(ConversationStatus.WAITING.canTransitionTo(ConversationStatus.RESOLVED)).isTrue();
        assertThat(ConversationStatus.WAITING.canTransitionTo(ConversationStatus.ACTIVE)).isFalse();
    }

    @Test
    void inProgressIsReleasedOrResolved() {
        assertThat(ConversationStatus.IN_PROGRESS.allowedTargets())
                .containsExactlyInAnyOrder(ConversationStatus.WAITING, ConversationStatus.RESOLVED);
    }

    @Test
    void resolvedIsTerminal() {
        assertThat(ConversationStatus.RESOLVED.allowedTargets()).containsExactly(ConversationStatus.RESOLVED);
        assertThat(ConversationStatus.RESOLVED.canTransitionTo(ConversationStatus.ACTIVE)).isFalse();
        assertThat(ConversationStatus.RESOLVED.canTransitionTo(null)).isFalse();
    }

    @Test
    void onlyWaitingAndInProgressAreQueued() {
        assertThat(ConversationStatus.WAITING.isQueued()).isTrue();
        assertThat(ConversationStatus.IN_PROGRESS.isQueued()).isTrue();
        assertThat(ConversationStatus.ACTIVE.isQueued()).isFalse();
        assertThat(ConversationStatus.RESOLVED.isQueued()).isFalse();
    }
}
