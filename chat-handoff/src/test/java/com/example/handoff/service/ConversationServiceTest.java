package com.example.handoff.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.ServiceMode;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import com.example.handoff.support.AbstractIntegrationTest;
import com.example.handoff.support.TestHandoffConfiguration;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConversationServiceTest extends AbstractIntegrationTest {

    @Test
    void createsActiveConversationWithDefaults() {
        Conversation conversation = conversationService.createConversation(NewConversation.builder()
                .sessionToken("sess-001")
                .attributes(Map.of("channel", "web"))
                .build());

        Conversation stored = conversationService.getConversation(conversation.getId());
        assertThat(stored.getStatus()).isEqualTo(ConversationStatus.ACTIVE);
        assertThat(stored.getServiceMode()).isEqualTo(ServiceMode.FULL_LLM_BOT);
        assertThat(stored.getPriority()).isEqualTo(ConversationPriority.NORMAL);
        assertThat(stored.getAssignedOperatorId()).isNull();
        assertThat(stored.getCreatedAt()).isEqualTo(TestHandoffConfiguration.START);
        assertThat(stored.getLastMessageAt()).isNull();
        assertThat(stored.getAttributes()).containsEntry("channel", "web");
    }

    @Test
    void blankSessionTokenIsRejected() {
        expectError(ErrorKind.INVALID_REQUEST, () -> newConversation(" "));
    }

    @Test
    void exclusiveCreationRejectsRecentlyActiveSession() {
        Conversation open = newConversation("sess-dup");
        clock.advance(Duration.ofHours(1));

        ServiceException ex = expectError(ErrorKind.DUPLICATE_SESSION, () -> conversationService.createConversation(
                NewConversation.builder().sessionToken("sess-dup").exclusiveSession(true).build()));
        assertThat(ex.getCurrentStatus()).isEqualTo(open.getStatus());
    }

    @Test
    void exclusiveCreationAllowedOnceSessionWindowPassed() {
        Conversation stale = newConversation("sess-stale");
        clock.advance(Duration.ofHours(13));

        Conversation fresh = conversationService.createConversation(
                NewConversation.builder().sessionToken("sess-stale").exclusiveSession(true).build());

        assertThat(fresh.getId()).isNotEqualTo(stale.getId());
        assertThat(conversationService.findOpenForSession("sess-stale")).map(Conversation::getId)
                .contains(fresh.getId());
    }

    @Test
    void nonExclusiveCreationAlwaysSucceeds() {
        Conversation first = newConversation("sess-shared");
        Conversation second = newConversation("sess-shared");

        assertThat(second.getId()).isNotEqualTo(first.getId());
    }

    @Test
    void invalidTransitionReportsCurrentStatus() {
        Conversation conversation = newConversation("sess-transition");

        ServiceException ex = expectError(ErrorKind.INVALID_TRANSITION,
                () -> conversationService.setStatus(conversation.getId(), ConversationStatus.IN_PROGRESS, "op-ani", null));
        assertThat(ex.getCurrentStatus()).isEqualTo(ConversationStatus.ACTIVE);

        conversationService.setStatus(conversation.getId(), ConversationStatus.RESOLVED);
        ex = expectError(ErrorKind.INVALID_TRANSITION,
                () -> conversationService.setStatus(conversation.getId(), ConversationStatus.WAITING));
        assertThat(ex.getCurrentStatus()).isEqualTo(ConversationStatus.RESOLVED);
    }

    @Test
    void inProgressRequiresOperator() {
        Conversation conversation = newConversation("sess-no-operator");
        conversationService.setStatus(conversation.getId(), ConversationStatus.WAITING);

        expectError(ErrorKind.INVALID_REQUEST,
                () -> conversationService.setStatus(conversation.getId(), ConversationStatus.IN_PROGRESS));
    }

    @Test
    void resolvingTwiceKeepsFirstResolutionTime() {
        Conversation conversation = newConversation("sess-resolve");
        Instant resolvedAt = conversationService.setStatus(conversation.getId(), ConversationStatus.RESOLVED)
                .getResolvedAt();
        clock.advance(Duration.ofMinutes(5));

        Conversation again = conversationService.setStatus(conversation.getId(), ConversationStatus.RESOLVED);

        assertThat(resolvedAt).isEqualTo(TestHandoffConfiguration.START);
        assertThat(again.getResolvedAt()).isEqualTo(resolvedAt);
    }

    @Test
    void lastMessageTimeNeverMovesBackwards() {
        Conversation conversation = newConversation("sess-touch");
        Instant later = TestHandoffConfiguration.START.plusSeconds(30);

        conversationService.touchLastMessage(conversation.getId(), later);
        conversationService.touchLastMessage(conversation.getId(), TestHandoffConfiguration.START.plusSeconds(10));

        assertThat(conversationService.getConversation(conversation.getId()).getLastMessageAt()).isEqualTo(later);
    }

    @Test
    void unknownConversationIsNotFound() {
        expectError(ErrorKind.NOT_FOUND, () -> conversationService.getConversation("missing"));
        expectError(ErrorKind.NOT_FOUND,
                () -> conversationService.touchLastMessage("missing", TestHandoffConfiguration.START));
        expectError(ErrorKind.NOT_FOUND,
                () -> conversationService.setStatus("missing", ConversationStatus.WAITING));
    }

    @Test
    void idleLookupOnlyReturnsActiveConversationsPastCutoff() {
        Conversation idle = newConversation("sess-idle");
        Conversation queued = newConversation("sess-queued");
        conversationService.setStatus(queued.getId(), ConversationStatus.WAITING);
        clock.advance(Duration.ofMinutes(20));
        Conversation recent = newConversation("sess-recent");

        List<Conversation> found = conversationService.findIdle(clock.instant().minus(Duration.ofMinutes(10)));

        assertThat(found).extracting(Conversation::getId)
                .containsExactly(idle.getId())
                .doesNotContain(queued.getId(), recent.getId());
    }

    @Test
    void listsConversationsByStatus() {
        Conversation active = newConversation("sess-a");
        Conversation waiting = newConversation("sess-b");
        conversationService.setStatus(waiting.getId(), ConversationStatus.WAITING);

        assertThat(conversationService.listConversations(EnumSet.of(ConversationStatus.WAITING)))
                .extracting(Conversation::getId)
                .containsExactly(waiting.getId());
        assertThat(conversationService.listConversations(EnumSet.noneOf(ConversationStatus.class)))
                .extracting(Conversation::getId)
                .containsExactlyInAnyOrder(active.getId(), waiting.getId());
    }
}
