package com.example.handoff.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.handoff.config.ChatProperties;
import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.MessageType;
import com.example.handoff.domain.OperatorContext;
import com.example.handoff.domain.OperatorRole;
import com.example.handoff.domain.QueueStats;
import com.example.handoff.dto.QueueOverviewItem;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import com.example.handoff.support.AbstractIntegrationTest;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class OperatorQueueServiceTest extends AbstractIntegrationTest {

    @Autowired
    private OperatorQueueService queueService;

    @Autowired
    private MessageService messageService;

    @Autowired
    private ChatProperties chatProperties;

    @Test
    void waitingListIsOrderedByPriorityThenAge() {
        Conversation normalEarly = queued("sess-n1", ConversationPriority.NORMAL);
        clock.advance(Duration.ofMinutes(1));
        Conversation urgent = queued("sess-u1", ConversationPriority.URGENT);
        clock.advance(Duration.ofMinutes(1));
        Conversation normalLate = queued("sess-n2", ConversationPriority.NORMAL);

        assertThat(queueService.listWaiting())
                .extracting(Conversation::getId)
                .containsExactly(urgent.getId(), normalEarly.getId(), normalLate.getId());
        assertThat(queueService.listWaiting())
                .allSatisfy(conversation -> assertThat(conversation.getStatus()).isEqualTo(ConversationStatus.WAITING));
    }

    @Test
    void enqueueMovesConversationToWaiting() {
        Conversation conversation = newConversation("sess-enqueue");

        Conversation waiting = queueService.enqueue(conversation.getId(), ConversationPriority.HIGH);

        assertThat(waiting.getStatus()).isEqualTo(ConversationStatus.WAITING);
        assertThat(waiting.getPriority()).isEqualTo(ConversationPriority.HIGH);
        assertThat(queueService.waitingEntries()).singleElement()
                .satisfies(entry -> assertThat(entry.getQueuedAt()).isEqualTo(clock.instant()));
    }

    @Test
    void enqueueTwiceIsRejected() {
        Conversation conversation = queued("sess-twice", ConversationPriority.NORMAL);

        expectError(ErrorKind.ALREADY_QUEUED,
                () -> queueService.enqueue(conversation.getId(), ConversationPriority.URGENT));

        queueService.claim(conversation.getId(), ANI);
        expectError(ErrorKind.ALREADY_QUEUED,
                () -> queueService.enqueue(conversation.getId(), ConversationPriority.URGENT));
    }

    @Test
    void resolvedConversationCannotBeQueued() {
        Conversation conversation = newConversation("sess-closed");
        queueService.resolve(conversation.getId());

        ServiceException ex = expectError(ErrorKind.INVALID_TRANSITION,
                () -> queueService.enqueue(conversation.getId(), ConversationPriority.NORMAL));
        assertThat(ex.getCurrentStatus()).isEqualTo(ConversationStatus.RESOLVED);
    }

    @Test
    void claimAssignsOperator() {
        Conversation conversation = queued("sess-claim", ConversationPriority.NORMAL);

        Conversation claimed = queueService.claim(conversation.getId(), ANI);

        assertThat(claimed.getStatus()).isEqualTo(ConversationStatus.IN_PROGRESS);
        assertThat(claimed.getAssignedOperatorId()).isEqualTo("op-ani");
        assertThat(queueService.listWaiting()).isEmpty();
    }

    @Test
    void claimOutcomes() {
        Conversation conversation = queued("sess-outcomes", ConversationPriority.NORMAL);
        queueService.claim(conversation.getId(), ANI);

        ServiceException taken = expectError(ErrorKind.ALREADY_CLAIMED,
                () -> queueService.claim(conversation.getId(), BUDI));
        assertThat(taken.getCurrentStatus()).isEqualTo(ConversationStatus.IN_PROGRESS);

        assertThat(queueService.claimForOperator(conversation.getId(), ANI).status())
                .isEqualTo(OperatorQueueService.ClaimStatus.OWNED);

        Conversation notQueued = newConversation("sess-not-queued");
        ServiceException notWaiting = expectError(ErrorKind.INVALID_TRANSITION,
                () -> queueService.claim(notQueued.getId(), ANI));
        assertThat(notWaiting.getCurrentStatus()).isEqualTo(ConversationStatus.ACTIVE);

        expectError(ErrorKind.NOT_FOUND, () -> queueService.claim("missing", ANI));
        expectError(ErrorKind.UNAUTHENTICATED, () -> queueService.claim(conversation.getId(), null));
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        Conversation conversation = queued("sess-race", ConversationPriority.NORMAL);
        int contenders = 8;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                OperatorContext operator = new OperatorContext("op-race-" + i, OperatorRole.ADMIN);
                outcomes.add(executor.submit(() -> {
                    start.await();
                    try {
                        return queueService.claim(conversation.getId(), operator);
                    } catch (ServiceException ex) {
                        return ex.getKind();
                    }
                }));
            }
            start.countDown();

            List<Object> results = new ArrayList<>();
            for (Future<Object> outcome : outcomes) {
                results.add(outcome.get(30, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(Conversation.class::isInstance).hasSize(1);
            assertThat(results).filteredOn(ErrorKind.ALREADY_CLAIMED::equals).hasSize(contenders - 1);
        } finally {
            executor.shutdownNow();
        }

        Conversation stored = conversationService.getConversation(conversation.getId());
        assertThat(stored.getStatus()).isEqualTo(ConversationStatus.IN_PROGRESS);
        assertThat(stored.getAssignedOperatorId()).startsWith("op-race-");
    }

    @Test
    void claimNextTakesHeadOfQueue() {
        Conversation normal = queued("sess-next-normal", ConversationPriority.NORMAL);
        clock.advance(Duration.ofSeconds(5));
        Conversation high = queued("sess-next-high", ConversationPriority.HIGH);

        Optional<Conversation> first = queueService.claimNext(ANI);
        Optional<Conversation> second = queueService.claimNext(BUDI);

        assertThat(first).map(Conversation::getId).contains(high.getId());
        assertThat(second).map(Conversation::getId).contains(normal.getId());
        assertThat(queueService.claimNext(ROOT)).isEmpty();
    }

    @Test
    void releaseRequeuesWithFreshWait() {
        Conversation conversation = queued("sess-release", ConversationPriority.NORMAL);
        queueService.claim(conversation.getId(), ANI);
        clock.advance(Duration.ofMinutes(3));

        expectError(ErrorKind.FORBIDDEN, () -> queueService.release(conversation.getId(), BUDI));
        Conversation released = queueService.release(conversation.getId(), ANI);

        assertThat(released.getStatus()).isEqualTo(ConversationStatus.WAITING);
        assertThat(released.getAssignedOperatorId()).isNull();
        assertThat(queueService.waitingEntries()).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getQueuedAt()).isEqualTo(clock.instant());
                    assertThat(entry.getClaimedAt()).isNull();
                });

        expectError(ErrorKind.INVALID_TRANSITION, () -> queueService.release(conversation.getId(), ANI));
    }

    @Test
    void superadminMayReleaseAnyConversation() {
        Conversation conversation = queued("sess-root-release", ConversationPriority.NORMAL);
        queueService.claim(conversation.getId(), BUDI);

        assertThat(queueService.release(conversation.getId(), ROOT).getStatus()).isEqualTo(ConversationStatus.WAITING);
    }

    @Test
    void resolveIsIdempotent() {
        Conversation conversation = queued("sess-resolve", ConversationPriority.NORMAL);
        queueService.claim(conversation.getId(), ANI);
        clock.advance(Duration.ofMinutes(2));
        Instant resolvedAt = clock.instant();

        Conversation resolved = queueService.resolve(conversation.getId());
        clock.advance(Duration.ofMinutes(2));
        Conversation again = queueService.resolve(conversation.getId());

        assertThat(resolved.getStatus()).isEqualTo(ConversationStatus.RESOLVED);
        assertThat(resolved.getResolvedAt()).isEqualTo(resolvedAt);
        assertThat(again.getResolvedAt()).isEqualTo(resolvedAt);
        assertThat(again.getAssignedOperatorId()).isNull();
        expectError(ErrorKind.NOT_FOUND, () -> queueService.resolve("missing"));
    }

    @Test
    void statsReportLatencies() {
        Conversation handled = queued("sess-stats", ConversationPriority.NORMAL);
        queued("sess-stats-waiting", ConversationPriority.LOW);
        newConversation("sess-stats-active");
        clock.advance(Duration.ofSeconds(60));
        queueService.claim(handled.getId(), ANI);
        clock.advance(Duration.ofSeconds(120));
        queueService.resolve(handled.getId());

        QueueStats stats = queueService.listStats();

        assertThat(stats.getTotalConversations()).isEqualTo(3);
        assertThat(stats.getActive()).isEqualTo(1);
        assertThat(stats.getWaiting()).isEqualTo(1);
        assertThat(stats.getInProgress()).isZero();
        assertThat(stats.getOpenTotal()).isEqualTo(1);
        assertThat(stats.getResolvedToday()).isEqualTo(1);
        assertThat(stats.getAverageResponseSeconds()).isEqualTo(60.0);
        assertThat(stats.getAverageResolutionSeconds()).isEqualTo(180.0);
        assertThat(stats.getComputedAt()).isEqualTo(clock.instant());
    }

    @Test
    void statsWithoutSamplesHaveNoAverages() {
        QueueStats stats = queueService.listStats();

        assertThat(stats.getTotalConversations()).isZero();
        assertThat(stats.getAverageResponseSeconds()).isNull();
        assertThat(stats.getAverageResolutionSeconds()).isNull();
    }

    @Test
    void operatorAtCapacityCannotClaim() {
        Conversation first = queued("sess-cap-1", ConversationPriority.NORMAL);
        Conversation second = queued("sess-cap-2", ConversationPriority.NORMAL);
        int previous = chatProperties.getQueue().getMaxConcurrentByOperator();
        chatProperties.getQueue().setMaxConcurrentByOperator(1);
        try {
            queueService.claim(first.getId(), ANI);

            expectError(ErrorKind.OPERATOR_AT_CAPACITY, () -> queueService.claim(second.getId(), ANI));
            expectError(ErrorKind.OPERATOR_AT_CAPACITY, () -> queueService.claimNext(ANI));
            assertThat(queueService.claim(second.getId(), BUDI).getAssignedOperatorId()).isEqualTo("op-budi");
        } finally {
            chatProperties.getQueue().setMaxConcurrentByOperator(previous);
        }
    }

    @Test
    void overviewDescribesOpenConversations() {
        Conversation conversation = newConversation("session-abcdef123456");
        messageService.append(ChatMessage.builder()
                .conversationId(conversation.getId())
                .type(MessageType.USER)
                .content("Pesanan saya belum sampai")
                .build());
        queueService.enqueue(conversation.getId(), ConversationPriority.HIGH);
        newConversation("sess-unqueued");
        clock.advance(Duration.ofMinutes(7));

        List<QueueOverviewItem> overview = queueService.overview();

        assertThat(overview).singleElement().satisfies(item -> {
            assertThat(item.getConversationId()).isEqualTo(conversation.getId());
            assertThat(item.getDisplayName()).isEqualTo("User-ef123456");
            assertThat(item.getStatus()).isEqualTo(ConversationStatus.WAITING);
            assertThat(item.getPriority()).isEqualTo(ConversationPriority.HIGH);
            assertThat(item.getWaitMinutes()).isEqualTo(7);
            assertThat(item.getMessageCount()).isEqualTo(1);
            assertThat(item.getLastMessage()).isEqualTo("Pesanan saya belum sampai");
        });
    }

    @Test
    void assigneeAndResolutionFollowStatus() {
        Conversation claimed = queued("sess-inv-1", ConversationPriority.NORMAL);
        Conversation released = queued("sess-inv-2", ConversationPriority.HIGH);
        Conversation resolved = queued("sess-inv-3", ConversationPriority.LOW);
        newConversation("sess-inv-4");
        queueService.claim(claimed.getId(), ANI);
        queueService.claim(released.getId(), BUDI);
        queueService.release(released.getId(), BUDI);
        queueService.claim(resolved.getId(), ROOT);
        queueService.resolve(resolved.getId());

        Integer violations = jdbcTemplate.queryForObject(
                "select count(*) from chat_conversations where "
                        + "(status = 'IN_PROGRESS' and assigned_operator_id is null) "
                        + "or (status <> 'IN_PROGRESS' and assigned_operator_id is not null) "
                        + "or (status = 'RESOLVED' and resolved_at is null) "
                        + "or (status <> 'RESOLVED' and resolved_at is not null)",
                Integer.class);

        assertThat(violations).isZero();
    }

    private Conversation queued(String sessionToken, ConversationPriority priority) {
        Conversation conversation = newConversation(sessionToken);
        return queueService.enqueue(conversation.getId(), priority);
    }
}
