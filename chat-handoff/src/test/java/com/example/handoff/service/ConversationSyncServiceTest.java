package com.example.handoff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.Conversation;
import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.MessageType;
import com.example.handoff.dto.ConversationSyncResponse;
import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.support.AbstractIntegrationTest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class ConversationSyncServiceTest extends AbstractIntegrationTest {

    @Autowired
    private ConversationSyncService syncService;

    @Autowired
    private MessageService messageService;

    @Autowired
    private EscalationService escalationService;

    @Autowired
    private OperatorQueueService queueService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private Conversation conversation;

    @BeforeEach
    void openConversation() {
        conversation = newConversation("sess-sync");
    }

    @Test
    void pollingWithCursorSeesEveryMessageOnce() {
        List<Long> seen = new ArrayList<>();
        long cursor = 0;

        append("satu");
        append("dua");
        ConversationSyncResponse firstPoll = syncService.fetchSince(conversation.getId(), cursor, SyncAudience.CUSTOMER);
        firstPoll.getNewMessages().forEach(message -> seen.add(message.getId()));
        cursor = firstPoll.getCursor();

        append("tiga");
        ConversationSyncResponse secondPoll = syncService.fetchSince(conversation.getId(), cursor, SyncAudience.CUSTOMER);
        secondPoll.getNewMessages().forEach(message -> seen.add(message.getId()));

        assertThat(seen).containsExactlyElementsOf(
                syncService.fetchFull(conversation.getId(), SyncAudience.CUSTOMER).getMessages().stream()
                        .map(ChatMessage::getId)
                        .toList());
        assertThat(seen).doesNotHaveDuplicates().hasSize(3);
        assertThat(secondPoll.getCursor()).isEqualTo(seen.get(2));
    }

    @Test
    void repeatedPollFromSameCursorReturnsOnlyNewMessage() {
        ChatMessage seen = append("sudah dibaca");
        long cursor = seen.getId();
        assertThat(syncService.fetchSince(conversation.getId(), cursor, SyncAudience.CUSTOMER).getNewMessages()).isEmpty();

        ChatMessage fresh = append("baru");

        assertThat(syncService.fetchSince(conversation.getId(), cursor, SyncAudience.CUSTOMER).getNewMessages())
                .extracting(ChatMessage::getId)
                .containsExactly(fresh.getId());
    }

    @Test
    void emptyPollStillCarriesStatus() {
        ChatMessage last = append("halo");
        queueService.enqueue(conversation.getId(), ConversationPriority.NORMAL);
        queueService.claim(conversation.getId(), ANI);

        ConversationSyncResponse response = syncService.fetchSince(conversation.getId(), last.getId(), SyncAudience.CUSTOMER);

        assertThat(response.getNewMessages()).isEmpty();
        assertThat(response.getMessages()).isNull();
        assertThat(response.getCursor()).isEqualTo(last.getId());
        assertThat(response.getStatus()).isEqualTo(ConversationStatus.IN_PROGRESS);
        assertThat(response.getAssignedOperatorId()).isEqualTo("op-ani");
    }

    @Test
    void appendWaitingOnAnOpenAppendIsNotSkippedByTheCursor() throws Exception {
        ChatMessage question = append("Halo");
        long cursor = question.getId();
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        CountDownLatch draftInserted = new CountDownLatch(1);
        CountDownLatch commitDraft = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ChatMessage> draft = executor.submit(() -> transaction.execute(status -> {
                ChatMessage saved = escalationService.proposeRecommendation(
                        conversation.getId(), question.getId(), "Bisa, silakan", 0.7);
                draftInserted.countDown();
                awaitUninterruptibly(commitDraft);
                return saved;
            }));
            assertThat(draftInserted.await(10, TimeUnit.SECONDS)).isTrue();

            Future<ChatMessage> followUp = executor.submit(() -> append("Halo lagi?"));
            assertThatThrownBy(() -> followUp.get(500, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

            ConversationSyncResponse whileOpen =
                    syncService.fetchSince(conversation.getId(), cursor, SyncAudience.OPERATOR);
            assertThat(whileOpen.getNewMessages()).isEmpty();
            cursor = whileOpen.getCursor();

            commitDraft.countDown();
            ChatMessage draftMessage = draft.get(10, TimeUnit.SECONDS);
            ChatMessage followUpMessage = followUp.get(10, TimeUnit.SECONDS);

            assertThat(syncService.fetchSince(conversation.getId(), cursor, SyncAudience.OPERATOR).getNewMessages())
                    .extracting(ChatMessage::getId)
                    .containsExactly(draftMessage.getId(), followUpMessage.getId());
        } finally {
            commitDraft.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void customerViewHidesDrafts() {
        ChatMessage question = append("Apakah bisa COD?");
        escalationService.proposeRecommendation(conversation.getId(), question.getId(), "Bisa untuk area Jakarta", 0.7);

        ConversationSyncResponse customer = syncService.fetchFull(conversation.getId(), SyncAudience.CUSTOMER);
        ConversationSyncResponse operator = syncService.fetchFull(conversation.getId(), SyncAudience.OPERATOR);

        assertThat(customer.getMessages()).extracting(ChatMessage::getType).containsExactly(MessageType.USER);
        assertThat(customer.getCursor()).isEqualTo(question.getId());
        assertThat(operator.getMessages()).extracting(ChatMessage::getType)
                .containsExactly(MessageType.USER, MessageType.LLM_RECOMMENDATION);
        assertThat(operator.getCursor()).isGreaterThan(question.getId());
    }

    @Test
    void rejectsNegativeCursorAndUnknownConversation() {
        expectError(ErrorKind.INVALID_REQUEST,
                () -> syncService.fetchSince(conversation.getId(), -1, SyncAudience.CUSTOMER));
        expectError(ErrorKind.NOT_FOUND, () -> syncService.fetchFull("missing", SyncAudience.OPERATOR));
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }

    private ChatMessage append(String content) {
        return messageService.append(ChatMessage.builder()
                .conversationId(conversation.getId())
                .type(MessageType.USER)
                .content(content)
                .build());
    }
}
