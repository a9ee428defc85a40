package com.workhub.server.service;

import com.workhub.server.agent.AgentGateway;
import com.workhub.server.agent.AgentRequest;
import com.workhub.server.agent.AgentUnavailableException;
import com.workhub.server.model.ConnectionEntry;
import com.workhub.server.model.MessageKind;
import com.workhub.server.model.PersistedRecord;
import com.workhub.server.model.RecipientSelector;
import com.workhub.server.model.Role;
import com.workhub.server.model.RoutedMessage;
import com.workhub.server.model.UserIdentity;
import com.workhub.server.persistence.PersistenceException;
import com.workhub.server.support.InMemoryMessageStore;
import com.workhub.server.support.ManualExecutor;
import com.workhub.server.support.RecordingChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MessageRouterTest {

    private static final Executor DIRECT = Runnable::run;

    @Mock
    private AgentGateway agentGateway;

    private ConnectionRegistry registry;
    private InMemoryMessageStore store;
    private MessageRouter router;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        store = new InMemoryMessageStore();
        router = new MessageRouter(registry, store, agentGateway, DIRECT, true);
        when(agentGateway.submit(any())).thenReturn(CompletableFuture.completedFuture(null));
    }

    private RecordingChannel connect(String userId, Role role, String teamId) {
        RecordingChannel channel = new RecordingChannel();
        registry.register(ConnectionEntry.of(new UserIdentity(userId, role, teamId), channel));
        return channel;
    }

    private static RoutedMessage chat(String from, String to, String content) {
        return RoutedMessage.builder()
                .senderId(from)
                .senderRole(Role.WORKER)
                .teamId("t1")
                .kind(MessageKind.CHAT)
                .content(content)
                .recipient(RecipientSelector.user(to))
                .build();
    }

    @Test
    void chatToOfflineUserIsStoredWithoutPush() throws Exception {
        RouteResult result = router.route(chat("w1", "m1", "hello"));

        assertThat(result.getLivePushes()).isZero();
        assertThat(result.getPersisted().get()).hasSize(1);
        PersistedRecord record = store.records().get(0);
        assertThat(record.getMessageId()).isEqualTo(result.getMessageId());
        assertThat(record.getRecipient()).isEqualTo(RecipientSelector.user("m1"));
        assertThat(router.getOfflineDeliveries()).isEqualTo(1);
    }

    @Test
    void chatToConnectedUserIsPushedAndStored() throws Exception {
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");

        RouteResult result = router.route(chat("w1", "m1", "hello"));

        assertThat(result.getLivePushes()).isEqualTo(1);
        assertThat(manager.liveContents()).containsExactly("hello");
        assertThat(manager.liveMessages().get(0).getMessageId()).isEqualTo(result.getMessageId());
        assertThat(result.getPersisted().get()).hasSize(1);
    }

    @Test
    void chatToConnectedUserOfAnotherTeamIsRejectedBeforeDeliveryOrStorage() {
        RecordingChannel stranger = connect("m9", Role.MANAGER, "t9");

        assertThatThrownBy(() -> router.route(chat("w1", "m9", "hi")))
                .isInstanceOf(RoutingException.class);

        assertThat(stranger.liveMessages()).isEmpty();
        assertThat(store.records()).isEmpty();
        assertThat(router.getRejected()).isEqualTo(1);
    }

    @Test
    void messageWithoutTeamIsRejectedBeforeDeliveryOrStorage() {
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");
        RoutedMessage noTeam = chat("w1", "m1", "hi").toBuilder().teamId(null).build();

        assertThatThrownBy(() -> router.route(noTeam))
                .isInstanceOf(RoutingException.class)
                .hasMessageContaining("requires a team");

        assertThat(manager.liveMessages()).isEmpty();
        assertThat(store.records()).isEmpty();
    }

    @Test
    void chatToOfflineUserIsStoredUnderSenderTeam() throws Exception {
        RouteResult result = router.route(chat("w1", "x2", "for x2"));

        assertThat(result.getPersisted().get()).hasSize(1);
        assertThat(store.records().get(0).getTeamId()).isEqualTo("t1");
        assertThat(store.fetchHistory(new UserIdentity("x2", Role.WORKER, "t2"), 10)).isEmpty();
    }

    @Test
    void offlineRecipientWhoConnectsBeforeStorageCompletesGetsLatePush() {
        ManualExecutor persistence = new ManualExecutor();
        router = new MessageRouter(registry, store, agentGateway, persistence, true);

        RouteResult result = router.route(chat("w1", "m1", "while you were away"));
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");
        assertThat(manager.liveMessages()).isEmpty();

        persistence.runAll();

        assertThat(manager.liveContents()).containsExactly("while you were away");
        assertThat(manager.liveMessages().get(0).getMessageId()).isEqualTo(result.getMessageId());
        assertThat(router.getLatePushes()).isEqualTo(1);
    }

    @Test
    void latePushSkipsRecipientWhoReconnectedInAnotherTeam() {
        ManualExecutor persistence = new ManualExecutor();
        router = new MessageRouter(registry, store, agentGateway, persistence, true);

        router.route(chat("w1", "m1", "t1 only"));
        RecordingChannel elsewhere = connect("m1", Role.MANAGER, "t2");
        persistence.runAll();

        assertThat(elsewhere.liveMessages()).isEmpty();
        assertThat(router.getLatePushes()).isZero();
    }

    @Test
    void incidentAlertReachesManagerWhoConnectedBeforeStorageCompleted() {
        ManualExecutor persistence = new ManualExecutor();
        router = new MessageRouter(registry, store, agentGateway, persistence, true);
        RecordingChannel early = connect("m1", Role.MANAGER, "t1");

        router.route(RoutedMessage.builder()
                .senderId("w1")
                .teamId("t1")
                .kind(MessageKind.INCIDENT_ALERT)
                .content("Flooding in bay 3")
                .recipient(RecipientSelector.roleInTeam(Role.MANAGER, "t1"))
                .build());
        RecordingChannel late = connect("m2", Role.MANAGER, "t1");
        persistence.runAll();

        assertThat(early.liveContents()).containsExactly("Flooding in bay 3");
        assertThat(late.liveContents()).containsExactly("Flooding in bay 3");
        assertThat(router.getLatePushes()).isEqualTo(1);
    }

    @Test
    void latePushStillHappensWhenStorageFails() {
        ManualExecutor persistence = new ManualExecutor();
        router = new MessageRouter(registry, store, agentGateway, persistence, true);
        store.setFailPersist(true);

        RouteResult result = router.route(chat("w1", "m1", "unstored"));
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");
        persistence.runAll();

        assertThat(result.getPersisted()).isCompletedExceptionally();
        assertThat(manager.liveContents()).containsExactly("unstored");
    }

    @Test
    void chatToAgentIsForwardedAndStoredAgainstAgent() throws Exception {
        RoutedMessage message = chat("w1", "ignored", "what is my shift?").toBuilder()
                .recipient(RecipientSelector.agent())
                .build();

        RouteResult result = router.route(message);

        ArgumentCaptor<AgentRequest> request = ArgumentCaptor.forClass(AgentRequest.class);
        verify(agentGateway).submit(request.capture());
        assertThat(request.getValue().getMessageId()).isEqualTo(message.getMessageId());
        assertThat(request.getValue().getSenderId()).isEqualTo("w1");
        assertThat(request.getValue().getTeamId()).isEqualTo("t1");
        assertThat(result.getAgentForwarded()).isCompleted();
        assertThat(result.getPersisted().get()).hasSize(1);
        assertThat(store.records().get(0).getRecipient().getType()).isEqualTo(RecipientSelector.Type.AGENT);
    }

    @Test
    void unavailableAgentFailsForwardButMessageIsStillStored() throws Exception {
        when(agentGateway.submit(any())).thenReturn(
                CompletableFuture.failedFuture(new AgentUnavailableException("The assistant is not available")));

        RouteResult result = router.route(chat("w1", "x", "help").toBuilder()
                .recipient(RecipientSelector.agent())
                .build());

        assertThat(result.getAgentForwarded()).isCompletedExceptionally();
        assertThat(result.getPersisted().get()).hasSize(1);
    }

    @Test
    void incidentAlertReachesEveryConnectedManagerOfTeamAndIsStoredOnce() throws Exception {
        RecordingChannel m1 = connect("m1", Role.MANAGER, "t1");
        RecordingChannel m2 = connect("m2", Role.MANAGER, "t1");
        RecordingChannel otherTeam = connect("m3", Role.MANAGER, "t2");
        RecordingChannel worker = connect("w2", Role.WORKER, "t1");

        RouteResult result = router.route(RoutedMessage.builder()
                .senderId("w1")
                .senderRole(Role.WORKER)
                .teamId("t1")
                .kind(MessageKind.INCIDENT_ALERT)
                .content("Gas leak at site B")
                .recipient(RecipientSelector.roleInTeam(Role.MANAGER, "t1"))
                .build());

        assertThat(result.getLivePushes()).isEqualTo(2);
        assertThat(m1.liveContents()).containsExactly("Gas leak at site B");
        assertThat(m2.liveContents()).containsExactly("Gas leak at site B");
        assertThat(otherTeam.liveMessages()).isEmpty();
        assertThat(worker.liveMessages()).isEmpty();
        assertThat(result.getPersisted().get()).hasSize(1);
        assertThat(store.records().get(0).getRecipient()).isEqualTo(RecipientSelector.roleInTeam(Role.MANAGER, "t1"));
    }

    @Test
    void managerRaisingIncidentDoesNotReceiveOwnAlert() {
        RecordingChannel sender = connect("m1", Role.MANAGER, "t1");
        RecordingChannel peer = connect("m2", Role.MANAGER, "t1");

        router.route(RoutedMessage.builder()
                .senderId("m1")
                .teamId("t1")
                .kind(MessageKind.INCIDENT_ALERT)
                .content("Fire drill")
                .recipient(RecipientSelector.roleInTeam(Role.MANAGER, "t1"))
                .build());

        assertThat(sender.liveMessages()).isEmpty();
        assertThat(peer.liveContents()).containsExactly("Fire drill");
    }

    @Test
    void taskNoticeStoresOneRecordPerDistinctAssignee() throws Exception {
        RecordingChannel w1 = connect("w1", Role.WORKER, "t1");

        RouteResult result = router.route(RoutedMessage.builder()
                .senderId("m1")
                .senderRole(Role.MANAGER)
                .teamId("t1")
                .kind(MessageKind.TASK_NOTICE)
                .content("Inspect pump 4")
                .recipient(RecipientSelector.users(List.of("w1", "w2", "w1")))
                .build());

        assertThat(w1.liveContents()).containsExactly("Inspect pump 4");
        assertThat(result.getPersisted().get()).hasSize(2);
        assertThat(store.records()).extracting(r -> r.getRecipient().singleUser()).containsExactly("w1", "w2");
    }

    @Test
    void agentResponseReachesWorkerAndTeamManagersButIsStoredOnceAsChat() throws Exception {
        RecordingChannel worker = connect("w1", Role.WORKER, "t1");
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");

        RouteResult result = router.route(RoutedMessage.builder()
                .senderId(RecipientSelector.AGENT_ID)
                .teamId("t1")
                .kind(MessageKind.AGENT_RESPONSE)
                .content("Your shift starts at 8")
                .recipient(RecipientSelector.user("w1"))
                .build());

        assertThat(result.getLivePushes()).isEqualTo(2);
        assertThat(worker.liveContents()).containsExactly("Your shift starts at 8");
        assertThat(manager.liveContents()).containsExactly("Your shift starts at 8");
        assertThat(result.getPersisted().get()).hasSize(1);
        assertThat(store.records().get(0).getKind()).isEqualTo(MessageKind.CHAT);
    }

    @Test
    void agentResponseIsNotMirroredWhenDisabled() {
        router = new MessageRouter(registry, store, agentGateway, DIRECT, false);
        connect("w1", Role.WORKER, "t1");
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");

        router.route(RoutedMessage.builder()
                .senderId(RecipientSelector.AGENT_ID)
                .teamId("t1")
                .kind(MessageKind.AGENT_RESPONSE)
                .content("ok")
                .recipient(RecipientSelector.user("w1"))
                .build());

        assertThat(manager.liveMessages()).isEmpty();
    }

    @Test
    void persistenceFailureSurfacesButLivePushIsNotRetracted() {
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");
        store.setFailPersist(true);

        RouteResult result = router.route(chat("w1", "m1", "are you there?"));

        assertThat(manager.liveContents()).containsExactly("are you there?");
        assertThatThrownBy(() -> result.getPersisted().get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(PersistenceException.class);
        assertThat(router.getPersistFailures()).isEqualTo(1);
    }

    @Test
    void rejectedPersistenceExecutorCompletesFutureExceptionally() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("full");
        };
        router = new MessageRouter(registry, store, agentGateway, rejecting, true);

        RouteResult result = router.route(chat("w1", "m1", "hi"));

        assertThat(result.getPersisted()).isCompletedExceptionally();
        assertThat(store.records()).isEmpty();
    }

    @Test
    void messagesToOneRecipientArriveInRoutingOrder() {
        RecordingChannel manager = connect("m1", Role.MANAGER, "t1");

        for (int i = 0; i < 50; i++) {
            router.route(chat("w1", "m1", "msg-" + i));
        }

        List<String> received = manager.liveContents();
        assertThat(received).hasSize(50);
        for (int i = 0; i < 50; i++) {
            assertThat(received.get(i)).isEqualTo("msg-" + i);
        }
    }

    @Test
    void chatToRoleSelectorIsRejected() {
        RoutedMessage message = chat("w1", "m1", "hi").toBuilder()
                .recipient(RecipientSelector.roleInTeam(Role.MANAGER, "t1"))
                .build();

        assertThatThrownBy(() -> router.route(message)).isInstanceOf(RoutingException.class);
        verify(agentGateway, never()).submit(any());
    }
}
