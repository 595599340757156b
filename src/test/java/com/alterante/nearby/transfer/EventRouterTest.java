package com.alterante.nearby.transfer;

import com.alterante.nearby.engine.ChannelMessage;
import com.alterante.nearby.engine.Direction;
import com.alterante.nearby.engine.EndpointInfo;
import com.alterante.nearby.engine.EngineException;
import com.alterante.nearby.engine.PayloadKind;
import com.alterante.nearby.engine.ProtocolEvent;
import com.alterante.nearby.engine.ProtocolState;
import com.alterante.nearby.engine.TransferAction;
import com.alterante.nearby.engine.TransferMetadata;
import com.alterante.nearby.observe.Milestone;
import com.alterante.nearby.observe.MilestoneSink;
import com.alterante.nearby.observe.NotificationAction;
import com.alterante.nearby.observe.SessionObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class EventRouterTest {

    private static final Path DOWNLOADS = Path.of("/home/user/Downloads");

    private final TransferStore store = new TransferStore();
    private final List<String> observed = new CopyOnWriteArrayList<>();
    private final List<Milestone> published = new CopyOnWriteArrayList<>();
    private final List<String> withdrawn = new CopyOnWriteArrayList<>();
    private final List<ChannelMessage> sentActions = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
    private boolean engineFails;

    private final SessionObserver observer = new SessionObserver() {
        @Override
        public void outboundChanged(OutboundSession session, TransferState previous) {
            observed.add("outbound " + session.id() + " " + previous + "->" + session.state());
        }

        @Override
        public void inboundChanged(InboundSession session) {
            observed.add("inbound " + session.transferId() + " " + session.stage());
        }

        @Override
        public void inboundClosed(InboundSession session) {
            observed.add("closed " + session.transferId());
        }
    };

    private final MilestoneSink milestones = new MilestoneSink() {
        @Override
        public void publish(Milestone milestone) {
            published.add(milestone);
        }

        @Override
        public void withdraw(String notificationId) {
            withdrawn.add(notificationId);
        }
    };

    private EventRouter router(Duration consentTimeout) {
        ActionSink actions = (id, action) -> {
            if (engineFails) throw new EngineException("engine down");
            sentActions.add(ChannelMessage.lib(id, action));
        };
        return new EventRouter(store, observer, milestones, actions, timers, Runnable::run,
                consentTimeout, () -> DOWNLOADS);
    }

    @AfterEach
    void tearDown() {
        timers.shutdownNow();
    }

    private static ChannelMessage client(String id, Direction dir, ProtocolState state) {
        return ChannelMessage.client(new ProtocolEvent(id, dir, state));
    }

    private static ChannelMessage client(String id, Direction dir, ProtocolState state, TransferMetadata meta) {
        return ChannelMessage.client(new ProtocolEvent(id, dir, state, meta));
    }

    private static ChannelMessage consentRequest(String id, Direction dir) {
        return client(id, dir, ProtocolState.WAITING_FOR_USER_CONSENT,
                new TransferMetadata(2048, 0, "1234", PayloadKind.FILES, List.of("a.jpg", "b.jpg"), null, null, "Galaxy"));
    }

    private void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not met in time");
            Thread.sleep(10);
        }
    }

    private List<String> snapshot() {
        List<String> out = new ArrayList<>();
        for (OutboundSession s : store.outboundSessions()) {
            out.add(s.id() + " " + s.state() + " " + s.lastEvent() + " " + s.eta().totalTransferred());
        }
        out.add("inbound " + store.inbound().map(InboundSession::toString).orElse("-"));
        return out;
    }

    // ---- dropping ----

    @Test
    void engineInternalMessagesLeaveEverythingUnchanged() {
        EventRouter router = router(Duration.ofMinutes(1));
        store.upsertEndpoint(new EndpointInfo("dev1", "Pixel", null, 0, true));
        store.upsertEndpoint(new EndpointInfo("dev2", "Mac", null, 0, true));
        router.route(client("dev2", Direction.OUTBOUND, ProtocolState.SENDING_FILES, TransferMetadata.progress(100, 10)));
        router.route(consentRequest("t1", Direction.INBOUND));
        List<String> before = snapshot();
        int observedBefore = observed.size();

        for (int i = 0; i < 50; i++) {
            TransferAction action = TransferAction.values()[i % TransferAction.values().length];
            String id = switch (i % 4) {
                case 0 -> "dev1";
                case 1 -> "dev2";
                case 2 -> "t1";
                default -> "other-" + i;
            };
            router.route(ChannelMessage.lib(id, action));
        }

        assertEquals(before, snapshot());
        assertEquals(observedBefore, observed.size());
    }

    @Test
    void handshakeStatesAreIgnored() {
        EventRouter router = router(Duration.ofMinutes(1));
        store.upsertEndpoint(new EndpointInfo("dev1", "Pixel", null, 0, true));
        for (ProtocolState ps : List.of(ProtocolState.INITIAL, ProtocolState.RECEIVED_CONNECTION_REQUEST,
                ProtocolState.SENT_UKEY_SERVER_INIT, ProtocolState.RECEIVED_PAIRED_KEY_RESULT)) {
            router.route(client("dev1", Direction.OUTBOUND, ps));
        }
        OutboundSession s = store.outbound("dev1").orElseThrow();
        assertEquals(TransferState.AWAITING_CONSENT_OR_IDLE, s.state());
        assertNull(s.lastEvent());
        assertTrue(observed.isEmpty());
    }

    @Test
    void unknownOutboundIdIsDropped() {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(client("ghost", Direction.OUTBOUND, ProtocolState.SENDING_FILES));
        assertEquals(0, store.outboundCount());
        assertTrue(observed.isEmpty());
    }

    @Test
    void staleInboundIdIsDropped() {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        InboundSession s = store.inbound().orElseThrow();

        router.route(client("t9", Direction.INBOUND, ProtocolState.FINISHED));

        assertSame(s, store.inbound().orElseThrow());
        assertEquals(ProtocolState.WAITING_FOR_USER_CONSENT, s.lastEvent().state());
    }

    // ---- outbound ----

    @Test
    void outboundEventsDriveTheSession() {
        EventRouter router = router(Duration.ofMinutes(1));
        store.upsertEndpoint(new EndpointInfo("dev1", "Pixel", null, 0, true));
        router.route(client("dev1", Direction.OUTBOUND, ProtocolState.SENT_INTRODUCTION));
        router.route(client("dev1", Direction.OUTBOUND, ProtocolState.SENDING_FILES, TransferMetadata.progress(100, 50)));
        router.route(client("dev1", Direction.OUTBOUND, ProtocolState.FINISHED));

        assertEquals(List.of(
                "outbound dev1 AWAITING_CONSENT_OR_IDLE->REQUESTED_FOR_CONSENT",
                "outbound dev1 REQUESTED_FOR_CONSENT->ONGOING_TRANSFER",
                "outbound dev1 ONGOING_TRANSFER->DONE"), observed);
    }

    // ---- inbound ----

    @Test
    void consentRequestStartsInboundRegardlessOfDirection() {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.OUTBOUND));

        InboundSession s = store.inbound().orElseThrow();
        assertEquals("t1", s.transferId());
        assertEquals(1, published.size());
        Milestone m = published.get(0);
        assertEquals(Milestone.Kind.INCOMING_REQUEST, m.kind());
        assertEquals("Galaxy", m.title());
        assertEquals("Galaxy wants to share 2 files", m.body());
        assertEquals(List.of(NotificationAction.CONSENT_ACCEPT, NotificationAction.CONSENT_DECLINE), m.actions());
        assertEquals(s.notificationId(), m.notificationId());
    }

    @Test
    void secondRequestWhileOccupiedIsDeclined() {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        router.route(consentRequest("t2", Direction.INBOUND));

        assertEquals("t1", store.inbound().orElseThrow().transferId());
        assertEquals(List.of(ChannelMessage.lib("t2", TransferAction.CONSENT_DECLINE)), sentActions);
    }

    @Test
    void duplicateRequestIsIgnored() {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        InboundSession s = store.inbound().orElseThrow();
        router.route(consentRequest("t1", Direction.INBOUND));

        assertSame(s, store.inbound().orElseThrow());
        assertTrue(sentActions.isEmpty());
        assertEquals(1, published.size());
    }

    @Test
    void unansweredRequestTimesOutExactlyOnce() throws Exception {
        EventRouter router = router(Duration.ofMillis(100));
        router.route(consentRequest("t1", Direction.INBOUND));
        InboundSession s = store.inbound().orElseThrow();

        await(s::isTimedOut);
        Thread.sleep(300);

        assertEquals(List.of(ChannelMessage.lib("t1", TransferAction.CONSENT_DECLINE)), sentActions);
        assertEquals(InboundStage.DECLINED, s.stage());
        assertEquals(1, published.stream().filter(m -> m.kind() == Milestone.Kind.REQUEST_TIMED_OUT).count());
        assertEquals(List.of(s.notificationId()), withdrawn);
        assertTrue(s.autoDecline().hasFired());
    }

    @Test
    void acceptBeforeDeadlinePreventsTimeout() throws Exception {
        EventRouter router = router(Duration.ofMillis(300));
        router.route(consentRequest("t1", Direction.INBOUND));
        InboundSession s = store.inbound().orElseThrow();

        assertTrue(router.applyUserAction(s, UserAction.CONSENT_ACCEPT));
        Thread.sleep(600);

        assertEquals(List.of(ChannelMessage.lib("t1", TransferAction.CONSENT_ACCEPT)), sentActions);
        assertFalse(s.isTimedOut());
        assertFalse(s.autoDecline().hasFired());
        assertEquals(InboundStage.IN_PROGRESS, s.stage());
        Milestone last = published.get(published.size() - 1);
        assertEquals(Milestone.Kind.TRANSFER_PROGRESS, last.kind());
        assertEquals(List.of(NotificationAction.TRANSFER_CANCEL), last.actions());
    }

    @Test
    void engineFailureLeavesSessionUntouched() {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        InboundSession s = store.inbound().orElseThrow();
        engineFails = true;

        assertThrows(EngineException.class, () -> router.applyUserAction(s, UserAction.CONSENT_ACCEPT));
        assertTrue(s.userAction().isEmpty());
        assertEquals(InboundStage.AWAITING_CONSENT, s.stage());
    }

    @Test
    void actionOutOfPhaseIsRefused() throws Exception {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        InboundSession s = store.inbound().orElseThrow();

        assertFalse(router.applyUserAction(s, UserAction.TRANSFER_CANCEL));
        assertTrue(sentActions.isEmpty());
    }

    @Test
    void finishedFilesPublishOpenFolderAndReleaseSlot() throws Exception {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        InboundSession s = store.inbound().orElseThrow();
        router.applyUserAction(s, UserAction.CONSENT_ACCEPT);

        router.route(client("t1", Direction.INBOUND, ProtocolState.RECEIVING_FILES, TransferMetadata.progress(2048, 1024)));
        router.route(client("t1", Direction.INBOUND, ProtocolState.FINISHED));

        assertTrue(store.inbound().isEmpty());
        Milestone done = published.get(published.size() - 1);
        assertEquals(Milestone.Kind.TRANSFER_FINISHED, done.kind());
        assertEquals("Received 2 files", done.body());
        assertEquals(List.of(NotificationAction.OPEN_FOLDER), done.actions());
        assertEquals(DOWNLOADS.toString(), done.parameter());
        assertEquals("closed t1", observed.get(observed.size() - 1));
    }

    @Test
    void finishedTextPublishesCopyText() throws Exception {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(client("t1", Direction.INBOUND, ProtocolState.WAITING_FOR_USER_CONSENT,
                new TransferMetadata(0, 0, "1111", PayloadKind.TEXT, null, "hello...", null, "Pixel")));
        InboundSession s = store.inbound().orElseThrow();
        assertEquals("Pixel wants to share \"hello...\"", published.get(0).body());
        router.applyUserAction(s, UserAction.CONSENT_ACCEPT);

        router.route(client("t1", Direction.INBOUND, ProtocolState.FINISHED,
                new TransferMetadata(0, 0, null, PayloadKind.TEXT, null, null, "hello world", "Pixel")));

        Milestone done = published.get(published.size() - 1);
        assertEquals(List.of(NotificationAction.COPY_TEXT), done.actions());
        assertEquals("hello world", done.parameter());
    }

    @Test
    void cancelledBySenderIsReportedButOwnCancelIsNot() throws Exception {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        router.applyUserAction(store.inbound().orElseThrow(), UserAction.CONSENT_ACCEPT);
        router.route(client("t1", Direction.INBOUND, ProtocolState.CANCELLED));
        assertEquals(Milestone.Kind.TRANSFER_CANCELLED, published.get(published.size() - 1).kind());
        assertEquals("Transfer cancelled by sender", published.get(published.size() - 1).body());

        published.clear();
        router.route(consentRequest("t2", Direction.INBOUND));
        InboundSession own = store.inbound().orElseThrow();
        router.applyUserAction(own, UserAction.CONSENT_ACCEPT);
        router.applyUserAction(own, UserAction.TRANSFER_CANCEL);
        router.route(client("t2", Direction.INBOUND, ProtocolState.CANCELLED));
        assertTrue(published.stream().noneMatch(m -> m.kind() == Milestone.Kind.TRANSFER_CANCELLED));
        assertTrue(store.inbound().isEmpty());
    }

    @Test
    void disconnectionIsReported() {
        EventRouter router = router(Duration.ofMinutes(1));
        router.route(consentRequest("t1", Direction.INBOUND));
        router.route(client("t1", Direction.INBOUND, ProtocolState.DISCONNECTED));

        Milestone m = published.get(published.size() - 1);
        assertEquals(Milestone.Kind.TRANSFER_FAILED, m.kind());
        assertEquals("Unexpected disconnection", m.body());
        assertTrue(store.inbound().isEmpty());
    }
}
