package kr.courtside.sync.core.presence;

import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.presence.DerivedPresence;
import kr.courtside.sync.api.presence.PresenceActor;
import kr.courtside.sync.api.presence.PresenceHandle;
import kr.courtside.sync.api.presence.PresenceRecord;
import kr.courtside.sync.api.realtime.ConnectionState;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.PresenceEventKind;
import kr.courtside.sync.core.realtime.ConnectionStateMachine;
import kr.courtside.sync.core.realtime.ReconnectionPolicy;
import kr.courtside.sync.core.support.FakeChannel;
import kr.courtside.sync.core.support.FakeTransport;
import kr.courtside.sync.core.support.ManualTaskExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PresenceTrackerTest {

    private static final String SCOPE = "pd-42";
    private static final String CHANNEL = "presence:play_date:pd-42";

    private ManualTaskExecutor executor;
    private FakeTransport transport;
    private ConnectionStateMachine connection;
    private PresenceTracker tracker;

    @BeforeEach
    void setUp() {
        executor = new ManualTaskExecutor();
        transport = new FakeTransport();
        Monitor monitor = mock(Monitor.class);
        connection = new ConnectionStateMachine(executor, ReconnectionPolicy.defaults(), monitor);
        tracker = new PresenceTracker(transport, executor, monitor, PresenceSettings.defaults(), connection);
        tracker.start();
    }

    private PresenceHandle trackAndAck() {
        PresenceHandle handle = tracker.trackPresence(SCOPE, PresenceActor.of("kim", "Kim"));
        transport.latest(CHANNEL).ack();
        executor.runPending();
        return handle;
    }

    @Test
    void track_isInactiveUntilSubscribed() {
        PresenceHandle handle = tracker.trackPresence(SCOPE, PresenceActor.of("kim", "Kim"));

        assertFalse(handle.isActive());
        assertEquals(ConnectionState.DISCONNECTED, handle.state());
        assertTrue(transport.latest(CHANNEL).tracked().isEmpty());
        assertEquals(ConnectionState.CONNECTING, connection.state());
    }

    @Test
    void subscribed_publishesInitialRecordAndDerivesSelf() {
        PresenceHandle handle = trackAndAck();
        FakeChannel channel = transport.latest(CHANNEL);

        assertTrue(handle.isActive());
        assertEquals(ConnectionState.CONNECTED, handle.state());
        assertEquals(ConnectionState.CONNECTED, connection.state());
        PresenceRecord initial = channel.tracked().get(0);
        assertEquals("kim", initial.actorId());
        assertFalse(initial.playing());
        assertNull(initial.activityId());

        DerivedPresence self = tracker.getPresenceSnapshot(SCOPE).get("kim");
        assertTrue(self.online());
        assertEquals("Kim", self.displayName());
    }

    @Test
    void heartbeat_republishesOnFixedInterval() {
        trackAndAck();
        FakeChannel channel = transport.latest(CHANNEL);

        executor.advance(29_999);
        assertEquals(1, channel.tracked().size());

        executor.advance(1);
        assertEquals(2, channel.tracked().size());

        executor.advance(30_000);
        assertEquals(3, channel.tracked().size());
        assertEquals(Instant.ofEpochMilli(executor.currentTimeMillis()), channel.tracked().get(2).lastSeenAt());
    }

    @Test
    void updateActivity_publishesImmediately() {
        PresenceHandle handle = trackAndAck();
        FakeChannel channel = transport.latest(CHANNEL);

        tracker.updateActivity(handle, "match-3");

        PresenceRecord latest = channel.tracked().get(channel.tracked().size() - 1);
        assertTrue(latest.playing());
        assertEquals("match-3", latest.activityId());

        handle.updateActivity(null);
        latest = channel.tracked().get(channel.tracked().size() - 1);
        assertFalse(latest.playing());
    }

    @Test
    void remoteJoinAndLeave_updateSnapshotAndHistory() {
        trackAndAck();
        FakeChannel channel = transport.latest(CHANNEL);

        channel.putMember(new PresenceRecord("lee", "Lee", Instant.ofEpochMilli(executor.currentTimeMillis()), true, "match-1"));
        channel.firePresence(PresenceEventKind.JOIN, "lee");
        executor.runPending();

        Map<String, DerivedPresence> snapshot = tracker.getPresenceSnapshot(SCOPE);
        assertEquals(List.of("kim", "lee"), List.copyOf(snapshot.keySet()));
        assertTrue(snapshot.get("lee").playing());

        channel.removeMember("lee");
        channel.firePresence(PresenceEventKind.LEAVE, "lee");
        executor.runPending();

        assertFalse(tracker.getPresenceSnapshot(SCOPE).containsKey("lee"));
        List<PresenceHistory.Entry> entries = tracker.history().entries();
        assertEquals(PresenceHistory.Action.LEAVE, entries.get(0).action());
        assertEquals("lee", entries.get(0).actorId());
        assertEquals(PresenceHistory.Action.JOIN, entries.get(1).action());
        assertEquals(2, tracker.analytics(SCOPE).joins());
    }

    @Test
    void staleMember_isReportedOffline() {
        PresenceHandle handle = trackAndAck();
        FakeChannel channel = transport.latest(CHANNEL);
        channel.putMember(new PresenceRecord("lee", "Lee",
                Instant.ofEpochMilli(executor.currentTimeMillis() - 90_000), true, "match-1"));

        handle.refresh();

        DerivedPresence lee = handle.snapshot().get("lee");
        assertFalse(lee.online());
        assertFalse(lee.playing());
    }

    @Test
    void bindFailure_releasesOpenedChannel() {
        transport.failBindings("binding rejected");

        PresenceHandle handle = tracker.trackPresence(SCOPE, PresenceActor.of("kim", "Kim"));

        FakeChannel opened = transport.latest(CHANNEL);
        assertTrue(opened.isClosed());
        assertEquals(0, opened.subscribeCalls());
        assertFalse(handle.isActive());
        assertEquals(ConnectionState.ERROR, handle.state());
    }

    @Test
    void channelFailure_reconnectsThroughStateMachine() {
        PresenceHandle handle = trackAndAck();
        FakeChannel first = transport.latest(CHANNEL);

        first.status(ChannelStatus.CHANNEL_ERROR, null);
        executor.runPending();

        assertFalse(handle.isActive());
        assertEquals(ConnectionState.ERROR, handle.state());
        assertEquals(ConnectionState.RECONNECTING, connection.state());

        executor.advance(1_000);
        FakeChannel second = transport.latest(CHANNEL);
        assertNotSame(first, second);
        assertTrue(first.isClosed());

        first.ack();
        executor.runPending();
        assertFalse(handle.isActive());

        second.ack();
        executor.runPending();
        assertTrue(handle.isActive());
        assertEquals(1, second.tracked().size());
    }

    @Test
    void close_untracksAndReleasesChannel() {
        PresenceHandle handle = trackAndAck();
        FakeChannel channel = transport.latest(CHANNEL);

        handle.close();
        handle.close();

        assertEquals(1, channel.untrackCalls());
        assertTrue(channel.isClosed());
        assertEquals(0, tracker.activeSessions());
        assertTrue(tracker.getPresenceSnapshot(SCOPE).isEmpty());

        executor.advance(60_000);
        assertEquals(1, channel.tracked().size());
    }

    @Test
    void trackingSameScopeAgain_replacesPreviousSession() {
        PresenceHandle first = trackAndAck();
        FakeChannel firstChannel = transport.latest(CHANNEL);

        PresenceHandle second = tracker.trackPresence(SCOPE, PresenceActor.of("kim", "Kim"));

        assertFalse(first.isActive());
        assertTrue(firstChannel.isClosed());
        assertEquals(1, tracker.activeSessions());
        assertNotSame(firstChannel, transport.latest(CHANNEL));
        assertEquals(SCOPE, second.scopeId());
    }

    @Test
    void stop_closesEverySession() {
        trackAndAck();
        tracker.trackPresence("pd-43", PresenceActor.of("kim", "Kim"));

        tracker.stop();

        assertEquals(0, tracker.activeSessions());
        assertTrue(transport.live().isEmpty());
    }
}
