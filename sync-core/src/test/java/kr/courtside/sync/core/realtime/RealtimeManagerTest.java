package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.realtime.ConnectionState;
import kr.courtside.sync.api.realtime.EventType;
import kr.courtside.sync.api.realtime.RealtimeSubscription;
import kr.courtside.sync.api.realtime.Registration;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.TransportException;
import kr.courtside.sync.core.support.FakeChannel;
import kr.courtside.sync.core.support.FakeTransport;
import kr.courtside.sync.core.support.ManualTaskExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RealtimeManagerTest {

    private static final String MATCHES = "realtime:matches";

    private ManualTaskExecutor executor;
    private FakeTransport transport;
    private Monitor monitor;
    private RealtimeManager manager;

    @BeforeEach
    void setUp() {
        executor = new ManualTaskExecutor();
        transport = new FakeTransport();
        monitor = mock(Monitor.class);
        manager = new RealtimeManager(transport, executor, monitor, RealtimeSettings.defaults());
        manager.start();
    }

    @Test
    void subscribeAndAck_connectsAndDeliversEvents() {
        List<ChangeEvent> received = new ArrayList<>();
        manager.subscribe("matches", null, received::add);
        assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());

        FakeChannel channel = transport.latest(MATCHES);
        channel.ack();
        channel.emit(ChangeEvent.of("matches", EventType.INSERT, Map.of("id", 3), null));
        executor.runPending();

        assertEquals(ConnectionState.CONNECTED, manager.getConnectionState());
        assertEquals(1, received.size());
        verify(monitor).recordMetric(eq("connection_quality"), anyDouble(), anyMap());
    }

    @Test
    void channelError_backsOffThenReopensEveryChannel() {
        manager.subscribe("matches", null, event -> { });
        manager.subscribe("players", "team_id=eq.4", event -> { });
        transport.opened().forEach(FakeChannel::ack);
        executor.runPending();

        transport.latest(MATCHES).status(ChannelStatus.CHANNEL_ERROR, new TransportException("connection reset"));
        executor.runPending();
        assertEquals(ConnectionState.RECONNECTING, manager.getConnectionState());
        assertEquals(2, transport.live().size());

        executor.advance(1_000);

        assertEquals(4, transport.opened().size());
        assertEquals(2, transport.live().size());
        assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());

        transport.live().forEach(FakeChannel::ack);
        executor.runPending();
        assertEquals(ConnectionState.CONNECTED, manager.getConnectionState());
        assertEquals(1, manager.metrics().failedConnections());
    }

    @Test
    void stateListener_seesFullReconnectCycle() {
        List<ConnectionState> states = new ArrayList<>();
        manager.onConnectionStateChange((previous, current) -> states.add(current));
        manager.subscribe("matches", null, event -> { });
        transport.latest(MATCHES).ack();
        executor.runPending();

        transport.latest(MATCHES).status(ChannelStatus.TIMED_OUT, null);
        executor.runPending();
        executor.advance(1_000);
        transport.latest(MATCHES).ack();
        executor.runPending();

        assertEquals(List.of(
                ConnectionState.DISCONNECTED,
                ConnectionState.CONNECTING,
                ConnectionState.CONNECTED,
                ConnectionState.ERROR,
                ConnectionState.RECONNECTING,
                ConnectionState.CONNECTING,
                ConnectionState.CONNECTED), states);
    }

    @Test
    void closedStateRegistration_stopsReceiving() {
        List<ConnectionState> states = new ArrayList<>();
        Registration registration = manager.onConnectionStateChange((previous, current) -> states.add(current));

        registration.close();
        manager.subscribe("matches", null, event -> { });

        assertEquals(List.of(ConnectionState.DISCONNECTED), states);
    }

    @Test
    void connectivityLostAndRestored_reopensImmediately() {
        manager.subscribe("matches", null, event -> { });
        transport.latest(MATCHES).ack();
        executor.runPending();

        manager.connectivityLost();
        assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());

        manager.connectivityRestored();
        assertEquals(2, transport.opened().size());
        assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());
    }

    @Test
    void lastUnsubscribe_closesTransportChannel() {
        RealtimeSubscription subscription = manager.subscribe("matches", null, event -> { });

        subscription.close();

        assertTrue(transport.latest(MATCHES).isClosed());
        assertEquals(0, manager.registry().channelCount());
    }

    @Test
    void stop_closesChannelsAndRejectsNewSubscriptions() {
        manager.subscribe("matches", null, event -> { });

        manager.stop();

        assertTrue(transport.latest(MATCHES).isClosed());
        assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
        assertThrows(IllegalStateException.class, () -> manager.subscribe("matches", null, event -> { }));
    }
}
