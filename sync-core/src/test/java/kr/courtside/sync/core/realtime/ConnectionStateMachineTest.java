package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.realtime.ConnectionState;
import kr.courtside.sync.api.realtime.Registration;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.TransportException;
import kr.courtside.sync.core.support.ManualTaskExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ConnectionStateMachineTest {

    private static final String CHANNEL = "realtime:matches";

    private ManualTaskExecutor executor;
    private Monitor monitor;
    private ConnectionStateMachine machine;
    private AtomicInteger reopens;
    private int channelsToReopen;

    @BeforeEach
    void setUp() {
        executor = new ManualTaskExecutor();
        monitor = mock(Monitor.class);
        machine = new ConnectionStateMachine(executor, new ReconnectionPolicy(1000, 30000, 2.0, 3), monitor);
        reopens = new AtomicInteger();
        channelsToReopen = 1;
        machine.addParticipant(() -> {
            reopens.incrementAndGet();
            return channelsToReopen;
        });
    }

    private void connect() {
        machine.channelOpening(CHANNEL);
        machine.channelSubscribed(CHANNEL);
    }

    private void fail() {
        machine.channelFailed(CHANNEL, ChannelStatus.CHANNEL_ERROR, new TransportException("connection reset"));
    }

    @Test
    void addListener_notifiesCurrentStateImmediately() {
        List<String> seen = new ArrayList<>();

        machine.addListener((previous, current) -> seen.add(previous + "->" + current));

        assertEquals(List.of("DISCONNECTED->DISCONNECTED"), seen);
    }

    @Test
    void openingThenSubscribed_reachesConnected() {
        List<ConnectionState> seen = new ArrayList<>();
        machine.addListener((previous, current) -> seen.add(current));

        connect();

        assertEquals(List.of(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING, ConnectionState.CONNECTED), seen);
        assertEquals(ConnectionState.CONNECTED, machine.state());
    }

    @Test
    void failure_schedulesReconnectAfterInitialDelay() {
        connect();

        fail();

        assertEquals(ConnectionState.RECONNECTING, machine.state());
        assertEquals(1, machine.attempts());
        assertTrue(machine.isReconnectPending());

        executor.advance(999);
        assertEquals(0, reopens.get());

        executor.advance(1);
        assertEquals(1, reopens.get());
        assertEquals(ConnectionState.CONNECTING, machine.state());
        assertFalse(machine.isReconnectPending());
    }

    @Test
    void repeatedFailures_backOffExponentiallyThenGiveUp() {
        connect();

        fail();
        executor.advance(1000);
        assertEquals(1, reopens.get());

        fail();
        executor.advance(1999);
        assertEquals(1, reopens.get());
        executor.advance(1);
        assertEquals(2, reopens.get());

        fail();
        executor.advance(3999);
        assertEquals(2, reopens.get());
        executor.advance(1);
        assertEquals(3, reopens.get());

        fail();
        assertEquals(ConnectionState.ERROR, machine.state());
        assertFalse(machine.isReconnectPending());
        assertEquals(0, executor.pendingTimers());
        verify(monitor).recordError(any(), anyMap());

        executor.advance(120_000);
        assertEquals(3, reopens.get());
    }

    @Test
    void successfulSubscribe_resetsAttempts() {
        connect();
        fail();
        executor.advance(1000);
        fail();
        assertEquals(2, machine.attempts());

        executor.advance(2000);
        machine.channelSubscribed(CHANNEL);
        assertEquals(0, machine.attempts());
        assertEquals(ConnectionState.CONNECTED, machine.state());

        fail();
        executor.advance(1000);
        assertEquals(3, reopens.get());
    }

    @Test
    void failuresWhileTimerPending_areCoalesced() {
        connect();

        fail();
        fail();
        machine.channelFailed("realtime:players", ChannelStatus.TIMED_OUT, null);

        assertEquals(1, machine.attempts());
        assertEquals(1, executor.pendingTimers());
        executor.advance(1000);
        assertEquals(1, reopens.get());
    }

    @Test
    void authError_reconnectsImmediatelyOnce_thenBacksOff() {
        connect();

        machine.channelFailed(CHANNEL, ChannelStatus.CHANNEL_ERROR, new TransportException("JWT expired"));
        assertEquals(1, reopens.get());
        assertEquals(0, machine.attempts());
        assertEquals(ConnectionState.CONNECTING, machine.state());

        machine.channelFailed(CHANNEL, ChannelStatus.CHANNEL_ERROR, new TransportException("JWT expired"));
        assertEquals(1, reopens.get());
        assertEquals(ConnectionState.RECONNECTING, machine.state());
        assertEquals(1, machine.attempts());
    }

    @Test
    void authBypass_isRestoredAfterConnected() {
        connect();
        machine.channelFailed(CHANNEL, ChannelStatus.CHANNEL_ERROR, new TransportException("JWT expired"));
        machine.channelSubscribed(CHANNEL);

        machine.channelFailed(CHANNEL, ChannelStatus.CHANNEL_ERROR, new TransportException("JWT expired"));

        assertEquals(2, reopens.get());
        assertFalse(machine.isReconnectPending());
    }

    @Test
    void connectivityLost_cancelsTimerAndIgnoresFailures() {
        connect();
        fail();

        machine.connectivityLost();

        assertEquals(ConnectionState.DISCONNECTED, machine.state());
        assertEquals(0, executor.pendingTimers());

        fail();
        assertEquals(ConnectionState.DISCONNECTED, machine.state());
        assertEquals(0, executor.pendingTimers());
        executor.advance(60_000);
        assertEquals(0, reopens.get());
    }

    @Test
    void connectivityRestored_reconnectsImmediatelyWithFreshAttempts() {
        connect();
        fail();
        machine.connectivityLost();

        machine.connectivityRestored();

        assertEquals(1, reopens.get());
        assertEquals(0, machine.attempts());
        assertEquals(ConnectionState.CONNECTING, machine.state());
    }

    @Test
    void manualReconnect_cancelsBackoffAndReopensNow() {
        connect();
        fail();

        machine.reconnect();

        assertEquals(1, reopens.get());
        assertEquals(0, machine.attempts());
        assertEquals(0, executor.pendingTimers());
    }

    @Test
    void manualReconnect_recoversFromExhaustion() {
        connect();
        for (int i = 0; i < 3; i++) {
            fail();
            executor.advance(10_000);
        }
        fail();
        assertEquals(ConnectionState.ERROR, machine.state());

        machine.reconnect();
        machine.channelSubscribed(CHANNEL);

        assertEquals(ConnectionState.CONNECTED, machine.state());
        fail();
        assertTrue(machine.isReconnectPending());
    }

    @Test
    void reconnect_withNothingToReopen_settlesDisconnected() {
        channelsToReopen = 0;
        List<ConnectionState> seen = new ArrayList<>();
        machine.addListener((previous, current) -> seen.add(current));

        machine.reconnect();

        assertEquals(ConnectionState.DISCONNECTED, machine.state());
        assertEquals(List.of(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING, ConnectionState.DISCONNECTED), seen);
    }

    @Test
    void reopenFailure_fallsBackToBackoff() {
        ConnectionStateMachine failing = new ConnectionStateMachine(executor, new ReconnectionPolicy(1000, 30000, 2.0, 3), monitor);
        failing.addParticipant(() -> {
            throw new IllegalStateException("boom");
        });

        failing.reconnect();

        assertEquals(ConnectionState.RECONNECTING, failing.state());
        assertTrue(failing.isReconnectPending());
    }

    @Test
    void registrationClose_stopsNotifications() {
        List<ConnectionState> seen = new ArrayList<>();
        Registration registration = machine.addListener((previous, current) -> seen.add(current));

        registration.close();
        connect();

        assertEquals(List.of(ConnectionState.DISCONNECTED), seen);
    }

    @Test
    void shutdown_cancelsTimerAndIgnoresLaterEvents() {
        connect();
        fail();

        machine.shutdown();
        executor.advance(60_000);
        machine.channelSubscribed(CHANNEL);

        assertEquals(ConnectionState.DISCONNECTED, machine.state());
        assertEquals(0, reopens.get());
        verify(monitor, never()).recordError(any(), anyMap());
    }
}
