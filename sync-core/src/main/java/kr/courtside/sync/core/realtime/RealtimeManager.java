package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.lifecycle.ManagedLifecycle;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.realtime.AsyncChangeCallback;
import kr.courtside.sync.api.realtime.ConnectionState;
import kr.courtside.sync.api.realtime.ConnectionStateListener;
import kr.courtside.sync.api.realtime.RealtimeService;
import kr.courtside.sync.api.realtime.RealtimeSubscription;
import kr.courtside.sync.api.realtime.Registration;
import kr.courtside.sync.api.realtime.SubscriptionSpec;
import kr.courtside.sync.api.transport.RealtimeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Channel registry and connection state machine wired together behind {@link RealtimeService}.
 * Calls from other threads are marshalled onto the event loop.
 */
public final class RealtimeManager implements RealtimeService, ManagedLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeManager.class);
    private static final int POOR_QUALITY_THRESHOLD = 50;

    private final TaskExecutor executor;
    private final Monitor monitor;
    private final ConnectionStateMachine connection;
    private final ChannelRegistry registry;
    private final ConnectionMetrics metrics;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public RealtimeManager(RealtimeTransport transport, TaskExecutor executor, Monitor monitor, RealtimeSettings settings) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        Objects.requireNonNull(settings, "settings");
        this.connection = new ConnectionStateMachine(executor, settings.reconnectionPolicy(), monitor);
        this.registry = new ChannelRegistry(transport, executor, monitor, settings, connection);
        this.metrics = new ConnectionMetrics(executor);
        connection.addParticipant(registry);
        connection.addListener(metrics);
        connection.addListener(this::reportQuality);
    }

    @Override
    public void start() {
        LOGGER.info("실시간 매니저를 시작합니다");
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        runOnLoop(() -> {
            registry.unsubscribeAll();
            connection.shutdown();
        });
    }

    @Override
    public RealtimeSubscription subscribe(SubscriptionSpec spec, AsyncChangeCallback callback, Consumer<Throwable> onError) {
        if (stopped.get()) {
            throw new IllegalStateException("RealtimeManager is stopped");
        }
        return registry.subscribe(spec, callback, onError);
    }

    @Override
    public ConnectionState getConnectionState() {
        return connection.state();
    }

    @Override
    public Registration onConnectionStateChange(ConnectionStateListener listener) {
        Preconditions.checkNotNull(listener, "listener");
        AtomicBoolean closed = new AtomicBoolean(false);
        AtomicReference<Registration> registration = new AtomicReference<>();
        runOnLoop(() -> {
            if (!closed.get()) {
                registration.set(connection.addListener(listener));
            }
        });
        return () -> {
            if (closed.compareAndSet(false, true)) {
                runOnLoop(() -> {
                    Registration current = registration.getAndSet(null);
                    if (current != null) {
                        current.close();
                    }
                });
            }
        };
    }

    @Override
    public void reconnect() {
        runOnLoop(connection::reconnect);
    }

    @Override
    public void connectivityRestored() {
        runOnLoop(connection::connectivityRestored);
    }

    @Override
    public void connectivityLost() {
        runOnLoop(connection::connectivityLost);
    }

    @Override
    public void unsubscribeAll() {
        registry.unsubscribeAll();
    }

    public ConnectionStateMachine connection() {
        return connection;
    }

    public ChannelRegistry registry() {
        return registry;
    }

    public ConnectionMetrics metrics() {
        return metrics;
    }

    private void reportQuality(ConnectionState previous, ConnectionState current) {
        if (previous == current || current != ConnectionState.CONNECTED) {
            return;
        }
        int quality = metrics.quality();
        monitor.recordMetric("connection_quality", quality, Map.of("component", "RealtimeManager"));
        if (metrics.totalDisconnectedMillis() > 0) {
            monitor.recordMetric("connection_downtime", metrics.totalDisconnectedMillis(), Map.of("component", "RealtimeManager"));
        }
        if (quality < POOR_QUALITY_THRESHOLD) {
            LOGGER.warn("연결 품질이 낮습니다: {}점 (시도 {}, 실패 {})", quality, metrics.connectionAttempts(), metrics.failedConnections());
        }
    }

    private void runOnLoop(Runnable task) {
        if (executor.inEventLoop()) {
            task.run();
        } else {
            executor.execute(task);
        }
    }
}
