package kr.courtside.sync.core.presence;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.lifecycle.ManagedLifecycle;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.presence.DerivedPresence;
import kr.courtside.sync.api.presence.PresenceActor;
import kr.courtside.sync.api.presence.PresenceHandle;
import kr.courtside.sync.api.presence.PresenceService;
import kr.courtside.sync.api.transport.RealtimeTransport;
import kr.courtside.sync.core.realtime.ConnectionStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 스코프별 {@link PresenceSession}을 만들고 연결 상태 머신의 재연결 대상으로 등록한다.
 * 같은 스코프를 다시 추적하면 이전 세션을 닫고 새 세션으로 바꾼다.
 */
public final class PresenceTracker implements PresenceService, ManagedLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(PresenceTracker.class);

    private final RealtimeTransport transport;
    private final TaskExecutor executor;
    private final Monitor monitor;
    private final PresenceSettings settings;
    private final ConnectionStateMachine connection;
    private final PresenceHistory history;
    private final Map<String, PresenceSession> sessions = new ConcurrentHashMap<>();

    public PresenceTracker(RealtimeTransport transport,
                           TaskExecutor executor,
                           Monitor monitor,
                           PresenceSettings settings,
                           ConnectionStateMachine connection) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.history = new PresenceHistory(settings.historySize());
    }

    @Override
    public void start() {
        LOGGER.info("프레즌스 추적기를 시작합니다 (heartbeat {}ms, offline {}ms)",
                settings.heartbeatIntervalMillis(), settings.offlineTimeoutMillis());
    }

    @Override
    public void stop() {
        for (PresenceSession session : new ArrayList<>(sessions.values())) {
            session.close();
        }
    }

    @Override
    public PresenceHandle trackPresence(String scopeId, PresenceActor actor) {
        Preconditions.checkNotBlank(scopeId, "scopeId");
        Preconditions.checkNotNull(actor, "actor");
        PresenceSession session = new PresenceSession(scopeId, actor, transport, executor, monitor, settings,
                connection, history, this::onSessionClosed);
        PresenceSession previous = sessions.put(scopeId, session);
        if (previous != null) {
            LOGGER.info("스코프 '{}'의 기존 프레즌스 세션을 교체합니다", scopeId);
            previous.close();
        }
        connection.addParticipant(session);
        session.start();
        return session;
    }

    @Override
    public Map<String, DerivedPresence> getPresenceSnapshot(String scopeId) {
        PresenceSession session = sessions.get(scopeId);
        return session == null ? Map.of() : session.snapshot();
    }

    public PresenceHistory history() {
        return history;
    }

    public PresenceHistory.Analytics analytics(String scopeId) {
        return history.analytics(scopeId, Instant.ofEpochMilli(executor.currentTimeMillis()));
    }

    public int activeSessions() {
        return sessions.size();
    }

    private void onSessionClosed(PresenceSession session) {
        sessions.remove(session.scopeId(), session);
        connection.removeParticipant(session);
    }
}
