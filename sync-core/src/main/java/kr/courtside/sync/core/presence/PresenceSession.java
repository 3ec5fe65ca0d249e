package kr.courtside.sync.core.presence;

import kr.courtside.sync.api.executor.ScheduledTask;
import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.presence.DerivedPresence;
import kr.courtside.sync.api.presence.PresenceActor;
import kr.courtside.sync.api.presence.PresenceHandle;
import kr.courtside.sync.api.presence.PresenceRecord;
import kr.courtside.sync.api.realtime.ConnectionState;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.PresenceEventKind;
import kr.courtside.sync.api.transport.RealtimeTransport;
import kr.courtside.sync.api.transport.TransportChannel;
import kr.courtside.sync.api.transport.TransportException;
import kr.courtside.sync.core.realtime.ChannelLifecycleListener;
import kr.courtside.sync.core.realtime.ChannelNames;
import kr.courtside.sync.core.realtime.ReconnectParticipant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 한 스코프의 프레즌스 채널, 하트비트 타이머, 파생 프레즌스 맵을 소유한다.
 * <p>
 * 구독 확인 직후 로컬 사용자의 레코드를 발행하고 고정 주기로 다시 발행한다. sync/join/leave 알림마다
 * 채널의 전체 멤버십으로 파생 맵을 새로 계산한다. 재연결 시에는 채널을 처음부터 다시 열며,
 * 이전 세대 채널의 콜백은 무시된다.
 */
public final class PresenceSession implements PresenceHandle, ReconnectParticipant {

    private static final Logger LOGGER = LoggerFactory.getLogger(PresenceSession.class);

    private final String scopeId;
    private final PresenceActor actor;
    private final String channelName;
    private final RealtimeTransport transport;
    private final TaskExecutor executor;
    private final Monitor monitor;
    private final PresenceSettings settings;
    private final ChannelLifecycleListener lifecycle;
    private final PresenceHistory history;
    private final Consumer<PresenceSession> onClose;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TransportChannel channel;
    private long generation;
    private ScheduledTask heartbeat;
    private String activityId;
    private volatile boolean active;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Map<String, DerivedPresence> derived = Collections.emptyMap();

    PresenceSession(String scopeId,
                    PresenceActor actor,
                    RealtimeTransport transport,
                    TaskExecutor executor,
                    Monitor monitor,
                    PresenceSettings settings,
                    ChannelLifecycleListener lifecycle,
                    PresenceHistory history,
                    Consumer<PresenceSession> onClose) {
        this.scopeId = Objects.requireNonNull(scopeId, "scopeId");
        this.actor = Objects.requireNonNull(actor, "actor");
        this.channelName = ChannelNames.presence(scopeId);
        this.transport = Objects.requireNonNull(transport, "transport");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.history = Objects.requireNonNull(history, "history");
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    void start() {
        if (closed.get() || !started.compareAndSet(false, true)) {
            return;
        }
        runOnLoop(() -> {
            LOGGER.info("스코프 '{}'의 프레즌스 추적을 시작합니다 ({})", scopeId, actor.actorId());
            open();
        });
    }

    @Override
    public String scopeId() {
        return scopeId;
    }

    @Override
    public PresenceActor actor() {
        return actor;
    }

    @Override
    public void updateActivity(String newActivityId) {
        runOnLoop(() -> {
            if (closed.get()) {
                return;
            }
            activityId = newActivityId == null || newActivityId.isBlank() ? null : newActivityId;
            if (active) {
                publish("activity");
            }
        });
    }

    @Override
    public void refresh() {
        runOnLoop(this::recompute);
    }

    @Override
    public Map<String, DerivedPresence> snapshot() {
        return derived;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public ConnectionState state() {
        return state;
    }

    public String channelName() {
        return channelName;
    }

    @Override
    public int reopen() {
        if (closed.get() || !started.get()) {
            return 0;
        }
        stopHeartbeat();
        active = false;
        closeChannel(channel, false);
        channel = null;
        open();
        return 1;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        runOnLoop(() -> {
            generation++;
            stopHeartbeat();
            active = false;
            state = ConnectionState.DISCONNECTED;
            derived = Collections.emptyMap();
            TransportChannel current = channel;
            channel = null;
            closeChannel(current, true);
            LOGGER.info("스코프 '{}'의 프레즌스 추적을 종료합니다", scopeId);
            onClose.accept(this);
        });
    }

    private void open() {
        long current = ++generation;
        lifecycle.channelOpening(channelName);
        TransportChannel opened = null;
        try {
            opened = transport.openChannel(channelName);
            opened.onPresence((kind, key) -> executor.execute(() -> onPresenceEvent(current, kind)));
        } catch (Exception e) {
            closeChannel(opened, false);
            onStatus(current, ChannelStatus.CHANNEL_ERROR, new TransportException("프레즌스 채널 열기 실패: " + channelName, e));
            return;
        }
        channel = opened;
        try {
            opened.subscribe((status, cause) -> executor.execute(() -> onStatus(current, status, cause)))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            executor.execute(() -> onStatus(current, ChannelStatus.CHANNEL_ERROR, unwrap(error)));
                        }
                    });
        } catch (Exception e) {
            onStatus(current, ChannelStatus.CHANNEL_ERROR, e);
        }
    }

    private void onStatus(long expectedGeneration, ChannelStatus status, Throwable cause) {
        if (expectedGeneration != generation || closed.get()) {
            return;
        }
        if (status == ChannelStatus.SUBSCRIBED) {
            state = ConnectionState.CONNECTED;
            active = true;
            lifecycle.channelSubscribed(channelName);
            publish("initial");
            startHeartbeat();
            recompute();
            return;
        }
        stopHeartbeat();
        active = false;
        state = status == ChannelStatus.CLOSED ? ConnectionState.DISCONNECTED : ConnectionState.ERROR;
        LOGGER.warn("프레즌스 채널 '{}' 상태 {}", channelName, status, cause);
        lifecycle.channelFailed(channelName, status, cause);
    }

    private void onPresenceEvent(long expectedGeneration, PresenceEventKind kind) {
        if (expectedGeneration != generation || closed.get()) {
            return;
        }
        LOGGER.debug("프레즌스 '{}' 알림 {}", channelName, kind);
        recompute();
    }

    private void recompute() {
        TransportChannel current = channel;
        if (current == null || closed.get()) {
            return;
        }
        Map<String, List<PresenceRecord>> membership;
        try {
            membership = current.presenceState();
        } catch (Exception e) {
            LOGGER.warn("프레즌스 '{}' 멤버십 조회 실패", channelName, e);
            return;
        }
        long now = executor.currentTimeMillis();
        Map<String, DerivedPresence> next = PresenceReducer.reduce(membership, now, settings.offlineTimeoutMillis());
        recordChanges(derived, next, Instant.ofEpochMilli(now));
        derived = next;
        if (active) {
            Map<String, String> context = Map.of("component", "PresenceTracker", "scope", scopeId);
            monitor.recordMetric("player_presence_online", PresenceReducer.countOnline(next), context);
            monitor.recordMetric("player_presence_playing", PresenceReducer.countPlaying(next), context);
        }
    }

    private void recordChanges(Map<String, DerivedPresence> previous, Map<String, DerivedPresence> next, Instant at) {
        for (DerivedPresence presence : next.values()) {
            DerivedPresence before = previous.get(presence.actorId());
            if (presence.online() && (before == null || !before.online())) {
                history.record(scopeId, presence.actorId(), PresenceHistory.Action.JOIN, at);
            } else if (!presence.online() && before != null && before.online()) {
                history.record(scopeId, presence.actorId(), PresenceHistory.Action.LEAVE, at);
            } else if (before != null && (before.playing() != presence.playing() || !Objects.equals(before.activityId(), presence.activityId()))) {
                history.record(scopeId, presence.actorId(), PresenceHistory.Action.UPDATE, at);
            }
        }
        for (DerivedPresence before : previous.values()) {
            if (before.online() && !next.containsKey(before.actorId())) {
                history.record(scopeId, before.actorId(), PresenceHistory.Action.LEAVE, at);
            }
        }
    }

    private void publish(String reason) {
        TransportChannel current = channel;
        if (current == null) {
            return;
        }
        PresenceRecord record = new PresenceRecord(actor.actorId(), actor.displayName(),
                Instant.ofEpochMilli(executor.currentTimeMillis()), activityId != null, activityId);
        try {
            current.track(record).whenComplete((ignored, error) -> {
                if (error != null) {
                    reportTrackFailure(reason, unwrap(error));
                }
            });
        } catch (Exception e) {
            reportTrackFailure(reason, e);
        }
    }

    private void reportTrackFailure(String reason, Throwable error) {
        LOGGER.warn("프레즌스 '{}' 발행 실패 ({})", channelName, reason, error);
        monitor.recordError(error, Map.of("component", "PresenceTracker", "scope", scopeId, "action", reason));
    }

    private void startHeartbeat() {
        stopHeartbeat();
        long current = generation;
        heartbeat = executor.schedule(() -> onHeartbeat(current), settings.heartbeatIntervalMillis(), TimeUnit.MILLISECONDS);
    }

    private void onHeartbeat(long expectedGeneration) {
        heartbeat = null;
        if (expectedGeneration != generation || closed.get() || !active) {
            return;
        }
        publish("heartbeat");
        startHeartbeat();
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel();
            heartbeat = null;
        }
    }

    private void closeChannel(TransportChannel target, boolean untrack) {
        if (target == null) {
            return;
        }
        try {
            if (untrack) {
                target.untrack().whenComplete((ignored, error) -> {
                    if (error != null) {
                        LOGGER.debug("프레즌스 '{}' untrack 실패", channelName, error);
                    }
                    release(target);
                });
            } else {
                release(target);
            }
        } catch (Exception e) {
            LOGGER.warn("프레즌스 채널 '{}' 정리 실패", channelName, e);
            release(target);
        }
    }

    private void release(TransportChannel target) {
        try {
            transport.closeChannel(target).whenComplete((ignored, error) -> {
                if (error != null) {
                    LOGGER.warn("프레즌스 채널 '{}' 닫기 실패", channelName, error);
                }
            });
        } catch (Exception e) {
            LOGGER.warn("프레즌스 채널 '{}' 닫기 실패", channelName, e);
        }
    }

    private void runOnLoop(Runnable task) {
        if (executor.inEventLoop()) {
            task.run();
        } else {
            executor.execute(task);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
