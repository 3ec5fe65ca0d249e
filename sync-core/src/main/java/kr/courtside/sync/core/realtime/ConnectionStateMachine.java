package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.executor.ScheduledTask;
import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.realtime.ConnectionState;
import kr.courtside.sync.api.realtime.ConnectionStateListener;
import kr.courtside.sync.api.realtime.Registration;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * 전체 연결 상태와 재연결 타이머를 관리한다.
 * <p>
 * 채널 실패 시 ERROR로 전이한 뒤 백오프 타이머를 걸고(RECONNECTING), 타이머가 만료되면 모든 참여자의
 * 채널을 처음부터 다시 연다. 최대 재시도 이후에는 수동 재연결이나 네트워크 복구 신호가 올 때까지 ERROR에 머문다.
 * 타이머는 인스턴스당 하나이며 새로 예약하기 전에 항상 이전 타이머를 취소한다. 모든 메서드는 이벤트 루프에서 호출된다.
 */
public final class ConnectionStateMachine implements ChannelLifecycleListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionStateMachine.class);

    private final TaskExecutor executor;
    private final ReconnectionPolicy policy;
    private final Monitor monitor;
    private final List<ReconnectParticipant> participants = new CopyOnWriteArrayList<>();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private int attempts;
    private ScheduledTask reconnectTimer;
    private boolean authBypassUsed;
    private boolean exhausted;
    private boolean networkAvailable = true;
    private boolean shutdown;

    public ConnectionStateMachine(TaskExecutor executor, ReconnectionPolicy policy, Monitor monitor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
    }

    public ConnectionState state() {
        return state;
    }

    public int attempts() {
        return attempts;
    }

    public boolean isReconnectPending() {
        return reconnectTimer != null;
    }

    public void addParticipant(ReconnectParticipant participant) {
        Preconditions.checkNotNull(participant, "participant");
        participants.add(participant);
    }

    public void removeParticipant(ReconnectParticipant participant) {
        participants.remove(participant);
    }

    /**
     * 리스너를 등록하고 현재 상태로 즉시 한 번 호출한다.
     */
    public Registration addListener(ConnectionStateListener listener) {
        Preconditions.checkNotNull(listener, "listener");
        listeners.add(listener);
        ConnectionState current = state;
        notifyListener(listener, current, current);
        return () -> listeners.remove(listener);
    }

    @Override
    public void channelOpening(String channelName) {
        if (state == ConnectionState.DISCONNECTED && networkAvailable && !shutdown) {
            transition(ConnectionState.CONNECTING, "실시간 연결을 시작합니다 (" + channelName + ")");
        }
    }

    @Override
    public void channelSubscribed(String channelName) {
        if (shutdown) {
            return;
        }
        networkAvailable = true;
        if (state != ConnectionState.CONNECTING && state != ConnectionState.CONNECTED) {
            transition(ConnectionState.CONNECTING, "실시간 연결을 확인합니다 (" + channelName + ")");
        }
        cancelTimer();
        attempts = 0;
        exhausted = false;
        authBypassUsed = false;
        transition(ConnectionState.CONNECTED, "실시간 연결이 정상화되었습니다");
    }

    @Override
    public void channelFailed(String channelName, ChannelStatus status, Throwable cause) {
        if (shutdown) {
            return;
        }
        if (!networkAvailable) {
            LOGGER.debug("네트워크가 끊긴 상태라 채널 '{}' 실패({})로 재연결을 예약하지 않습니다", channelName, status);
            return;
        }
        if (exhausted) {
            return;
        }
        if (reconnectTimer != null) {
            LOGGER.debug("재연결이 이미 예약되어 채널 '{}' 실패({})를 합칩니다", channelName, status);
            return;
        }
        transition(ConnectionState.ERROR, "채널 '" + channelName + "' 상태 " + status);
        if (AuthErrors.isAuthError(cause) && !authBypassUsed) {
            authBypassUsed = true;
            LOGGER.warn("인증 오류가 감지되어 백오프 없이 즉시 재연결합니다");
            reconnectNow();
            return;
        }
        scheduleReconnect();
    }

    /**
     * 수동 재연결. 대기 중인 타이머를 취소하고 시도 횟수를 초기화한다.
     */
    public void reconnect() {
        if (shutdown) {
            return;
        }
        LOGGER.info("수동 재연결을 요청받았습니다");
        resetAttempts();
        networkAvailable = true;
        reconnectNow();
    }

    public void connectivityRestored() {
        if (shutdown) {
            return;
        }
        LOGGER.info("네트워크가 복구되어 즉시 재연결합니다");
        resetAttempts();
        networkAvailable = true;
        reconnectNow();
    }

    public void connectivityLost() {
        if (shutdown) {
            return;
        }
        networkAvailable = false;
        cancelTimer();
        transition(ConnectionState.DISCONNECTED, "네트워크 연결이 끊겼습니다");
    }

    public void shutdown() {
        if (shutdown) {
            return;
        }
        cancelTimer();
        participants.clear();
        transition(ConnectionState.DISCONNECTED, "실시간 연결을 종료합니다");
        shutdown = true;
        listeners.clear();
    }

    private void scheduleReconnect() {
        cancelTimer();
        if (!policy.shouldRetry(attempts)) {
            exhausted = true;
            LOGGER.warn("최대 재연결 횟수({}회)를 초과했습니다 - 수동 재연결이 필요합니다", policy.maxRetries());
            monitor.recordError(new TransportException("max reconnect attempts exceeded"),
                    Map.of("component", "ConnectionStateMachine", "attempts", Integer.toString(attempts)));
            return;
        }
        long delay = policy.delayMillis(attempts);
        attempts++;
        transition(ConnectionState.RECONNECTING, "재연결을 예약합니다 (" + attempts + "/" + policy.maxRetries() + ", " + delay + "ms 후)");
        reconnectTimer = executor.schedule(this::onReconnectTimer, delay, TimeUnit.MILLISECONDS);
    }

    private void onReconnectTimer() {
        reconnectTimer = null;
        if (shutdown) {
            return;
        }
        reconnectNow();
    }

    private void reconnectNow() {
        cancelTimer();
        transition(ConnectionState.CONNECTING, "실시간 채널을 다시 엽니다");
        int reopened = 0;
        for (ReconnectParticipant participant : participants) {
            try {
                reopened += participant.reopen();
            } catch (Exception e) {
                LOGGER.warn("재연결 중 채널 재생성에 실패했습니다", e);
                monitor.recordError(e, Map.of("component", "ConnectionStateMachine", "action", "reopen"));
                if (reconnectTimer == null && !exhausted) {
                    transition(ConnectionState.ERROR, "채널 재생성 실패");
                    scheduleReconnect();
                }
                return;
            }
        }
        if (reopened == 0 && state == ConnectionState.CONNECTING) {
            transition(ConnectionState.DISCONNECTED, "열린 채널이 없어 연결을 유지하지 않습니다");
        }
    }

    private void resetAttempts() {
        cancelTimer();
        attempts = 0;
        exhausted = false;
        authBypassUsed = false;
    }

    private void cancelTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void transition(ConnectionState newState, String message) {
        ConnectionState previous = state;
        if (previous == newState) {
            return;
        }
        state = newState;
        switch (newState) {
            case CONNECTED, CONNECTING, DISCONNECTED -> LOGGER.info("{}", message);
            case RECONNECTING -> LOGGER.warn("{} (RECONNECTING)", message);
            case ERROR -> LOGGER.warn("{} (ERROR)", message);
        }
        for (ConnectionStateListener listener : listeners) {
            notifyListener(listener, previous, newState);
        }
    }

    private void notifyListener(ConnectionStateListener listener, ConnectionState previous, ConnectionState current) {
        try {
            listener.onStateChange(previous, current);
        } catch (Exception e) {
            LOGGER.warn("연결 상태 리스너 실행 중 오류", e);
        }
    }
}
