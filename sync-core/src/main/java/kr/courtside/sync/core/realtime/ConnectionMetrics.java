package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.realtime.ConnectionState;
import kr.courtside.sync.api.realtime.ConnectionStateListener;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 연결 상태 전이를 누적해 시도/성공/실패 횟수, 끊김 시간, 최근 이력과 품질 점수를 계산한다.
 */
public final class ConnectionMetrics implements ConnectionStateListener {

    public static final int HISTORY_SIZE = 10;
    private static final long RECENT_WINDOW_MS = TimeUnit.MINUTES.toMillis(5);

    /**
     * @param durationMillis 직전 상태에 머문 시간
     */
    public record Transition(ConnectionState state, Instant at, long durationMillis) {
    }

    private final TaskExecutor clock;
    private final Deque<Transition> history = new ArrayDeque<>();
    private long connectionAttempts;
    private long successfulConnections;
    private long failedConnections;
    private long totalDisconnectedMillis;
    private Instant lastConnected;
    private Instant lastDisconnected;
    private long disconnectedSince = -1L;
    private long lastTransitionAt;

    public ConnectionMetrics(TaskExecutor clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastTransitionAt = clock.currentTimeMillis();
    }

    @Override
    public synchronized void onStateChange(ConnectionState previous, ConnectionState current) {
        if (previous == current) {
            return;
        }
        long now = clock.currentTimeMillis();
        switch (current) {
            case CONNECTING -> connectionAttempts++;
            case CONNECTED -> {
                successfulConnections++;
                lastConnected = Instant.ofEpochMilli(now);
                if (disconnectedSince >= 0) {
                    totalDisconnectedMillis += now - disconnectedSince;
                    disconnectedSince = -1L;
                }
            }
            case ERROR -> failedConnections++;
            default -> {
            }
        }
        if (previous == ConnectionState.CONNECTED) {
            lastDisconnected = Instant.ofEpochMilli(now);
            disconnectedSince = now;
        }
        history.addFirst(new Transition(current, Instant.ofEpochMilli(now), now - lastTransitionAt));
        while (history.size() > HISTORY_SIZE) {
            history.removeLast();
        }
        lastTransitionAt = now;
    }

    /**
     * 0~100 품질 점수. 성공률을 기본으로 실패율과 최근 5분간 끊김 횟수를 반영한다. 시도가 없으면 0.
     */
    public synchronized int quality() {
        if (connectionAttempts == 0) {
            return 0;
        }
        double score = (double) successfulConnections / connectionAttempts * 100.0d;
        score -= (double) failedConnections / connectionAttempts * 30.0d;
        long now = clock.currentTimeMillis();
        long recentDrops = history.stream()
                .filter(t -> t.state() == ConnectionState.DISCONNECTED || t.state() == ConnectionState.ERROR)
                .filter(t -> now - t.at().toEpochMilli() < RECENT_WINDOW_MS)
                .count();
        if (recentDrops == 0) {
            score += 10;
        } else if (recentDrops <= 2) {
            score += 5;
        } else {
            score -= recentDrops * 5;
        }
        return (int) Math.round(Math.max(0.0d, Math.min(100.0d, score)));
    }

    public synchronized long connectionAttempts() {
        return connectionAttempts;
    }

    public synchronized long successfulConnections() {
        return successfulConnections;
    }

    public synchronized long failedConnections() {
        return failedConnections;
    }

    /**
     * 누적 끊김 시간. 현재 끊긴 상태라면 지금까지의 시간도 포함한다.
     */
    public synchronized long totalDisconnectedMillis() {
        if (disconnectedSince >= 0) {
            return totalDisconnectedMillis + (clock.currentTimeMillis() - disconnectedSince);
        }
        return totalDisconnectedMillis;
    }

    public synchronized Instant lastConnected() {
        return lastConnected;
    }

    public synchronized Instant lastDisconnected() {
        return lastDisconnected;
    }

    /**
     * 최신 항목이 앞에 온다.
     */
    public synchronized List<Transition> history() {
        return List.copyOf(history);
    }
}
