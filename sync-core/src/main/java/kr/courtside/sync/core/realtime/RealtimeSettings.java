package kr.courtside.sync.core.realtime;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 채널/재연결 정책을 외부 설정으로 전달하기 위한 옵션.
 */
public final class RealtimeSettings {

    private final ReconnectionPolicy reconnectionPolicy;
    private final long subscribeTimeoutMillis;
    private final long latencyWarnMillis;

    public RealtimeSettings(ReconnectionPolicy reconnectionPolicy, long subscribeTimeoutMillis, long latencyWarnMillis) {
        this.reconnectionPolicy = Objects.requireNonNull(reconnectionPolicy, "reconnectionPolicy");
        this.subscribeTimeoutMillis = Math.max(1L, subscribeTimeoutMillis);
        this.latencyWarnMillis = Math.max(0L, latencyWarnMillis);
    }

    public static RealtimeSettings defaults() {
        return new RealtimeSettings(ReconnectionPolicy.defaults(), TimeUnit.SECONDS.toMillis(10), TimeUnit.SECONDS.toMillis(1));
    }

    public ReconnectionPolicy reconnectionPolicy() {
        return reconnectionPolicy;
    }

    public long subscribeTimeoutMillis() {
        return subscribeTimeoutMillis;
    }

    public long latencyWarnMillis() {
        return latencyWarnMillis;
    }
}
