package kr.courtside.sync.core.presence;

import java.util.concurrent.TimeUnit;

/**
 * 프레즌스 하트비트/오프라인 판정 옵션.
 */
public final class PresenceSettings {

    private final long heartbeatIntervalMillis;
    private final long offlineTimeoutMillis;
    private final int historySize;

    public PresenceSettings(long heartbeatIntervalMillis, long offlineTimeoutMillis, int historySize) {
        this.heartbeatIntervalMillis = Math.max(1L, heartbeatIntervalMillis);
        this.offlineTimeoutMillis = Math.max(1L, offlineTimeoutMillis);
        this.historySize = Math.max(1, historySize);
    }

    public static PresenceSettings defaults() {
        return new PresenceSettings(TimeUnit.SECONDS.toMillis(30), TimeUnit.SECONDS.toMillis(60), 100);
    }

    public long heartbeatIntervalMillis() {
        return heartbeatIntervalMillis;
    }

    public long offlineTimeoutMillis() {
        return offlineTimeoutMillis;
    }

    public int historySize() {
        return historySize;
    }
}
