package kr.courtside.sync.core.realtime;

import java.util.concurrent.TimeUnit;

/**
 * 제한된 지수 백오프 정책.
 * <p>
 * {@code delay(n) = min(initialDelay * multiplier^n, maxDelay)}, n은 0부터 시작하는 시도 횟수.
 */
public final class ReconnectionPolicy {

    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final double multiplier;
    private final int maxRetries;

    public ReconnectionPolicy(long initialDelayMillis, long maxDelayMillis, double multiplier, int maxRetries) {
        this.initialDelayMillis = Math.max(0L, initialDelayMillis);
        this.maxDelayMillis = Math.max(this.initialDelayMillis, maxDelayMillis);
        this.multiplier = Math.max(1.0d, multiplier);
        this.maxRetries = Math.max(0, maxRetries);
    }

    public static ReconnectionPolicy defaults() {
        return new ReconnectionPolicy(TimeUnit.SECONDS.toMillis(1), TimeUnit.SECONDS.toMillis(30), 2.0d, 10);
    }

    public long delayMillis(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        double backoff = initialDelayMillis * Math.pow(multiplier, attempt);
        return (long) Math.min(backoff, maxDelayMillis);
    }

    /**
     * 지금까지 {@code attempt}번 재시도했을 때 한 번 더 예약해도 되는지.
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxRetries;
    }

    public long initialDelayMillis() {
        return initialDelayMillis;
    }

    public long maxDelayMillis() {
        return maxDelayMillis;
    }

    public double multiplier() {
        return multiplier;
    }

    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "ReconnectionPolicy{" +
                "initialDelayMillis=" + initialDelayMillis +
                ", maxDelayMillis=" + maxDelayMillis +
                ", multiplier=" + multiplier +
                ", maxRetries=" + maxRetries +
                '}';
    }
}
