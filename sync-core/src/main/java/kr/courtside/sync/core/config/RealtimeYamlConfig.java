package kr.courtside.sync.core.config;

import kr.courtside.sync.core.realtime.RealtimeSettings;
import kr.courtside.sync.core.realtime.ReconnectionPolicy;

import java.util.Map;

import static kr.courtside.sync.core.config.YamlValues.toDouble;
import static kr.courtside.sync.core.config.YamlValues.toInt;
import static kr.courtside.sync.core.config.YamlValues.toLong;

public record RealtimeYamlConfig(long initialDelayMs,
                                 long maxDelayMs,
                                 double multiplier,
                                 int maxRetries,
                                 long subscribeTimeoutMs,
                                 long latencyWarnMs) {

    public static RealtimeYamlConfig fromMap(Map<String, Object> section) {
        Map<String, Object> values = section == null ? Map.of() : section;
        long initial = toLong(values.get("initial-delay-ms"), 1000L);
        long max = toLong(values.get("max-delay-ms"), 30000L);
        double multiplier = toDouble(values.get("multiplier"), 2.0d);
        int maxRetries = toInt(values.get("max-retries"), 10);
        long subscribeTimeout = toLong(values.get("subscribe-timeout-ms"), 10000L);
        long latencyWarn = toLong(values.get("latency-warn-ms"), 1000L);
        if (initial < 0) {
            throw new IllegalArgumentException("realtime.initial-delay-ms는 0 이상이어야 합니다.");
        }
        if (max < initial) {
            throw new IllegalArgumentException("realtime.max-delay-ms는 initial-delay-ms보다 작을 수 없습니다.");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("realtime.multiplier는 1 이상이어야 합니다.");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("realtime.max-retries는 0 이상이어야 합니다.");
        }
        if (subscribeTimeout <= 0) {
            throw new IllegalArgumentException("realtime.subscribe-timeout-ms는 양수여야 합니다.");
        }
        return new RealtimeYamlConfig(initial, max, multiplier, maxRetries, subscribeTimeout, Math.max(0L, latencyWarn));
    }

    public RealtimeSettings toSettings() {
        return new RealtimeSettings(new ReconnectionPolicy(initialDelayMs, maxDelayMs, multiplier, maxRetries),
                subscribeTimeoutMs, latencyWarnMs);
    }
}
