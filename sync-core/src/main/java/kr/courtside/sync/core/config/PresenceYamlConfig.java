package kr.courtside.sync.core.config;

import kr.courtside.sync.core.presence.PresenceSettings;

import java.util.Map;

import static kr.courtside.sync.core.config.YamlValues.toInt;
import static kr.courtside.sync.core.config.YamlValues.toLong;

public record PresenceYamlConfig(long heartbeatIntervalMs, long offlineTimeoutMs, int historySize) {

    public static PresenceYamlConfig fromMap(Map<String, Object> section) {
        Map<String, Object> values = section == null ? Map.of() : section;
        long heartbeat = toLong(values.get("heartbeat-interval-ms"), 30000L);
        long offline = toLong(values.get("offline-timeout-ms"), 60000L);
        int historySize = toInt(values.get("history-size"), 100);
        if (heartbeat <= 0) {
            throw new IllegalArgumentException("presence.heartbeat-interval-ms는 양수여야 합니다.");
        }
        if (offline <= heartbeat) {
            throw new IllegalArgumentException("presence.offline-timeout-ms는 heartbeat-interval-ms보다 커야 합니다.");
        }
        return new PresenceYamlConfig(heartbeat, offline, Math.max(1, historySize));
    }

    public PresenceSettings toSettings() {
        return new PresenceSettings(heartbeatIntervalMs, offlineTimeoutMs, historySize);
    }
}
