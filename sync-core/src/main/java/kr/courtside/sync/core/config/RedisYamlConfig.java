package kr.courtside.sync.core.config;

import kr.courtside.sync.core.redis.RedisClientFactory;

import java.time.Duration;
import java.util.Map;

import static kr.courtside.sync.core.config.YamlValues.toBoolean;
import static kr.courtside.sync.core.config.YamlValues.toInt;
import static kr.courtside.sync.core.config.YamlValues.toLong;
import static kr.courtside.sync.core.config.YamlValues.trimToEmpty;

public record RedisYamlConfig(String host, int port, boolean ssl, String password, long timeoutMs, int database,
                              long presenceTtlSeconds) {

    public static RedisYamlConfig fromMap(Map<String, Object> section) {
        if (section == null) {
            throw new IllegalArgumentException("redis 섹션이 존재하지 않습니다.");
        }
        String host = trimToEmpty(section.get("host"));
        int port = toInt(section.get("port"), 6379);
        boolean ssl = toBoolean(section.get("ssl"), false);
        String password = section.get("password") == null ? "" : section.get("password").toString();
        long timeout = toLong(section.get("timeout-ms"), 5000L);
        int database = toInt(section.get("database"), 0);
        long presenceTtl = toLong(section.get("presence-ttl-seconds"), 300L);
        if (host.isBlank()) {
            throw new IllegalArgumentException("redis.host 값이 비어 있습니다.");
        }
        if (port <= 0) {
            throw new IllegalArgumentException("redis.port는 양수여야 합니다.");
        }
        if (timeout <= 0) {
            throw new IllegalArgumentException("redis.timeout-ms는 양수여야 합니다.");
        }
        if (database < 0) {
            throw new IllegalArgumentException("redis.database는 0 이상이어야 합니다.");
        }
        return new RedisYamlConfig(host, port, ssl, password, timeout, database, Math.max(1L, presenceTtl));
    }

    public RedisClientFactory toClientFactory() {
        return new RedisClientFactory(host, port, ssl, password, Duration.ofMillis(timeoutMs), database);
    }

    public Duration presenceTtl() {
        return Duration.ofSeconds(presenceTtlSeconds);
    }
}
