package kr.courtside.sync.core.config;

import kr.courtside.sync.core.store.jdbc.DatabaseConfig;

import java.util.Map;

import static kr.courtside.sync.core.config.YamlValues.toInt;
import static kr.courtside.sync.core.config.YamlValues.trimToEmpty;

public record DatabaseYamlConfig(String host, int port, String database, String username, String password, int poolSize,
                                 String table, int workerThreads, Map<String, String> properties) {

    public static DatabaseYamlConfig fromMap(Map<String, Object> section) {
        if (section == null) {
            throw new IllegalArgumentException("database 섹션이 존재하지 않습니다.");
        }
        String host = trimToEmpty(section.get("host"));
        int port = toInt(section.get("port"), 3306);
        String database = trimToEmpty(section.get("database"));
        String username = trimToEmpty(section.get("username"));
        String password = section.get("password") == null ? "" : section.get("password").toString();
        int poolSize = toInt(section.get("pool-size"), 10);
        String table = trimToEmpty(section.get("table"));
        int workerThreads = toInt(section.get("worker-threads"), 4);
        if (host.isBlank()) {
            throw new IllegalArgumentException("database.host 값이 비어 있습니다.");
        }
        if (database.isBlank()) {
            throw new IllegalArgumentException("database.database 값이 비어 있습니다.");
        }
        if (username.isBlank()) {
            throw new IllegalArgumentException("database.username 값이 비어 있습니다.");
        }
        return new DatabaseYamlConfig(host, port, database, username, password, poolSize,
                table.isBlank() ? "synced_records" : table, Math.max(1, workerThreads), YamlValues.properties(section.get("properties")));
    }

    public DatabaseConfig toDatabaseConfig() {
        return new DatabaseConfig(host, port, database, username, password, poolSize, table, properties);
    }
}
