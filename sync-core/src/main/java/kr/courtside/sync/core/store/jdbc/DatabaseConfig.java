package kr.courtside.sync.core.store.jdbc;

import java.util.Map;

/**
 * MySQL 접속 정보와 버전 테이블 이름.
 */
public record DatabaseConfig(String host,
                             int port,
                             String database,
                             String username,
                             String password,
                             int poolSize,
                             String table,
                             Map<String, String> properties) {

    public DatabaseConfig {
        host = host == null ? "" : host;
        database = database == null ? "" : database;
        username = username == null ? "" : username;
        poolSize = Math.max(1, poolSize);
        table = table == null || table.isBlank() ? "synced_records" : table;
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public String jdbcUrl() {
        if (host.isBlank()) {
            throw new IllegalStateException("host must be provided");
        }
        if (database.isBlank()) {
            throw new IllegalStateException("database must be provided");
        }
        return "jdbc:mysql://" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "DatabaseConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", username='" + username + '\'' +
                ", password='" + (password == null || password.isEmpty() ? "" : "****") + '\'' +
                ", poolSize=" + poolSize +
                ", table='" + table + '\'' +
                '}';
    }
}
