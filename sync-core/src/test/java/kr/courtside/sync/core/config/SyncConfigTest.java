package kr.courtside.sync.core.config;

import kr.courtside.sync.api.conflict.ResolutionStrategy;
import kr.courtside.sync.core.conflict.ConflictSettings;
import kr.courtside.sync.core.realtime.RealtimeSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncConfigTest {

    private static Map<String, Object> minimal() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("sync", new LinkedHashMap<>(Map.of("environment", "test", "node-id", "node-a")));
        root.put("redis", new LinkedHashMap<>(Map.of("host", "redis.local")));
        return root;
    }

    @Test
    void fromMap_appliesDefaultsForOmittedSections() {
        SyncConfig config = SyncConfig.fromMap(minimal());

        assertEquals(SyncYamlConfig.StoreMode.MEMORY, config.sync().store());
        assertEquals("node-a", config.sync().toContext().nodeId());
        assertNull(config.database());

        RealtimeSettings realtime = config.realtime().toSettings();
        assertEquals(10_000L, realtime.subscribeTimeoutMillis());
        assertEquals(1_000L, realtime.reconnectionPolicy().delayMillis(0));

        ConflictSettings conflict = config.conflict().toSettings();
        assertEquals(ResolutionStrategy.Kind.LATEST_WINS, conflict.defaultStrategy().kind());
        assertEquals(3, conflict.maxRetries());

        assertEquals(30_000L, config.presence().toSettings().heartbeatIntervalMillis());
        assertEquals(6379, config.redis().port());
        assertEquals(Duration.ofSeconds(300), config.redis().presenceTtl());
    }

    @Test
    void fromMap_missingRequiredSections_fail() {
        Map<String, Object> noSync = minimal();
        noSync.remove("sync");
        Map<String, Object> noRedis = minimal();
        noRedis.remove("redis");

        assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(noSync));
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(noRedis));
    }

    @Test
    void fromMap_jdbcStore_requiresDatabaseSection() {
        Map<String, Object> root = minimal();
        root.put("sync", new LinkedHashMap<>(Map.of("environment", "test", "node-id", "node-a", "store", "jdbc")));

        assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(root));

        root.put("database", new LinkedHashMap<>(Map.of("host", "db.local", "database", "courtside", "username", "app")));
        SyncConfig config = SyncConfig.fromMap(root);
        assertEquals("synced_records", config.database().table());
        assertEquals("jdbc:mysql://db.local:3306/courtside", config.database().toDatabaseConfig().jdbcUrl());
        assertTrue(config.database().properties().isEmpty());
    }

    @Test
    void fromMap_databaseProperties_areStringified() {
        Map<String, Object> root = minimal();
        root.put("sync", new LinkedHashMap<>(Map.of("environment", "test", "node-id", "node-a", "store", "jdbc")));
        Map<String, Object> database = new LinkedHashMap<>(Map.of("host", "db.local", "database", "courtside", "username", "app"));
        database.put("properties", new LinkedHashMap<>(Map.of("cachePrepStmts", true, "prepStmtCacheSize", 250)));
        root.put("database", database);

        SyncConfig config = SyncConfig.fromMap(root);

        assertEquals(Map.of("cachePrepStmts", "true", "prepStmtCacheSize", "250"), config.database().properties());
        assertEquals("250", config.database().toDatabaseConfig().properties().get("prepStmtCacheSize"));
    }

    @Test
    void fromMap_rejectsMergeAsConfiguredDefault() {
        Map<String, Object> root = minimal();
        root.put("conflict", new LinkedHashMap<>(Map.of("default-strategy", "merge")));

        assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(root));
    }

    @Test
    void fromMap_acceptsManualDefault() {
        Map<String, Object> root = minimal();
        root.put("conflict", new LinkedHashMap<>(Map.of("default-strategy", "manual", "max-retries", 5)));

        ConflictSettings settings = SyncConfig.fromMap(root).conflict().toSettings();

        assertEquals(ResolutionStrategy.Kind.MANUAL, settings.defaultStrategy().kind());
        assertEquals(5, settings.maxRetries());
    }

    @Test
    void fromMap_rejectsOfflineTimeoutNotAboveHeartbeat() {
        Map<String, Object> root = minimal();
        root.put("presence", new LinkedHashMap<>(Map.of("heartbeat-interval-ms", 30000, "offline-timeout-ms", 30000)));

        assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(root));
    }

    @Test
    void fromMap_rejectsUnknownStoreMode() {
        Map<String, Object> root = minimal();
        root.put("sync", new LinkedHashMap<>(Map.of("environment", "test", "node-id", "node-a", "store", "cassandra")));

        assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(root));
    }

    @Test
    void parse_readsYaml() {
        String yaml = "sync:\n  environment: prod\n  node-id: n1\nredis:\n  host: cache\n  port: 6380\n"
                + "realtime:\n  max-retries: 4\n";

        SyncConfig config = SyncConfig.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals("prod", config.sync().environment());
        assertEquals(6380, config.redis().port());
        assertEquals(4, config.realtime().maxRetries());
    }

    @Test
    void load_copiesBundledDefaultsOnFirstRun(@TempDir Path dir) throws Exception {
        Path dataDir = dir.resolve("courtside");

        SyncConfig config = SyncConfig.load(dataDir, getClass().getClassLoader());

        assertTrue(Files.exists(dataDir.resolve(SyncConfig.FILE_NAME)));
        assertEquals("dev", config.sync().environment());
        assertEquals("127.0.0.1", config.redis().host());
    }

    @Test
    void load_keepsExistingFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(SyncConfig.FILE_NAME),
                "sync:\n  environment: staging\n  node-id: n2\nredis:\n  host: cache\n");

        SyncConfig config = SyncConfig.load(dir, getClass().getClassLoader());

        assertEquals("staging", config.sync().environment());
    }
}
