package kr.courtside.sync.core.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * {@code config.yml}을 읽어 섹션별 설정 레코드로 나눈다.
 * <p>
 * 데이터 디렉터리에 파일이 없으면 클래스패스의 기본 {@code config.yml}을 복사한다.
 * {@code database} 섹션은 {@code sync.store}가 jdbc일 때만 검증한다.
 */
public final class SyncConfig {

    public static final String FILE_NAME = "config.yml";

    private final SyncYamlConfig sync;
    private final RealtimeYamlConfig realtime;
    private final ConflictYamlConfig conflict;
    private final PresenceYamlConfig presence;
    private final RedisYamlConfig redis;
    private final DatabaseYamlConfig database;

    private SyncConfig(SyncYamlConfig sync,
                       RealtimeYamlConfig realtime,
                       ConflictYamlConfig conflict,
                       PresenceYamlConfig presence,
                       RedisYamlConfig redis,
                       DatabaseYamlConfig database) {
        this.sync = sync;
        this.realtime = realtime;
        this.conflict = conflict;
        this.presence = presence;
        this.redis = redis;
        this.database = database;
    }

    public static SyncConfig load(Path dataDir, ClassLoader loader) {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(loader, "loader");
        try {
            if (!Files.exists(dataDir)) {
                Files.createDirectories(dataDir);
            }
            Path file = dataDir.resolve(FILE_NAME);
            if (!Files.exists(file)) {
                try (InputStream in = loader.getResourceAsStream(FILE_NAME)) {
                    if (in == null) {
                        throw new IllegalStateException("리소스에 기본 config.yml이 존재하지 않습니다.");
                    }
                    Files.copy(in, file);
                }
            }
            try (InputStream in = Files.newInputStream(file)) {
                return parse(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("config.yml을 불러오지 못했습니다.", e);
        }
    }

    public static SyncConfig parse(InputStream in) {
        Object loaded = new Yaml().load(in);
        return fromMap(YamlValues.section(loaded));
    }

    public static SyncConfig fromMap(Map<String, Object> root) {
        Objects.requireNonNull(root, "root");
        SyncYamlConfig sync = SyncYamlConfig.fromMap(root.containsKey("sync") ? YamlValues.section(root.get("sync")) : null);
        RealtimeYamlConfig realtime = RealtimeYamlConfig.fromMap(YamlValues.section(root.get("realtime")));
        ConflictYamlConfig conflict = ConflictYamlConfig.fromMap(YamlValues.section(root.get("conflict")));
        PresenceYamlConfig presence = PresenceYamlConfig.fromMap(YamlValues.section(root.get("presence")));
        RedisYamlConfig redis = RedisYamlConfig.fromMap(root.containsKey("redis") ? YamlValues.section(root.get("redis")) : null);
        DatabaseYamlConfig database = null;
        if (sync.store() == SyncYamlConfig.StoreMode.JDBC) {
            database = DatabaseYamlConfig.fromMap(root.containsKey("database") ? YamlValues.section(root.get("database")) : null);
        }
        return new SyncConfig(sync, realtime, conflict, presence, redis, database);
    }

    public SyncYamlConfig sync() {
        return sync;
    }

    public RealtimeYamlConfig realtime() {
        return realtime;
    }

    public ConflictYamlConfig conflict() {
        return conflict;
    }

    public PresenceYamlConfig presence() {
        return presence;
    }

    public RedisYamlConfig redis() {
        return redis;
    }

    /**
     * jdbc 저장소가 아니면 {@code null}.
     */
    public DatabaseYamlConfig database() {
        return database;
    }
}
