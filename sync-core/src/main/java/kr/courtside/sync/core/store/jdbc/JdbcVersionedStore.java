package kr.courtside.sync.core.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.lifecycle.ManagedLifecycle;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.realtime.EventType;
import kr.courtside.sync.api.store.RecordNotFoundException;
import kr.courtside.sync.api.store.StoreException;
import kr.courtside.sync.api.store.VersionedRecord;
import kr.courtside.sync.api.store.VersionedStore;
import kr.courtside.sync.api.store.WriteResult;
import kr.courtside.sync.api.transport.ChangePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;

/**
 * {@code (id, version, payload, updated_at)} 테이블 위의 버전 저장소.
 * <p>
 * 필드는 JSON 컬럼 하나에 저장되고, 쓰기는 {@code UPDATE ... WHERE id = ? AND version = ?}로
 * 비교 후 교체된다. 블로킹 JDBC 호출은 전용 워커 풀에서 실행한다.
 * 쓰기가 성공하면 테이블 이름을 토픽으로 하는 UPDATE 변경 이벤트를 발행한다.
 */
public final class JdbcVersionedStore implements VersionedStore, ManagedLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcVersionedStore.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final DatabaseService database;
    private final String table;
    private final ObjectMapper mapper;
    private final ExecutorService workers;
    private final ChangePublisher publisher;
    private final Clock clock;

    public JdbcVersionedStore(DatabaseService database,
                              String table,
                              ObjectMapper mapper,
                              ExecutorService workers,
                              ChangePublisher publisher,
                              Clock clock) {
        this.database = Objects.requireNonNull(database, "database");
        Preconditions.checkArgument(table != null && TABLE_NAME.matcher(table).matches(), "invalid table name: " + table);
        this.table = table;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.publisher = publisher;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void start() {
        database.inTransaction(session -> session.executeUpdate("CREATE TABLE IF NOT EXISTS " + table + " ("
                + "id VARCHAR(191) NOT NULL PRIMARY KEY, "
                + "version BIGINT NOT NULL, "
                + "payload JSON NOT NULL, "
                + "updated_at TIMESTAMP(3) NOT NULL)"));
        LOGGER.info("버전 테이블 '{}'을 사용합니다", table);
    }

    @Override
    public void stop() {
        workers.shutdown();
    }

    public String table() {
        return table;
    }

    /**
     * 새 레코드를 버전 1로 만든다.
     */
    public CompletableFuture<VersionedRecord> insert(String id, Map<String, Object> fields) {
        Preconditions.checkNotBlank(id, "id");
        return CompletableFuture.supplyAsync(() -> {
            VersionedRecord record = new VersionedRecord(id, 1L, fields);
            database.inTransaction(session -> session.executeUpdate(
                    "INSERT INTO " + table + " (id, version, payload, updated_at) VALUES (?, ?, ?, ?)",
                    id, record.version(), encode(record.fields()), clock.instant()));
            return record;
        }, workers);
    }

    @Override
    public CompletableFuture<VersionedRecord> read(String id) {
        Preconditions.checkNotBlank(id, "id");
        return CompletableFuture.supplyAsync(() -> database.inTransaction(session -> select(session, id, false))
                .orElseThrow(() -> new RecordNotFoundException(id)), workers);
    }

    @Override
    public CompletableFuture<WriteResult> conditionalWrite(String id, Map<String, Object> fields, long expectedVersion) {
        Preconditions.checkNotBlank(id, "id");
        Map<String, Object> patch = fields == null ? Map.of() : new LinkedHashMap<>(fields);
        return CompletableFuture.supplyAsync(() -> {
            Attempt attempt = database.inTransaction(session -> write(session, id, patch, expectedVersion));
            if (attempt.previous() == null) {
                throw new RecordNotFoundException(id);
            }
            if (attempt.result().written()) {
                publishUpdate(attempt);
            }
            return attempt.result();
        }, workers);
    }

    private Attempt write(DbSession session, String id, Map<String, Object> patch, long expectedVersion) {
        Optional<VersionedRecord> current = select(session, id, true);
        if (current.isEmpty()) {
            return new Attempt(null, null, WriteResult.conflict(-1L), null);
        }
        VersionedRecord previous = current.get();
        if (previous.version() != expectedVersion) {
            return new Attempt(previous, null, WriteResult.conflict(previous.version()), null);
        }
        Map<String, Object> merged = new LinkedHashMap<>(previous.fields());
        merged.putAll(patch);
        Instant committedAt = clock.instant();
        int updated = session.executeUpdate(
                "UPDATE " + table + " SET payload = ?, version = version + 1, updated_at = ? WHERE id = ? AND version = ?",
                encode(merged), committedAt, id, expectedVersion);
        if (updated == 0) {
            long latest = select(session, id, false).map(VersionedRecord::version).orElse(-1L);
            return new Attempt(previous, null, WriteResult.conflict(latest), null);
        }
        VersionedRecord next = new VersionedRecord(id, expectedVersion + 1, merged);
        return new Attempt(previous, next, WriteResult.written(next.version()), committedAt);
    }

    private Optional<VersionedRecord> select(DbSession session, String id, boolean forUpdate) {
        String sql = "SELECT id, version, payload FROM " + table + " WHERE id = ?" + (forUpdate ? " FOR UPDATE" : "");
        return session.queryOne(sql, row -> new VersionedRecord(row.getString("id"), row.getLong("version"),
                decode(row.getString("payload"))), id);
    }

    private void publishUpdate(Attempt attempt) {
        if (publisher == null) {
            return;
        }
        ChangeEvent event = new ChangeEvent(table, EventType.UPDATE, asRow(attempt.next()), asRow(attempt.previous()),
                attempt.committedAt());
        publisher.publish(event).whenComplete((ignored, error) -> {
            if (error != null) {
                LOGGER.warn("'{}' 변경 이벤트 발행 실패 (id {})", table, attempt.next().id(), error);
            }
        });
    }

    private static Map<String, Object> asRow(VersionedRecord record) {
        Map<String, Object> row = new LinkedHashMap<>(record.fields());
        row.put("id", record.id());
        row.put("version", record.version());
        return row;
    }

    private String encode(Map<String, Object> fields) {
        try {
            return mapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new StoreException("failed to encode fields", e);
        }
    }

    private Map<String, Object> decode(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, FIELDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException("failed to decode payload", e);
        }
    }

    private record Attempt(VersionedRecord previous, VersionedRecord next, WriteResult result, Instant committedAt) {
    }
}
