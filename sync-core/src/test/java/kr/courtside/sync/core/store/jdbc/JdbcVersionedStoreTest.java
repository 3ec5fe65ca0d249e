package kr.courtside.sync.core.store.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.realtime.EventType;
import kr.courtside.sync.api.store.RecordNotFoundException;
import kr.courtside.sync.api.store.VersionedRecord;
import kr.courtside.sync.api.store.WriteResult;
import kr.courtside.sync.api.transport.ChangePublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcVersionedStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private TableDatabase database;
    private ChangePublisher publisher;
    private JdbcVersionedStore store;

    @BeforeEach
    void setUp() {
        database = new TableDatabase();
        publisher = mock(ChangePublisher.class);
        when(publisher.publish(any())).thenReturn(CompletableFuture.completedFuture(null));
        store = new JdbcVersionedStore(database, "synced_records", new ObjectMapper(),
                Executors.newSingleThreadExecutor(), publisher, Clock.fixed(NOW, ZoneOffset.UTC));
        store.start();
    }

    @AfterEach
    void tearDown() {
        store.stop();
    }

    @Test
    void start_createsTable() {
        assertTrue(database.statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS synced_records"));
    }

    @Test
    void constructor_rejectsUnsafeTableName() {
        assertThrows(IllegalArgumentException.class, () -> new JdbcVersionedStore(database, "records; DROP TABLE x",
                new ObjectMapper(), Executors.newSingleThreadExecutor(), null, Clock.systemUTC()));
    }

    @Test
    void insertThenRead_roundTripsJsonPayload() {
        store.insert("match-1", Map.of("home_score", 3, "status", "live")).join();

        VersionedRecord record = store.read("match-1").join();

        assertEquals(1L, record.version());
        assertEquals(3, record.fields().get("home_score"));
        assertEquals("live", record.fields().get("status"));
    }

    @Test
    void read_unknownId_failsWithNotFound() {
        CompletionException error = assertThrows(CompletionException.class, () -> store.read("missing").join());

        assertInstanceOf(RecordNotFoundException.class, error.getCause());
    }

    @Test
    void conditionalWrite_matchingVersion_mergesAndPublishesUpdate() {
        store.insert("match-1", Map.of("home_score", 3, "status", "live")).join();

        WriteResult result = store.conditionalWrite("match-1", Map.of("home_score", 4), 1L).join();

        assertTrue(result.written());
        assertEquals(2L, result.newVersion());
        VersionedRecord record = store.read("match-1").join();
        assertEquals(2L, record.version());
        assertEquals(4, record.fields().get("home_score"));
        assertEquals("live", record.fields().get("status"));

        ArgumentCaptor<ChangeEvent> captor = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(publisher).publish(captor.capture());
        ChangeEvent event = captor.getValue();
        assertEquals("synced_records", event.topic());
        assertEquals(EventType.UPDATE, event.eventType());
        assertEquals(4, event.newRecord().get("home_score"));
        assertEquals(2L, event.newRecord().get("version"));
        assertEquals("match-1", event.newRecord().get("id"));
        assertEquals(3, event.oldRecord().get("home_score"));
        assertEquals(NOW, event.commitTimestamp());
    }

    @Test
    void conditionalWrite_staleVersion_returnsConflictWithoutPublishing() {
        store.insert("match-1", Map.of("home_score", 3)).join();
        store.conditionalWrite("match-1", Map.of("home_score", 4), 1L).join();

        WriteResult result = store.conditionalWrite("match-1", Map.of("home_score", 9), 1L).join();

        assertTrue(result.isConflict());
        assertEquals(2L, result.newVersion());
        assertEquals(4, store.read("match-1").join().fields().get("home_score"));
    }

    @Test
    void conditionalWrite_lostRace_reselectsCurrentVersion() {
        store.insert("match-1", Map.of("home_score", 3)).join();
        database.bumpBeforeNextUpdate = true;

        WriteResult result = store.conditionalWrite("match-1", Map.of("home_score", 4), 1L).join();

        assertTrue(result.isConflict());
        assertEquals(2L, result.newVersion());
        verify(publisher, never()).publish(any());
    }

    @Test
    void conditionalWrite_unknownId_failsWithNotFound() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> store.conditionalWrite("missing", Map.of("home_score", 1), 1L).join());

        assertInstanceOf(RecordNotFoundException.class, error.getCause());
    }

    /**
     * 버전 테이블 하나를 흉내 내는 메모리 데이터베이스.
     */
    private static final class TableDatabase implements DatabaseService, DbSession {

        private final Map<String, Map<String, Object>> rows = new HashMap<>();
        private final List<String> statements = new ArrayList<>();
        private boolean bumpBeforeNextUpdate;

        @Override
        public synchronized <T> T inTransaction(Function<DbSession, T> work) {
            return work.apply(this);
        }

        @Override
        public PoolState state() {
            return PoolState.RUNNING;
        }

        @Override
        public void start() {
        }

        @Override
        public void stop() {
        }

        @Override
        public int executeUpdate(String sql, Object... params) {
            statements.add(sql);
            if (sql.startsWith("INSERT")) {
                Map<String, Object> row = new HashMap<>();
                row.put("id", params[0]);
                row.put("version", params[1]);
                row.put("payload", params[2]);
                rows.put((String) params[0], row);
                return 1;
            }
            if (sql.startsWith("UPDATE")) {
                Map<String, Object> row = rows.get((String) params[2]);
                if (row == null) {
                    return 0;
                }
                if (bumpBeforeNextUpdate) {
                    bumpBeforeNextUpdate = false;
                    row.put("version", ((Number) row.get("version")).longValue() + 1);
                }
                if (((Number) row.get("version")).longValue() != ((Number) params[3]).longValue()) {
                    return 0;
                }
                row.put("payload", params[0]);
                row.put("version", ((Number) row.get("version")).longValue() + 1);
                return 1;
            }
            return 0;
        }

        @Override
        public <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
            statements.add(sql);
            Map<String, Object> row = rows.get((String) params[0]);
            if (row == null) {
                return Optional.empty();
            }
            return Optional.of(mapper.map(new ResultRow() {
                @Override
                public String getString(String columnLabel) {
                    Object value = row.get(columnLabel);
                    return value == null ? null : value.toString();
                }

                @Override
                public Long getLong(String columnLabel) {
                    Object value = row.get(columnLabel);
                    return value == null ? null : ((Number) value).longValue();
                }

                @Override
                public Instant getInstant(String columnLabel) {
                    return null;
                }
            }));
        }
    }
}
