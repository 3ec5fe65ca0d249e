package kr.courtside.sync.core.store.memory;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.store.RecordNotFoundException;
import kr.courtside.sync.api.store.VersionedRecord;
import kr.courtside.sync.api.store.VersionedStore;
import kr.courtside.sync.api.store.WriteResult;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 프로세스 안에서만 유지되는 버전 저장소. 로컬 모드와 테스트용이다.
 */
public final class InMemoryVersionedStore implements VersionedStore {

    private final Map<String, VersionedRecord> records = new HashMap<>();

    /**
     * 새 레코드를 버전 1로 넣는다. 이미 있으면 덮어쓰지 않고 기존 레코드를 돌려준다.
     */
    public synchronized VersionedRecord insert(String id, Map<String, Object> fields) {
        Preconditions.checkNotBlank(id, "id");
        VersionedRecord existing = records.get(id);
        if (existing != null) {
            return existing;
        }
        VersionedRecord created = new VersionedRecord(id, 1L, fields);
        records.put(id, created);
        return created;
    }

    public synchronized Optional<VersionedRecord> find(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public synchronized void remove(String id) {
        records.remove(id);
    }

    public synchronized int size() {
        return records.size();
    }

    @Override
    public synchronized CompletableFuture<VersionedRecord> read(String id) {
        VersionedRecord record = records.get(id);
        if (record == null) {
            return CompletableFuture.failedFuture(new RecordNotFoundException(id));
        }
        return CompletableFuture.completedFuture(record);
    }

    @Override
    public synchronized CompletableFuture<WriteResult> conditionalWrite(String id, Map<String, Object> fields, long expectedVersion) {
        VersionedRecord current = records.get(id);
        if (current == null) {
            return CompletableFuture.failedFuture(new RecordNotFoundException(id));
        }
        if (current.version() != expectedVersion) {
            return CompletableFuture.completedFuture(WriteResult.conflict(current.version()));
        }
        Map<String, Object> merged = new LinkedHashMap<>(current.fields());
        if (fields != null) {
            merged.putAll(fields);
        }
        long next = current.version() + 1;
        records.put(id, new VersionedRecord(id, next, merged));
        return CompletableFuture.completedFuture(WriteResult.written(next));
    }
}
