package kr.courtside.sync.api.store;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Point reads and compare-and-swap writes keyed by a version field.
 * <p>
 * A write succeeds iff {@code expectedVersion} equals the stored version at write time; on success the
 * stored version grows by exactly one. {@code fields} are applied on top of the stored fields.
 */
public interface VersionedStore {

    /**
     * Completes exceptionally with {@link RecordNotFoundException} when the id is unknown.
     */
    CompletableFuture<VersionedRecord> read(String id);

    CompletableFuture<WriteResult> conditionalWrite(String id, Map<String, Object> fields, long expectedVersion);
}
