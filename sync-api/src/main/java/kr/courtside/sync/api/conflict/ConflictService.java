package kr.courtside.sync.api.conflict;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Optimistic-concurrency updates over versioned records.
 */
public interface ConflictService {

    /**
     * Reads the record, writes {@code changes} against the observed version and reports a conflict as data.
     * Only a failed initial read completes the future exceptionally.
     */
    CompletableFuture<UpdateResult> updateWithConflictCheck(String entityId, Map<String, Object> changes);

    CompletableFuture<Boolean> resolveConflict(String conflictId, ResolutionStrategy strategy);

    void dismissConflict(String conflictId);

    void clearConflicts();

    List<Conflict> conflicts();

    Optional<Conflict> conflict(String conflictId);

    default boolean hasConflicts() {
        return !conflicts().isEmpty();
    }
}
