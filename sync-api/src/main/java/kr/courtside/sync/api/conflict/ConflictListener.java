package kr.courtside.sync.api.conflict;

/**
 * Observer for the conflict lifecycle. All methods are optional.
 */
public interface ConflictListener {

    default void onConflictDetected(Conflict conflict) {
    }

    /**
     * 해결 시도 중 다른 쓰기가 끼어들어 원격 스냅샷이 갱신되었다.
     */
    default void onConflictUpdated(Conflict conflict) {
    }

    default void onConflictResolved(Conflict conflict, ResolutionStrategy strategy) {
    }

    default void onResolutionFailed(Conflict conflict, Throwable cause) {
    }
}
