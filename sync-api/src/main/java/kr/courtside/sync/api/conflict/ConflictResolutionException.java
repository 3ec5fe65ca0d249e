package kr.courtside.sync.api.conflict;

/**
 * 충돌 해결 실패 원인. 해결 실패 콜백으로만 전달되며 호출자에게 던져지지 않는다.
 */
public class ConflictResolutionException extends RuntimeException {

    public ConflictResolutionException(String message) {
        super(message);
    }

    public ConflictResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
