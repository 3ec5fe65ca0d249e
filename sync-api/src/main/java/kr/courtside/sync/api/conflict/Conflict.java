package kr.courtside.sync.api.conflict;

import kr.courtside.sync.api.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 버전 불일치로 거부된 조건부 쓰기의 기록.
 * <p>
 * 살아 있는 충돌은 항상 {@code remoteVersion > localVersion}을 만족한다. 해결 도중 새 충돌이 나면
 * 같은 id로 원격 스냅샷만 교체된 인스턴스가 저장된다.
 *
 * @param localVersion  쓰기 직전 읽었던 버전
 * @param remoteVersion 충돌 후 다시 읽은 최신 버전
 * @param localChanges  호출자가 쓰려던 변경분
 * @param remoteChanges 최신 레코드의 필드 스냅샷
 * @param retryCount    지금까지 시도한 해결 횟수
 */
public record Conflict(String conflictId,
                       String entityId,
                       long localVersion,
                       long remoteVersion,
                       Map<String, Object> localChanges,
                       Map<String, Object> remoteChanges,
                       Instant createdAt,
                       int retryCount) {

    public Conflict {
        Preconditions.checkNotBlank(conflictId, "conflictId");
        Preconditions.checkNotBlank(entityId, "entityId");
        Preconditions.checkNotNull(createdAt, "createdAt");
        if (remoteVersion <= localVersion) {
            throw new IllegalArgumentException("remoteVersion(" + remoteVersion + ") must be greater than localVersion(" + localVersion + ")");
        }
        localChanges = copy(localChanges);
        remoteChanges = copy(remoteChanges);
    }

    public Conflict withRemote(long newRemoteVersion, Map<String, Object> newRemoteChanges) {
        return new Conflict(conflictId, entityId, localVersion, newRemoteVersion, localChanges, newRemoteChanges, createdAt, retryCount);
    }

    public Conflict withRetryCount(int newRetryCount) {
        return new Conflict(conflictId, entityId, localVersion, remoteVersion, localChanges, remoteChanges, createdAt, newRetryCount);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
