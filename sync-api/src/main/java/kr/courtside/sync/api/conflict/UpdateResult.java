package kr.courtside.sync.api.conflict;

/**
 * {@code updateWithConflictCheck}의 결과.
 *
 * @param success  최종적으로 쓰기가 반영되었는지
 * @param version  반영된 경우 새 버전, 알 수 없으면 -1
 * @param conflict 해결되지 않은 충돌, 성공이면 {@code null}
 */
public record UpdateResult(boolean success, long version, Conflict conflict) {

    public static UpdateResult success(long version) {
        return new UpdateResult(true, version, null);
    }

    public static UpdateResult conflicted(Conflict conflict) {
        return new UpdateResult(false, -1L, conflict);
    }

    public boolean hasConflict() {
        return conflict != null;
    }
}
