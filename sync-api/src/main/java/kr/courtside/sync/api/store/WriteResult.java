package kr.courtside.sync.api.store;

/**
 * 조건부 쓰기 결과. 버전 불일치는 예외가 아니라 값으로 돌려준다.
 *
 * @param written    쓰기 성공 여부
 * @param newVersion 성공 시 증가된 버전, 충돌 시 저장소가 알려준 현재 버전(모르면 -1)
 */
public record WriteResult(boolean written, long newVersion) {

    public static WriteResult written(long newVersion) {
        return new WriteResult(true, newVersion);
    }

    public static WriteResult conflict(long currentVersion) {
        return new WriteResult(false, currentVersion);
    }

    public boolean isConflict() {
        return !written;
    }
}
