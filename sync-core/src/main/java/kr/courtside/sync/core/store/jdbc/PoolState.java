package kr.courtside.sync.core.store.jdbc;

/**
 * 버전 테이블 커넥션 풀의 상태.
 */
public enum PoolState {
    /** 시작 전이거나 종료된 상태. */
    STOPPED(false),
    /** 풀을 만드는 중. */
    CONNECTING(false),
    /** 쓰기와 조회를 받는 상태. */
    RUNNING(true),
    /** 연속 실패로 요청을 거부하고 재생성을 기다리는 상태. */
    DEGRADED(false);

    private final boolean acceptsWork;

    PoolState(boolean acceptsWork) {
        this.acceptsWork = acceptsWork;
    }

    public boolean acceptsWork() {
        return acceptsWork;
    }
}
