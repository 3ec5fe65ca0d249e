package kr.courtside.sync.api.executor;

/**
 * 예약 작업 핸들.
 */
public interface ScheduledTask {

    /**
     * 아직 실행되지 않았다면 취소한다. 여러 번 호출해도 안전하다.
     */
    void cancel();

    boolean isCancelled();
}
