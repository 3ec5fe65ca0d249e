package kr.courtside.sync.api.executor;

import java.util.concurrent.TimeUnit;

/**
 * 단일 이벤트 루프 스레드에 작업을 넘기는 실행기.
 * <p>
 * 코어의 모든 가변 상태는 이 루프 위에서만 변경된다. 전송/저장소의 비동기 완료는
 * {@link #execute(Runnable)}로 루프에 다시 올라온 뒤 처리된다.
 */
public interface TaskExecutor {

    void execute(Runnable task);

    /**
     * 지연 후 한 번 실행될 작업을 예약한다.
     */
    ScheduledTask schedule(Runnable task, long delay, TimeUnit unit);

    /**
     * 루프가 사용하는 시계의 현재 시각(epoch millis).
     */
    long currentTimeMillis();

    boolean inEventLoop();
}
