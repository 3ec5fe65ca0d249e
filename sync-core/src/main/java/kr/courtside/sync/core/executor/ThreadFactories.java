package kr.courtside.sync.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 동기화 코어가 만드는 데몬 스레드의 이름과 예외 처리를 통일한다.
 */
public final class ThreadFactories {

    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadFactories.class);
    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT =
            (thread, error) -> LOGGER.error("스레드 {}에서 처리되지 않은 예외가 발생했습니다", thread.getName(), error);

    private ThreadFactories() {
    }

    /**
     * 저장소 I/O처럼 이벤트 루프 밖에서 돌아야 하는 작업용 고정 풀.
     */
    public static ExecutorService workerPool(int threads, String prefix) {
        return Executors.newFixedThreadPool(Math.max(1, threads), daemon(prefix));
    }

    public static ThreadFactory daemon(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        AtomicInteger sequence = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
            return thread;
        };
    }
}
