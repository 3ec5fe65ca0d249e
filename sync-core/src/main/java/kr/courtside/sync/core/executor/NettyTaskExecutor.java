package kr.courtside.sync.core.executor;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import kr.courtside.sync.api.executor.ScheduledTask;
import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.lifecycle.ManagedLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Netty {@link DefaultEventExecutor} 하나를 코어 이벤트 루프로 쓰는 실행기.
 */
public final class NettyTaskExecutor implements TaskExecutor, ManagedLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyTaskExecutor.class);

    private final EventExecutor loop;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public NettyTaskExecutor(String threadName) {
        this.loop = new DefaultEventExecutor(ThreadFactories.daemon(Objects.requireNonNull(threadName, "threadName")));
    }

    @Override
    public void start() {
        // DefaultEventExecutor는 첫 작업 제출 시 스레드를 띄운다
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("이벤트 루프를 종료합니다");
        loop.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (stopped.get()) {
            LOGGER.debug("이벤트 루프가 종료되어 작업을 버립니다");
            return;
        }
        try {
            loop.execute(guard(task));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("이벤트 루프가 작업을 거부했습니다", e);
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delay, TimeUnit unit) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(unit, "unit");
        ScheduledFuture<?> future = loop.schedule(guard(task), Math.max(0L, delay), unit);
        return new ScheduledTask() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public boolean inEventLoop() {
        return loop.inEventLoop();
    }

    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                LOGGER.error("이벤트 루프 작업 실행 중 오류", e);
            }
        };
    }
}
