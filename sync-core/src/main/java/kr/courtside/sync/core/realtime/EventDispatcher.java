package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.realtime.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 채널에 도착한 변경 이벤트를 구독자 콜백으로 전달한다.
 * <p>
 * 콜백 하나의 실패는 해당 구독의 오류 처리기와 {@link Monitor}로만 보고되고 나머지 구독자 전달을 막지 않는다.
 */
final class EventDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventDispatcher.class);
    private static final long SLOW_CALLBACK_WARN_MS = 500;

    private final TaskExecutor executor;
    private final Monitor monitor;
    private final long latencyWarnMillis;

    EventDispatcher(TaskExecutor executor, Monitor monitor, long latencyWarnMillis) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.latencyWarnMillis = latencyWarnMillis;
    }

    /**
     * @param subscribers 전달 시점의 구독자 스냅샷. 전달 도중 해제된 구독은 건너뛴다.
     */
    void dispatch(String channelName, List<DefaultSubscription> subscribers, ChangeEvent event) {
        recordLatency(channelName, event);
        for (DefaultSubscription subscription : subscribers) {
            if (!subscription.isActive() || !subscription.accepts(event)) {
                continue;
            }
            invoke(channelName, subscription, event);
        }
    }

    private void invoke(String channelName, DefaultSubscription subscription, ChangeEvent event) {
        long start = System.nanoTime();
        CompletionStage<?> stage;
        try {
            stage = subscription.callback().onChange(event);
        } catch (Exception e) {
            reportFailure(channelName, subscription, e);
            return;
        } finally {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (elapsedMs > SLOW_CALLBACK_WARN_MS) {
                LOGGER.warn("구독 '{}' 콜백 처리 지연 {} ms", subscription.id(), elapsedMs);
            }
        }
        if (stage != null) {
            stage.whenComplete((ignored, error) -> {
                if (error != null) {
                    executor.execute(() -> reportFailure(channelName, subscription, unwrap(error)));
                }
            });
        }
    }

    private void reportFailure(String channelName, DefaultSubscription subscription, Throwable error) {
        LOGGER.warn("채널 '{}'의 구독 '{}' 콜백 실행 중 오류", channelName, subscription.id(), error);
        monitor.recordError(error, Map.of("channel", channelName, "subscription", subscription.id(), "action", "callback"));
        Consumer<Throwable> onError = subscription.onError();
        if (onError == null) {
            return;
        }
        try {
            onError.accept(error);
        } catch (Exception e) {
            LOGGER.warn("구독 '{}'의 오류 처리기가 예외를 던졌습니다", subscription.id(), e);
        }
    }

    private void recordLatency(String channelName, ChangeEvent event) {
        if (!event.hasCommitTimestamp()) {
            return;
        }
        long latency = Math.max(0L, executor.currentTimeMillis() - event.commitTimestamp().toEpochMilli());
        monitor.recordLatency(latency, Map.of("channel", channelName, "topic", event.topic(), "event", event.eventType().wireName()));
        if (latency > latencyWarnMillis) {
            LOGGER.warn("채널 '{}' 전달 지연이 큽니다: {} ms", channelName, latency);
        }
    }

    static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
