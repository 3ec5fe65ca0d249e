package kr.courtside.sync.core.monitoring;

import kr.courtside.sync.api.monitoring.Monitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 지표를 로그로만 남기는 {@link Monitor}. 외부 수집기가 없을 때 기본값으로 쓴다.
 */
public final class LoggingMonitor implements Monitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingMonitor.class);

    @Override
    public void recordLatency(long millis, Map<String, String> context) {
        LOGGER.debug("latency {}ms {}", millis, context);
    }

    @Override
    public void recordError(Throwable error, Map<String, String> context) {
        LOGGER.warn("오류 기록 {}: {}", context, error == null ? "null" : error.toString());
    }

    @Override
    public void recordMetric(String name, double value, Map<String, String> context) {
        LOGGER.debug("metric {}={} {}", name, value, context);
    }
}
