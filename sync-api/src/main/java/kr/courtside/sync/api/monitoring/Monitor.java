package kr.courtside.sync.api.monitoring;

import java.util.Map;

/**
 * Observational metrics sink. Implementations must never throw into the caller.
 */
public interface Monitor {

    void recordLatency(long millis, Map<String, String> context);

    void recordError(Throwable error, Map<String, String> context);

    void recordMetric(String name, double value, Map<String, String> context);

    static Monitor noop() {
        return new Monitor() {
            @Override
            public void recordLatency(long millis, Map<String, String> context) {
            }

            @Override
            public void recordError(Throwable error, Map<String, String> context) {
            }

            @Override
            public void recordMetric(String name, double value, Map<String, String> context) {
            }
        };
    }
}
