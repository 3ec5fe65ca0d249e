package kr.courtside.sync.api.realtime;

import kr.courtside.sync.api.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 전송 계층에서 도착한 단일 변경 이벤트.
 * <p>
 * {@code commitTimestamp}는 서버 커밋 시각이며, 전송이 제공하지 않으면 {@code null}이다.
 * 레코드 필드 값에는 null이 허용된다.
 */
public record ChangeEvent(String topic,
                          EventType eventType,
                          Map<String, Object> newRecord,
                          Map<String, Object> oldRecord,
                          Instant commitTimestamp) {

    public ChangeEvent {
        Preconditions.checkNotBlank(topic, "topic");
        Preconditions.checkNotNull(eventType, "eventType");
        Preconditions.checkArgument(eventType != EventType.ALL, "eventType must be concrete");
        newRecord = copy(newRecord);
        oldRecord = copy(oldRecord);
    }

    public static ChangeEvent of(String topic, EventType eventType, Map<String, Object> newRecord, Instant commitTimestamp) {
        return new ChangeEvent(topic, eventType, newRecord, Map.of(), commitTimestamp);
    }

    public boolean hasCommitTimestamp() {
        return commitTimestamp != null;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
