package kr.courtside.sync.api.transport;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.realtime.ChangeFilter;
import kr.courtside.sync.api.realtime.EventType;

/**
 * 채널에 등록하는 변경 수신 조건.
 */
public record ChangeBinding(String topic, EventType eventType, ChangeFilter filter) {

    public ChangeBinding {
        Preconditions.checkNotBlank(topic, "topic");
        eventType = eventType == null ? EventType.ALL : eventType;
    }

    public boolean accepts(ChangeEvent event) {
        if (!topic.equals(event.topic()) || !eventType.matches(event.eventType())) {
            return false;
        }
        return filter == null || filter.matches(event);
    }
}
