package kr.courtside.sync.api.realtime;

import kr.courtside.sync.api.Preconditions;

/**
 * 논리 구독의 대상. 같은 (topic, filter)를 가진 구독은 하나의 채널을 공유한다.
 *
 * @param id        호출자가 지정한 구독 id, 없으면 자동 생성
 * @param topic     테이블/토픽 이름
 * @param eventType 받을 변경 종류
 * @param filter    {@link ChangeFilter} 표현식, 없으면 {@code null}
 */
public record SubscriptionSpec(String id, String topic, EventType eventType, String filter) {

    public SubscriptionSpec {
        Preconditions.checkNotBlank(topic, "topic");
        eventType = eventType == null ? EventType.ALL : eventType;
        filter = filter == null || filter.isBlank() ? null : filter.trim();
        if (filter != null) {
            ChangeFilter.parse(filter);
        }
    }

    public static SubscriptionSpec of(String topic) {
        return new SubscriptionSpec(null, topic, EventType.ALL, null);
    }

    public static SubscriptionSpec of(String topic, String filter) {
        return new SubscriptionSpec(null, topic, EventType.ALL, filter);
    }

    public SubscriptionSpec withEvent(EventType type) {
        return new SubscriptionSpec(id, topic, type, filter);
    }

    public SubscriptionSpec withId(String newId) {
        return new SubscriptionSpec(newId, topic, eventType, filter);
    }

    public boolean hasFilter() {
        return filter != null;
    }
}
