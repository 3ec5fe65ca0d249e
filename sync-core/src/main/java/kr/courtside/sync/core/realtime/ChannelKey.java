package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.realtime.SubscriptionSpec;

/**
 * 채널 식별자. 같은 (topic, filter)는 항상 같은 채널을 가리킨다.
 */
public record ChannelKey(String topic, String filter) {

    public ChannelKey {
        Preconditions.checkNotBlank(topic, "topic");
        filter = filter == null || filter.isBlank() ? null : filter;
    }

    public static ChannelKey of(SubscriptionSpec spec) {
        return new ChannelKey(spec.topic(), spec.filter());
    }

    public String channelName() {
        return ChannelNames.realtime(topic, filter);
    }
}
