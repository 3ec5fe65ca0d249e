package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.executor.ScheduledTask;
import kr.courtside.sync.api.transport.TransportChannel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 레지스트리가 소유하는 채널 상태. 이벤트 루프에서만 접근한다.
 */
final class ManagedChannel {

    final ChannelKey key;
    final String name;
    final Map<String, DefaultSubscription> subscribers = new LinkedHashMap<>();
    TransportChannel handle;
    ChannelPhase phase = ChannelPhase.OPENING;
    long generation;
    ScheduledTask subscribeTimeout;

    ManagedChannel(ChannelKey key) {
        this.key = key;
        this.name = key.channelName();
    }

    int refCount() {
        return subscribers.size();
    }

    List<DefaultSubscription> snapshot() {
        return List.copyOf(subscribers.values());
    }

    void cancelTimeout() {
        if (subscribeTimeout != null) {
            subscribeTimeout.cancel();
            subscribeTimeout = null;
        }
    }

    ChannelInfo info() {
        return new ChannelInfo(name, key.topic(), key.filter(), phase, refCount());
    }
}
