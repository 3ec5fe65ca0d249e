package kr.courtside.sync.core.redis;

import kr.courtside.sync.api.presence.PresenceRecord;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.transport.ChangeBinding;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.ChannelStatusListener;
import kr.courtside.sync.api.transport.PresenceEventKind;
import kr.courtside.sync.api.transport.PresenceListener;
import kr.courtside.sync.api.transport.TransportChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Redis pub/sub 채널 몇 개를 묶은 전송 채널 하나.
 * 변경 바인딩마다 토픽 채널을, 프레즌스 리스너가 있으면 프레즌스 이벤트 채널을 구독한다.
 */
final class LettuceTransportChannel implements TransportChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(LettuceTransportChannel.class);

    private record Binding(ChangeBinding binding, Consumer<ChangeEvent> listener) {
    }

    private final String name;
    private final LettuceRealtimeTransport transport;
    private final List<Binding> bindings = new CopyOnWriteArrayList<>();
    private final List<PresenceListener> presenceListeners = new CopyOnWriteArrayList<>();
    private final Map<String, PresenceRecord> members = new ConcurrentHashMap<>();
    private volatile ChannelStatusListener statusListener;
    private volatile String trackedKey;
    private volatile long epoch = -1L;
    private volatile boolean terminated;

    LettuceTransportChannel(String name, LettuceRealtimeTransport transport) {
        this.name = Objects.requireNonNull(name, "name");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void onChange(ChangeBinding binding, Consumer<ChangeEvent> listener) {
        bindings.add(new Binding(Objects.requireNonNull(binding, "binding"), Objects.requireNonNull(listener, "listener")));
    }

    @Override
    public void onPresence(PresenceListener listener) {
        presenceListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public CompletableFuture<Void> subscribe(ChannelStatusListener listener) {
        this.statusListener = Objects.requireNonNull(listener, "listener");
        return transport.subscribeChannel(this);
    }

    @Override
    public CompletableFuture<Void> track(PresenceRecord record) {
        return transport.track(this, record);
    }

    @Override
    public CompletableFuture<Void> untrack() {
        return transport.untrack(this);
    }

    @Override
    public Map<String, List<PresenceRecord>> presenceState() {
        Map<String, List<PresenceRecord>> grouped = new LinkedHashMap<>();
        for (PresenceRecord record : members.values()) {
            grouped.computeIfAbsent(record.actorId(), key -> new ArrayList<>()).add(record);
        }
        return grouped;
    }

    Set<String> topics() {
        Set<String> topics = new LinkedHashSet<>();
        for (Binding binding : bindings) {
            topics.add(binding.binding().topic());
        }
        return topics;
    }

    boolean tracksPresence() {
        return !presenceListeners.isEmpty();
    }

    long epoch() {
        return epoch;
    }

    void bindEpoch(long epoch) {
        this.epoch = epoch;
    }

    String trackedKey() {
        return trackedKey;
    }

    void trackedKey(String key) {
        this.trackedKey = key;
    }

    boolean isTerminated() {
        return terminated;
    }

    void deliverChange(ChangeEvent event) {
        if (terminated) {
            return;
        }
        for (Binding binding : bindings) {
            if (binding.binding().accepts(event)) {
                binding.listener().accept(event);
            }
        }
    }

    void applySnapshot(Map<String, PresenceRecord> snapshot) {
        members.clear();
        members.putAll(snapshot);
        firePresence(PresenceEventKind.SYNC, null);
    }

    void applyJoin(String key, PresenceRecord record) {
        members.put(key, record);
        firePresence(PresenceEventKind.JOIN, key);
    }

    void applyLeave(String key) {
        if (members.remove(key) != null) {
            firePresence(PresenceEventKind.LEAVE, key);
        }
    }

    void notifyStatus(ChannelStatus status, Throwable cause) {
        if (terminated) {
            return;
        }
        if (status != ChannelStatus.SUBSCRIBED) {
            terminated = true;
        }
        ChannelStatusListener listener = statusListener;
        if (listener == null) {
            return;
        }
        try {
            listener.onStatus(status, cause);
        } catch (Exception e) {
            LOGGER.warn("채널 '{}' 상태 리스너 실행 중 오류", name, e);
        }
    }

    void terminate() {
        terminated = true;
        members.clear();
    }

    private void firePresence(PresenceEventKind kind, String key) {
        if (terminated) {
            return;
        }
        for (PresenceListener listener : presenceListeners) {
            try {
                listener.onPresence(kind, key);
            } catch (Exception e) {
                LOGGER.warn("채널 '{}' 프레즌스 리스너 실행 중 오류", name, e);
            }
        }
    }
}
