package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.realtime.AsyncChangeCallback;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.realtime.ChangeFilter;
import kr.courtside.sync.api.realtime.EventType;
import kr.courtside.sync.api.realtime.RealtimeSubscription;
import kr.courtside.sync.api.realtime.SubscriptionSpec;
import kr.courtside.sync.api.transport.ChangeBinding;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.RealtimeTransport;
import kr.courtside.sync.api.transport.TransportChannel;
import kr.courtside.sync.api.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 논리 구독을 (topic, filter)별 전송 채널 하나로 묶어 관리한다.
 * <p>
 * 채널은 첫 구독 때 열리고 마지막 구독이 해제되면 닫힌다. 채널 맵은 이벤트 루프에서만 바뀌며,
 * 전송 계층 콜백은 세대 번호를 확인한 뒤에만 상태를 건드린다.
 */
public final class ChannelRegistry implements ReconnectParticipant {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelRegistry.class);

    private final RealtimeTransport transport;
    private final TaskExecutor executor;
    private final Monitor monitor;
    private final RealtimeSettings settings;
    private final ChannelLifecycleListener lifecycle;
    private final EventDispatcher dispatcher;
    private final Map<ChannelKey, ManagedChannel> channels = new LinkedHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(0);

    public ChannelRegistry(RealtimeTransport transport,
                           TaskExecutor executor,
                           Monitor monitor,
                           RealtimeSettings settings,
                           ChannelLifecycleListener lifecycle) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.dispatcher = new EventDispatcher(executor, monitor, settings.latencyWarnMillis());
    }

    public RealtimeSubscription subscribe(SubscriptionSpec spec, AsyncChangeCallback callback, Consumer<Throwable> onError) {
        Preconditions.checkNotNull(spec, "spec");
        Preconditions.checkNotNull(callback, "callback");
        String id = spec.id() != null ? spec.id() : nextId(spec);
        DefaultSubscription subscription = new DefaultSubscription(id, spec, callback, onError,
                closed -> runOnLoop(() -> detach(closed)));
        runOnLoop(() -> attach(subscription));
        return subscription;
    }

    /**
     * 모든 구독을 해제하고 채널을 닫는다. 기존 핸들의 close()는 이후 아무 일도 하지 않는다.
     */
    public void unsubscribeAll() {
        runOnLoop(() -> {
            int count = channels.size();
            for (ManagedChannel channel : new ArrayList<>(channels.values())) {
                channel.subscribers.values().forEach(DefaultSubscription::deactivate);
                channel.subscribers.clear();
                destroy(channel);
            }
            if (count > 0) {
                LOGGER.info("모든 실시간 구독을 해제했습니다 (채널 {}개)", count);
            }
        });
    }

    @Override
    public int reopen() {
        List<ManagedChannel> current = new ArrayList<>(channels.values());
        for (ManagedChannel channel : current) {
            channel.cancelTimeout();
            closeHandle(channel);
            open(channel);
        }
        if (!current.isEmpty()) {
            LOGGER.info("실시간 채널 {}개를 다시 열었습니다", current.size());
        }
        return current.size();
    }

    public List<ChannelInfo> activeChannels() {
        List<ChannelInfo> infos = new ArrayList<>();
        for (ManagedChannel channel : channels.values()) {
            infos.add(channel.info());
        }
        return List.copyOf(infos);
    }

    public int channelCount() {
        return channels.size();
    }

    public int subscriptionCount() {
        int total = 0;
        for (ManagedChannel channel : channels.values()) {
            total += channel.refCount();
        }
        return total;
    }

    private void attach(DefaultSubscription subscription) {
        if (!subscription.isActive()) {
            return;
        }
        replaceExisting(subscription);
        ChannelKey key = subscription.key();
        ManagedChannel channel = channels.get(key);
        if (channel == null) {
            channel = new ManagedChannel(key);
            channels.put(key, channel);
            channel.subscribers.put(subscription.id(), subscription);
            LOGGER.info("채널 '{}'을 엽니다 (구독 {})", channel.name, subscription.id());
            open(channel);
            return;
        }
        channel.subscribers.put(subscription.id(), subscription);
        LOGGER.debug("채널 '{}'을 재사용합니다 (참조 {}개)", channel.name, channel.refCount());
    }

    private void replaceExisting(DefaultSubscription subscription) {
        for (ManagedChannel channel : new ArrayList<>(channels.values())) {
            DefaultSubscription existing = channel.subscribers.get(subscription.id());
            if (existing != null && existing != subscription) {
                existing.deactivate();
                LOGGER.debug("같은 id의 기존 구독 '{}'을 교체합니다", subscription.id());
                detach(existing);
            }
        }
    }

    private void detach(DefaultSubscription subscription) {
        ManagedChannel channel = channels.get(subscription.key());
        if (channel == null || channel.subscribers.get(subscription.id()) != subscription) {
            return;
        }
        channel.subscribers.remove(subscription.id());
        if (channel.subscribers.isEmpty()) {
            LOGGER.info("마지막 구독이 해제되어 채널 '{}'을 닫습니다", channel.name);
            destroy(channel);
        }
    }

    private void open(ManagedChannel channel) {
        long generation = ++channel.generation;
        channel.phase = ChannelPhase.OPENING;
        lifecycle.channelOpening(channel.name);

        TransportChannel handle = null;
        try {
            handle = transport.openChannel(channel.name);
            handle.onChange(binding(channel.key), event -> executor.execute(() -> onEvent(channel, generation, event)));
        } catch (Exception e) {
            if (handle != null) {
                release(handle);
            }
            onStatus(channel, generation, ChannelStatus.CHANNEL_ERROR, new TransportException("채널 열기 실패: " + channel.name, e));
            return;
        }
        channel.handle = handle;
        channel.subscribeTimeout = executor.schedule(
                () -> onStatus(channel, generation, ChannelStatus.TIMED_OUT, new TransportException("구독 확인 시간 초과: " + channel.name)),
                settings.subscribeTimeoutMillis(), TimeUnit.MILLISECONDS);
        try {
            handle.subscribe((status, cause) -> executor.execute(() -> onStatus(channel, generation, status, cause)))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            executor.execute(() -> onStatus(channel, generation, ChannelStatus.CHANNEL_ERROR, EventDispatcher.unwrap(error)));
                        }
                    });
        } catch (Exception e) {
            onStatus(channel, generation, ChannelStatus.CHANNEL_ERROR, e);
        }
    }

    private void onStatus(ManagedChannel channel, long generation, ChannelStatus status, Throwable cause) {
        if (!isCurrent(channel, generation)) {
            LOGGER.debug("이전 세대 채널 '{}'의 상태 {}를 무시합니다", channel.name, status);
            return;
        }
        channel.cancelTimeout();
        if (status == ChannelStatus.SUBSCRIBED) {
            channel.phase = ChannelPhase.SUBSCRIBED;
            LOGGER.info("채널 '{}' 구독이 확인되었습니다", channel.name);
            lifecycle.channelSubscribed(channel.name);
            return;
        }
        if (channel.phase == ChannelPhase.FAILED) {
            return;
        }
        channel.phase = ChannelPhase.FAILED;
        Throwable error = cause != null ? cause : new TransportException("채널 상태 " + status + ": " + channel.name);
        LOGGER.warn("채널 '{}' 상태 {} - 재연결을 요청합니다", channel.name, status, error);
        monitor.recordError(error, Map.of("channel", channel.name, "status", status.name(), "action", "subscribe"));
        lifecycle.channelFailed(channel.name, status, error);
    }

    private void onEvent(ManagedChannel channel, long generation, ChangeEvent event) {
        if (!isCurrent(channel, generation)) {
            return;
        }
        dispatcher.dispatch(channel.name, channel.snapshot(), event);
    }

    private boolean isCurrent(ManagedChannel channel, long generation) {
        return channels.get(channel.key) == channel && channel.generation == generation;
    }

    private void destroy(ManagedChannel channel) {
        channels.remove(channel.key);
        channel.generation++;
        channel.cancelTimeout();
        channel.phase = ChannelPhase.CLOSED;
        closeHandle(channel);
    }

    private void closeHandle(ManagedChannel channel) {
        TransportChannel handle = channel.handle;
        channel.handle = null;
        if (handle != null) {
            release(handle);
        }
    }

    private void release(TransportChannel handle) {
        try {
            transport.closeChannel(handle).whenComplete((ignored, error) -> {
                if (error != null) {
                    LOGGER.warn("채널 '{}' 닫기에 실패했습니다", handle.name(), error);
                }
            });
        } catch (Exception e) {
            LOGGER.warn("채널 '{}' 닫기에 실패했습니다", handle.name(), e);
        }
    }

    private static ChangeBinding binding(ChannelKey key) {
        ChangeFilter filter = key.filter() == null ? null : ChangeFilter.parse(key.filter());
        return new ChangeBinding(key.topic(), EventType.ALL, filter);
    }

    private String nextId(SubscriptionSpec spec) {
        return spec.topic() + "-" + spec.eventType().wireName() + "-" + idSequence.incrementAndGet();
    }

    private void runOnLoop(Runnable task) {
        if (executor.inEventLoop()) {
            task.run();
        } else {
            executor.execute(task);
        }
    }
}
