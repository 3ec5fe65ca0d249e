package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.realtime.AsyncChangeCallback;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.realtime.RealtimeSubscription;
import kr.courtside.sync.api.realtime.SubscriptionSpec;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

final class DefaultSubscription implements RealtimeSubscription {

    private final String id;
    private final SubscriptionSpec spec;
    private final ChannelKey key;
    private final AsyncChangeCallback callback;
    private final Consumer<Throwable> onError;
    private final Consumer<DefaultSubscription> disposer;
    private final AtomicBoolean active = new AtomicBoolean(true);

    DefaultSubscription(String id,
                        SubscriptionSpec spec,
                        AsyncChangeCallback callback,
                        Consumer<Throwable> onError,
                        Consumer<DefaultSubscription> disposer) {
        this.id = Objects.requireNonNull(id, "id");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.key = ChannelKey.of(spec);
        this.callback = Objects.requireNonNull(callback, "callback");
        this.onError = onError;
        this.disposer = Objects.requireNonNull(disposer, "disposer");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public SubscriptionSpec spec() {
        return spec;
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    @Override
    public void close() {
        if (active.compareAndSet(true, false)) {
            disposer.accept(this);
        }
    }

    /**
     * 레지스트리가 직접 정리할 때 사용한다. disposer는 호출하지 않는다.
     */
    boolean deactivate() {
        return active.compareAndSet(true, false);
    }

    ChannelKey key() {
        return key;
    }

    AsyncChangeCallback callback() {
        return callback;
    }

    Consumer<Throwable> onError() {
        return onError;
    }

    boolean accepts(ChangeEvent event) {
        return spec.eventType().matches(event.eventType());
    }

    @Override
    public String toString() {
        return "Subscription{" + id + " -> " + key.channelName() + '}';
    }
}
