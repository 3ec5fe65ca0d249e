package kr.courtside.sync.api.realtime;

import java.util.function.Consumer;

/**
 * Subscription and connection surface exposed to application code.
 */
public interface RealtimeService {

    RealtimeSubscription subscribe(SubscriptionSpec spec, AsyncChangeCallback callback, Consumer<Throwable> onError);

    default RealtimeSubscription subscribe(String topic, String filter, ChangeCallback callback) {
        return subscribe(SubscriptionSpec.of(topic, filter), AsyncChangeCallback.of(callback), null);
    }

    default RealtimeSubscription subscribe(String topic, String filter, ChangeCallback callback, Consumer<Throwable> onError) {
        return subscribe(SubscriptionSpec.of(topic, filter), AsyncChangeCallback.of(callback), onError);
    }

    ConnectionState getConnectionState();

    Registration onConnectionStateChange(ConnectionStateListener listener);

    /**
     * 대기 중인 백오프를 취소하고 시도 횟수를 초기화한 뒤 모든 채널을 다시 연다.
     */
    void reconnect();

    void connectivityRestored();

    void connectivityLost();

    void unsubscribeAll();
}
