package kr.courtside.sync.api.realtime;

/**
 * 구독 핸들.
 * close() 하면 해당 구독이 해제되며, 두 번째 호출부터는 아무 일도 하지 않는다.
 */
public interface RealtimeSubscription extends AutoCloseable {

    String id();

    SubscriptionSpec spec();

    boolean isActive();

    @Override
    void close();
}
