package kr.courtside.sync.api.presence;

import kr.courtside.sync.api.realtime.ConnectionState;

import java.util.Map;

/**
 * 하나의 스코프에 대한 프레즌스 추적 세션.
 * close()는 하트비트를 멈추고 채널을 반납하며, 여러 번 호출해도 안전하다.
 */
public interface PresenceHandle extends AutoCloseable {

    String scopeId();

    PresenceActor actor();

    /**
     * 현재 활동 id를 바꾼다. {@code null}이면 대기 상태로 돌아간다. 다음 하트비트를 기다리지 않고 바로 발행한다.
     */
    void updateActivity(String activityId);

    /**
     * 채널의 전체 멤버십으로 파생 프레즌스를 다시 계산한다.
     */
    void refresh();

    Map<String, DerivedPresence> snapshot();

    boolean isActive();

    /**
     * CONNECTED, DISCONNECTED, ERROR 중 하나.
     */
    ConnectionState state();

    @Override
    void close();
}
