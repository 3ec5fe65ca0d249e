package kr.courtside.sync.api.transport;

/**
 * 채널 상태 콜백. 구독 확인 이후에도 끊김/오류가 발생하면 다시 호출될 수 있다.
 * 전송 구현 스레드에서 호출될 수 있으므로 구현체는 상태를 직접 바꾸지 말고 루프로 넘겨야 한다.
 */
@FunctionalInterface
public interface ChannelStatusListener {

    void onStatus(ChannelStatus status, Throwable cause);
}
