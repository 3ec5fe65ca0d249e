package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.transport.ChannelStatus;

/**
 * 채널 수명 이벤트를 연결 상태 머신으로 전달한다. 항상 이벤트 루프에서 호출된다.
 */
public interface ChannelLifecycleListener {

    void channelOpening(String channelName);

    void channelSubscribed(String channelName);

    void channelFailed(String channelName, ChannelStatus status, Throwable cause);
}
