package kr.courtside.sync.core.realtime;

/**
 * 개별 채널의 상태.
 */
public enum ChannelPhase {
    OPENING,
    SUBSCRIBED,
    FAILED,
    CLOSED
}
