package kr.courtside.sync.core.realtime;

/**
 * 진단용 채널 스냅샷.
 */
public record ChannelInfo(String name, String topic, String filter, ChannelPhase phase, int refCount) {
}
