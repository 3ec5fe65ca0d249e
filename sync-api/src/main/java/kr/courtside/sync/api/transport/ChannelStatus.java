package kr.courtside.sync.api.transport;

/**
 * Status notifications a transport channel reports during its life.
 */
public enum ChannelStatus {
    SUBSCRIBED,
    CLOSED,
    CHANNEL_ERROR,
    TIMED_OUT;

    public boolean isFailure() {
        return this != SUBSCRIBED;
    }
}
