package kr.courtside.sync.api.realtime;

/**
 * 실시간 연결 상태 머신.
 */
public enum ConnectionState {
    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    RECONNECTING("reconnecting"),
    ERROR("error");

    private final String wireName;

    ConnectionState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isConnected() {
        return this == CONNECTED;
    }
}
