package kr.courtside.sync.api.transport;

@FunctionalInterface
public interface PresenceListener {

    /**
     * @param key 변경된 프레즌스 키, SYNC 알림이면 {@code null}
     */
    void onPresence(PresenceEventKind kind, String key);
}
