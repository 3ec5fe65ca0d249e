package kr.courtside.sync.api.transport;

public enum PresenceEventKind {
    SYNC,
    JOIN,
    LEAVE
}
