package kr.courtside.sync.api.realtime;

/**
 * Row-level change kinds carried by the transport. {@link #ALL} only appears in subscriptions.
 */
public enum EventType {
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    ALL("*");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean matches(EventType actual) {
        return this == ALL || this == actual;
    }

    public static EventType fromWireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return ALL;
        }
        for (EventType type : values()) {
            if (type.wireName.equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown event type: " + name);
    }
}
