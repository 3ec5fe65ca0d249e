package kr.courtside.sync.core.presence;

import kr.courtside.sync.api.presence.DerivedPresence;
import kr.courtside.sync.api.presence.PresenceRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces a full membership snapshot to one derived record per actor.
 */
public final class PresenceReducer {

    private PresenceReducer() {
    }

    public static Map<String, DerivedPresence> reduce(Map<String, List<PresenceRecord>> membership, long nowMillis, long offlineTimeoutMillis) {
        if (membership == null || membership.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, PresenceRecord> latest = new HashMap<>();
        for (List<PresenceRecord> records : membership.values()) {
            if (records == null) {
                continue;
            }
            for (PresenceRecord record : records) {
                PresenceRecord current = latest.get(record.actorId());
                if (current == null || record.lastSeenAt().isAfter(current.lastSeenAt())) {
                    latest.put(record.actorId(), record);
                }
            }
        }
        Map<String, DerivedPresence> derived = new TreeMap<>();
        for (PresenceRecord record : latest.values()) {
            boolean online = nowMillis - record.lastSeenAt().toEpochMilli() < offlineTimeoutMillis;
            derived.put(record.actorId(), new DerivedPresence(
                    record.actorId(),
                    record.displayName(),
                    online,
                    record.playing() && online,
                    record.lastSeenAt(),
                    record.activityId()));
        }
        return Collections.unmodifiableMap(derived);
    }

    public static long countOnline(Map<String, DerivedPresence> derived) {
        return derived.values().stream().filter(DerivedPresence::online).count();
    }

    public static long countPlaying(Map<String, DerivedPresence> derived) {
        return derived.values().stream().filter(DerivedPresence::playing).count();
    }
}
