package kr.courtside.sync.api.presence;

import java.time.Instant;

/**
 * Per-actor presence reduced from every raw record of that actor.
 * {@code playing} is never true while {@code online} is false.
 */
public record DerivedPresence(String actorId, String displayName, boolean online, boolean playing, Instant lastSeenAt, String activityId) {
}
