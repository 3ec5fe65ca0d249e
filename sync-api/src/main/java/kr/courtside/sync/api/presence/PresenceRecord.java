package kr.courtside.sync.api.presence;

import kr.courtside.sync.api.Preconditions;

import java.time.Instant;

/**
 * Raw liveness record as published by one client. An actor may have several (tabs, devices).
 */
public record PresenceRecord(String actorId, String displayName, Instant lastSeenAt, boolean playing, String activityId) {

    public PresenceRecord {
        Preconditions.checkNotBlank(actorId, "actorId");
        Preconditions.checkNotNull(lastSeenAt, "lastSeenAt");
        displayName = displayName == null || displayName.isBlank() ? "Unknown" : displayName;
    }
}
