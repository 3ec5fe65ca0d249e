package kr.courtside.sync.api.presence;

import kr.courtside.sync.api.Preconditions;

/**
 * 로컬에서 프레즌스를 발행하는 사용자.
 */
public record PresenceActor(String actorId, String displayName) {

    public PresenceActor {
        Preconditions.checkNotBlank(actorId, "actorId");
    }

    public static PresenceActor of(String actorId, String displayName) {
        return new PresenceActor(actorId, displayName);
    }
}
