package kr.courtside.sync.api.presence;

import java.util.Map;

public interface PresenceService {

    PresenceHandle trackPresence(String scopeId, PresenceActor actor);

    default void updateActivity(PresenceHandle handle, String activityId) {
        handle.updateActivity(activityId);
    }

    /**
     * 추적 중이 아닌 스코프면 빈 맵을 돌려준다.
     */
    Map<String, DerivedPresence> getPresenceSnapshot(String scopeId);
}
