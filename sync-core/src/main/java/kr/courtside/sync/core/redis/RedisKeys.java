package kr.courtside.sync.core.redis;

import kr.courtside.sync.api.Preconditions;

/**
 * 환경별 Redis 키/채널 이름 규칙.
 * <pre>
 * courtside:&lt;env&gt;:changes:&lt;topic&gt;          변경 이벤트 pub/sub 채널
 * courtside:&lt;env&gt;:&lt;presence channel&gt;         프레즌스 멤버십 해시
 * courtside:&lt;env&gt;:&lt;presence channel&gt;:events  join/leave pub/sub 채널
 * </pre>
 */
public final class RedisKeys {

    private static final String ROOT = "courtside";

    private final String prefix;

    public RedisKeys(String environment) {
        Preconditions.checkNotBlank(environment, "environment");
        this.prefix = ROOT + ":" + environment + ":";
    }

    public String changes(String topic) {
        Preconditions.checkNotBlank(topic, "topic");
        return prefix + "changes:" + topic;
    }

    public String presenceHash(String channelName) {
        Preconditions.checkNotBlank(channelName, "channelName");
        return prefix + channelName;
    }

    public String presenceEvents(String channelName) {
        return presenceHash(channelName) + ":events";
    }
}
