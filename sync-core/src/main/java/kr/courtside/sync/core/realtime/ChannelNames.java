package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.Preconditions;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 채널 이름 규칙.
 * <ul>
 *     <li>realtime:{topic}</li>
 *     <li>realtime:{topic}:{filter-digest}</li>
 *     <li>presence:play_date:{scope}</li>
 * </ul>
 */
public final class ChannelNames {

    private static final String REALTIME_PREFIX = "realtime:";
    private static final String PRESENCE_PREFIX = "presence:play_date:";
    private static final int DIGEST_BYTES = 8;

    private ChannelNames() {
    }

    public static String realtime(String topic, String filter) {
        Preconditions.checkNotBlank(topic, "topic");
        if (filter == null || filter.isBlank()) {
            return REALTIME_PREFIX + topic;
        }
        return REALTIME_PREFIX + topic + ":" + hash(filter);
    }

    public static String presence(String scopeId) {
        Preconditions.checkNotBlank(scopeId, "scopeId");
        return PRESENCE_PREFIX + scopeId;
    }

    /**
     * 필터 문자열 SHA-256의 앞 8바이트를 16진수로 표기한다. 서로 다른 필터가 같은 전송 채널을 공유하지 않게 한다.
     */
    static String hash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, DIGEST_BYTES);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256을 사용할 수 없습니다", e);
        }
    }
}
