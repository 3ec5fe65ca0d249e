package kr.courtside.sync.core.redis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedisKeysTest {

    private final RedisKeys keys = new RedisKeys("prod");

    @Test
    void changes_isScopedByEnvironment() {
        assertEquals("courtside:prod:changes:matches", keys.changes("matches"));
        assertEquals("courtside:dev:changes:matches", new RedisKeys("dev").changes("matches"));
    }

    @Test
    void presenceKeys_shareTheHashPrefix() {
        assertEquals("courtside:prod:presence:play_date:pd-1", keys.presenceHash("presence:play_date:pd-1"));
        assertEquals("courtside:prod:presence:play_date:pd-1:events", keys.presenceEvents("presence:play_date:pd-1"));
    }

    @Test
    void blankInput_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RedisKeys(" "));
        assertThrows(IllegalArgumentException.class, () -> keys.changes(""));
    }
}
