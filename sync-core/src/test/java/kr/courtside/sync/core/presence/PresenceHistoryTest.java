package kr.courtside.sync.core.presence;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static kr.courtside.sync.core.presence.PresenceHistory.Action.JOIN;
import static kr.courtside.sync.core.presence.PresenceHistory.Action.LEAVE;
import static kr.courtside.sync.core.presence.PresenceHistory.Action.UPDATE;
import static org.junit.jupiter.api.Assertions.*;

class PresenceHistoryTest {

    private static final Instant BASE = Instant.parse("2024-05-01T09:00:00Z");

    @Test
    void record_keepsNewestFirstWithinCapacity() {
        PresenceHistory history = new PresenceHistory(3);

        for (int i = 0; i < 5; i++) {
            history.record("pd-1", "actor-" + i, JOIN, BASE.plusSeconds(i));
        }

        List<PresenceHistory.Entry> entries = history.entries();
        assertEquals(3, entries.size());
        assertEquals("actor-4", entries.get(0).actorId());
        assertEquals("actor-2", entries.get(2).actorId());
    }

    @Test
    void analytics_summarisesSessionsAndPeakHour() {
        PresenceHistory history = new PresenceHistory(100);
        history.record("pd-1", "kim", JOIN, BASE);
        history.record("pd-1", "lee", JOIN, BASE.plus(Duration.ofMinutes(5)));
        history.record("pd-1", "kim", UPDATE, BASE.plus(Duration.ofMinutes(10)));
        history.record("pd-1", "kim", LEAVE, BASE.plus(Duration.ofMinutes(30)));
        history.record("pd-1", "lee", LEAVE, BASE.plus(Duration.ofMinutes(55)));
        history.record("pd-1", "park", JOIN, BASE.plus(Duration.ofMinutes(70)));
        history.record("pd-2", "choi", JOIN, BASE);

        PresenceHistory.Analytics analytics = history.analytics("pd-1", BASE.plus(Duration.ofHours(2)));

        assertEquals(6, analytics.totalEvents());
        assertEquals(3, analytics.uniqueActors());
        assertEquals(3, analytics.joins());
        assertEquals(2, analytics.leaves());
        assertEquals(Duration.ofMinutes(40).toMillis(), analytics.averageSessionMillis());
        assertEquals(BASE, analytics.peakHour());
    }

    @Test
    void analytics_ignoresEventsOlderThanOneDay() {
        PresenceHistory history = new PresenceHistory(100);
        history.record("pd-1", "kim", JOIN, BASE);
        history.record("pd-1", "kim", LEAVE, BASE.plus(Duration.ofHours(1)));

        PresenceHistory.Analytics analytics = history.analytics("pd-1", BASE.plus(Duration.ofHours(25)).plusSeconds(1));

        assertEquals(0, analytics.totalEvents());
        assertEquals(0L, analytics.averageSessionMillis());
        assertNull(analytics.peakHour());
    }

    @Test
    void clear_dropsEverything() {
        PresenceHistory history = new PresenceHistory(10);
        history.record("pd-1", "kim", JOIN, BASE);

        history.clear();

        assertTrue(history.entries().isEmpty());
    }
}
