package kr.courtside.sync.core.presence;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * 스코프별 프레즌스 변화(입장/퇴장/갱신)의 제한된 이력과 집계.
 */
public final class PresenceHistory {

    private static final long ANALYTICS_WINDOW_MS = TimeUnit.HOURS.toMillis(24);

    public enum Action {
        JOIN,
        LEAVE,
        UPDATE
    }

    public record Entry(String scopeId, String actorId, Action action, Instant at) {
    }

    /**
     * @param averageSessionMillis 입장-퇴장 쌍이 완성된 세션의 평균 길이, 없으면 0
     * @param peakHour             이벤트가 가장 많았던 시각(정시), 이벤트가 없으면 {@code null}
     */
    public record Analytics(int totalEvents, int uniqueActors, int joins, int leaves, long averageSessionMillis, Instant peakHour) {
    }

    private final int maxEntries;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public PresenceHistory(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    public synchronized void record(String scopeId, String actorId, Action action, Instant at) {
        entries.addFirst(new Entry(scopeId, actorId, action, at));
        while (entries.size() > maxEntries) {
            entries.removeLast();
        }
    }

    /**
     * 최신 항목이 앞에 온다.
     */
    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * 최근 24시간의 해당 스코프 이벤트로 집계한다.
     */
    public synchronized Analytics analytics(String scopeId, Instant now) {
        Instant since = now.minusMillis(ANALYTICS_WINDOW_MS);
        List<Entry> recent = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.scopeId().equals(scopeId) && !entry.at().isBefore(since)) {
                recent.add(entry);
            }
        }
        Collections.reverse(recent);

        Set<String> actors = new HashSet<>();
        int joins = 0;
        int leaves = 0;
        Map<String, Instant> openSessions = new HashMap<>();
        long totalSession = 0L;
        int completedSessions = 0;
        Map<Instant, Integer> hourly = new TreeMap<>();
        for (Entry entry : recent) {
            actors.add(entry.actorId());
            hourly.merge(entry.at().truncatedTo(ChronoUnit.HOURS), 1, Integer::sum);
            if (entry.action() == Action.JOIN) {
                joins++;
                openSessions.put(entry.actorId(), entry.at());
            } else if (entry.action() == Action.LEAVE) {
                leaves++;
                Instant joinedAt = openSessions.remove(entry.actorId());
                if (joinedAt != null) {
                    totalSession += entry.at().toEpochMilli() - joinedAt.toEpochMilli();
                    completedSessions++;
                }
            }
        }
        Instant peak = null;
        int peakCount = 0;
        for (Map.Entry<Instant, Integer> hour : hourly.entrySet()) {
            if (hour.getValue() > peakCount) {
                peak = hour.getKey();
                peakCount = hour.getValue();
            }
        }
        long average = completedSessions == 0 ? 0L : totalSession / completedSessions;
        return new Analytics(recent.size(), actors.size(), joins, leaves, average, peak);
    }
}
