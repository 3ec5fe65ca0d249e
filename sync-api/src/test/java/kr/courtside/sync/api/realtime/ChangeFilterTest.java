package kr.courtside.sync.api.realtime;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChangeFilterTest {

    @Test
    void parse_splitsColumnOperatorAndValue() {
        ChangeFilter filter = ChangeFilter.parse(" play_date_id=eq.42 ");

        assertEquals("play_date_id", filter.column());
        assertEquals(ChangeFilter.Operator.EQ, filter.operator());
        assertEquals("play_date_id=eq.42", filter.expression());
    }

    @Test
    void eq_comparesNumbersNumerically() {
        ChangeFilter filter = ChangeFilter.parse("court_id=eq.7");

        assertTrue(filter.matches(Map.of("court_id", 7)));
        assertTrue(filter.matches(Map.of("court_id", "7.0")));
        assertFalse(filter.matches(Map.of("court_id", 8)));
        assertFalse(filter.matches(Map.of("other", 7)));
    }

    @Test
    void rangeOperators_work() {
        assertTrue(ChangeFilter.parse("score=gt.10").matches(Map.of("score", 11)));
        assertFalse(ChangeFilter.parse("score=gt.10").matches(Map.of("score", 10)));
        assertTrue(ChangeFilter.parse("score=gte.10").matches(Map.of("score", 10)));
        assertTrue(ChangeFilter.parse("score=lt.10").matches(Map.of("score", 9)));
        assertTrue(ChangeFilter.parse("score=lte.10").matches(Map.of("score", 10)));
        assertTrue(ChangeFilter.parse("status=neq.done").matches(Map.of("status", "live")));
    }

    @Test
    void in_matchesAnyListedValue() {
        ChangeFilter filter = ChangeFilter.parse("status=in.(scheduled, in_progress)");

        assertTrue(filter.matches(Map.of("status", "in_progress")));
        assertFalse(filter.matches(Map.of("status", "done")));
    }

    @Test
    void nullColumn_onlyMatchesNeq() {
        Map<String, Object> row = new HashMap<>();
        row.put("winner", null);

        assertFalse(ChangeFilter.parse("winner=eq.kim").matches(row));
        assertTrue(ChangeFilter.parse("winner=neq.kim").matches(row));
    }

    @Test
    void deleteEvents_areMatchedAgainstOldRecord() {
        ChangeFilter filter = ChangeFilter.parse("court_id=eq.7");
        ChangeEvent delete = new ChangeEvent("matches", EventType.DELETE, Map.of(), Map.of("court_id", 7), null);

        assertTrue(filter.matches(delete));
    }

    @Test
    void parse_rejectsMalformedExpressions() {
        assertThrows(IllegalArgumentException.class, () -> ChangeFilter.parse("court_id"));
        assertThrows(IllegalArgumentException.class, () -> ChangeFilter.parse("court_id=like.7"));
        assertThrows(IllegalArgumentException.class, () -> ChangeFilter.parse("status=in.scheduled"));
        assertThrows(IllegalArgumentException.class, () -> ChangeFilter.parse(" "));
    }
}
