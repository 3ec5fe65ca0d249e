package kr.courtside.sync.core.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.courtside.sync.api.presence.PresenceRecord;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.realtime.EventType;

import java.time.Instant;
import java.util.Map;

/**
 * Redis로 오가는 JSON 메시지 변환만 담당한다. 시각은 epoch millis로 보낸다.
 */
public final class RedisWireCodec {

    private final ObjectMapper mapper;

    public RedisWireCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public RedisWireCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encodeChange(ChangeEvent event) {
        ChangeMessage message = new ChangeMessage(event.topic(), event.eventType().wireName(), event.newRecord(),
                event.oldRecord(), event.hasCommitTimestamp() ? event.commitTimestamp().toEpochMilli() : null);
        return write(message, "ChangeEvent");
    }

    public ChangeEvent decodeChange(String json) {
        ChangeMessage message = read(json, ChangeMessage.class, "ChangeEvent");
        Instant commitTimestamp = message.commitTimestamp() == null ? null : Instant.ofEpochMilli(message.commitTimestamp());
        return new ChangeEvent(message.topic(), EventType.fromWireName(message.type()), message.newRecord(),
                message.oldRecord(), commitTimestamp);
    }

    public String encodePresence(PresenceRecord record) {
        return write(PresencePayload.from(record), "PresenceRecord");
    }

    public PresenceRecord decodePresence(String json) {
        return read(json, PresencePayload.class, "PresenceRecord").toRecord();
    }

    public String encodePresenceMessage(PresenceMessage message) {
        return write(message, "PresenceMessage");
    }

    public PresenceMessage decodePresenceMessage(String json) {
        return read(json, PresenceMessage.class, "PresenceMessage");
    }

    private String write(Object value, String what) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + what, e);
        }
    }

    private <T> T read(String json, Class<T> type, String what) {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to decode " + what + ": " + safe(json), e);
        }
    }

    private static String safe(String s) {
        if (s == null) return "null";
        if (s.length() <= 200) return s;
        return s.substring(0, 200) + "...(truncated)";
    }

    public record ChangeMessage(String topic,
                         String type,
                         Map<String, Object> newRecord,
                         Map<String, Object> oldRecord,
                         Long commitTimestamp) {
    }

    public record PresencePayload(String actorId, String displayName, long lastSeenAt, boolean playing, String activityId) {

        static PresencePayload from(PresenceRecord record) {
            return new PresencePayload(record.actorId(), record.displayName(), record.lastSeenAt().toEpochMilli(),
                    record.playing(), record.activityId());
        }

        PresenceRecord toRecord() {
            return new PresenceRecord(actorId, displayName, Instant.ofEpochMilli(lastSeenAt), playing, activityId);
        }
    }

    /**
     * 프레즌스 채널의 join/leave 알림. leave에는 {@code record}가 없다.
     */
    public record PresenceMessage(String kind, String key, PresencePayload record) {

        public static final String JOIN = "join";
        public static final String LEAVE = "leave";

        public static PresenceMessage join(String key, PresenceRecord record) {
            return new PresenceMessage(JOIN, key, PresencePayload.from(record));
        }

        public static PresenceMessage leave(String key) {
            return new PresenceMessage(LEAVE, key, null);
        }

        public boolean announcesJoin() {
            return JOIN.equals(kind);
        }

        public PresenceRecord presenceRecord() {
            return record == null ? null : record.toRecord();
        }
    }
}
