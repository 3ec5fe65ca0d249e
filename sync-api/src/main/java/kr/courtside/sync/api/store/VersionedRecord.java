package kr.courtside.sync.api.store;

import kr.courtside.sync.api.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a stored record. {@code fields} never contains the version itself.
 */
public record VersionedRecord(String id, long version, Map<String, Object> fields) {

    public VersionedRecord {
        Preconditions.checkNotBlank(id, "id");
        Preconditions.checkNotNegative(version, "version");
        fields = fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
