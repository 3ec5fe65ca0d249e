package kr.courtside.sync.core.config;

import kr.courtside.sync.api.context.SyncContext;

import java.util.Locale;
import java.util.Map;

import static kr.courtside.sync.core.config.YamlValues.trimToEmpty;

public record SyncYamlConfig(String environment, String nodeId, StoreMode store) {

    public enum StoreMode {
        MEMORY,
        JDBC
    }

    public static SyncYamlConfig fromMap(Map<String, Object> section) {
        if (section == null) {
            throw new IllegalArgumentException("sync 섹션이 존재하지 않습니다.");
        }
        String environment = trimToEmpty(section.get("environment"));
        String nodeId = trimToEmpty(section.get("node-id"));
        String store = trimToEmpty(section.get("store"));
        if (environment.isBlank()) {
            throw new IllegalArgumentException("sync.environment 값이 비어 있습니다.");
        }
        if (nodeId.isBlank()) {
            throw new IllegalArgumentException("sync.node-id 값이 비어 있습니다.");
        }
        StoreMode mode;
        try {
            mode = store.isBlank() ? StoreMode.MEMORY : StoreMode.valueOf(store.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("sync.store 값은 memory 또는 jdbc여야 합니다: " + store, e);
        }
        return new SyncYamlConfig(environment, nodeId, mode);
    }

    public SyncContext toContext() {
        return SyncContext.of(environment, nodeId);
    }
}
