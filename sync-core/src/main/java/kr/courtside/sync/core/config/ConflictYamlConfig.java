package kr.courtside.sync.core.config;

import kr.courtside.sync.api.conflict.ResolutionStrategy;
import kr.courtside.sync.core.conflict.ConflictSettings;

import java.util.Map;

import static kr.courtside.sync.core.config.YamlValues.toInt;
import static kr.courtside.sync.core.config.YamlValues.trimToEmpty;

public record ConflictYamlConfig(ResolutionStrategy.Kind defaultStrategy, int maxRetries) {

    public static ConflictYamlConfig fromMap(Map<String, Object> section) {
        Map<String, Object> values = section == null ? Map.of() : section;
        String strategy = trimToEmpty(values.get("default-strategy"));
        int maxRetries = toInt(values.get("max-retries"), 3);
        ResolutionStrategy.Kind kind;
        try {
            kind = ResolutionStrategy.Kind.fromWireName(strategy);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("conflict.default-strategy 값을 알 수 없습니다: " + strategy, e);
        }
        if (kind == ResolutionStrategy.Kind.MERGE) {
            throw new IllegalArgumentException("conflict.default-strategy에는 merge를 쓸 수 없습니다 (병합 함수는 코드로 지정).");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("conflict.max-retries는 0 이상이어야 합니다.");
        }
        return new ConflictYamlConfig(kind, maxRetries);
    }

    public ConflictSettings toSettings() {
        ResolutionStrategy strategy = switch (defaultStrategy) {
            case MANUAL -> ResolutionStrategy.manual();
            case USER_WINS -> ResolutionStrategy.userWins();
            case LATEST_WINS, MERGE -> ResolutionStrategy.latestWins();
        };
        return new ConflictSettings(strategy, maxRetries);
    }
}
