package kr.courtside.sync.core.conflict;

import kr.courtside.sync.api.conflict.ResolutionStrategy;

import java.util.Objects;

/**
 * 충돌 해결기 옵션.
 */
public final class ConflictSettings {

    private final ResolutionStrategy defaultStrategy;
    private final int maxRetries;

    public ConflictSettings(ResolutionStrategy defaultStrategy, int maxRetries) {
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy, "defaultStrategy");
        this.maxRetries = Math.max(0, maxRetries);
    }

    public static ConflictSettings defaults() {
        return new ConflictSettings(ResolutionStrategy.latestWins(), 3);
    }

    public ResolutionStrategy defaultStrategy() {
        return defaultStrategy;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
