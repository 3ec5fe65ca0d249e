package kr.courtside.sync.api.conflict;

import kr.courtside.sync.api.Preconditions;

/**
 * How a detected conflict is turned into a new write.
 * A {@link Kind#MERGE} strategy without a merge function behaves like {@link Kind#LATEST_WINS}.
 */
public record ResolutionStrategy(Kind kind, MergeFunction mergeFunction) {

    public enum Kind {
        MANUAL("manual"),
        LATEST_WINS("latest-wins"),
        USER_WINS("user-wins"),
        MERGE("merge");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Kind fromWireName(String name) {
            if (name == null || name.trim().isEmpty()) {
                return LATEST_WINS;
            }
            for (Kind kind : values()) {
                if (kind.wireName.equalsIgnoreCase(name.trim())) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("unknown resolution strategy: " + name);
        }
    }

    public ResolutionStrategy {
        Preconditions.checkNotNull(kind, "kind");
    }

    public static ResolutionStrategy latestWins() {
        return new ResolutionStrategy(Kind.LATEST_WINS, null);
    }

    public static ResolutionStrategy userWins() {
        return new ResolutionStrategy(Kind.USER_WINS, null);
    }

    public static ResolutionStrategy manual() {
        return new ResolutionStrategy(Kind.MANUAL, null);
    }

    public static ResolutionStrategy merge(MergeFunction mergeFunction) {
        return new ResolutionStrategy(Kind.MERGE, mergeFunction);
    }

    public String name() {
        return kind.wireName();
    }
}
