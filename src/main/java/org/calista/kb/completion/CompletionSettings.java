package org.calista.kb.completion;

import java.util.Objects;

/**
 * Knobs of the completion loop. Immutable; change via {@link #toBuilder()}.
 */
public final class CompletionSettings {

    public static final long UNBOUNDED = Long.MAX_VALUE;

    /** Overlaps processed between two confluence checks. */
    public final long checkConfluenceInterval;

    /** Largest overlap measure considered, {@link #UNBOUNDED} for all. */
    public final long maxOverlap;

    /** Stop once this many rules are active, {@link #UNBOUNDED} for no limit. */
    public final long maxRules;

    public final OverlapPolicy overlapPolicy;

    public CompletionSettings(long checkConfluenceInterval, long maxOverlap, long maxRules, OverlapPolicy overlapPolicy) {
        if (checkConfluenceInterval < 1) throw new IllegalArgumentException("checkConfluenceInterval must be >= 1");
        if (maxOverlap < 1) throw new IllegalArgumentException("maxOverlap must be >= 1");
        if (maxRules < 1) throw new IllegalArgumentException("maxRules must be >= 1");

        this.checkConfluenceInterval = checkConfluenceInterval;
        this.maxOverlap = maxOverlap;
        this.maxRules = maxRules;
        this.overlapPolicy = Objects.requireNonNull(overlapPolicy, "overlapPolicy");
    }

    public static CompletionSettings defaults() {
        return builder().build();
    }

    public boolean bounded() {
        return maxOverlap != UNBOUNDED || maxRules != UNBOUNDED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .checkConfluenceInterval(checkConfluenceInterval)
                .maxOverlap(maxOverlap)
                .maxRules(maxRules)
                .overlapPolicy(overlapPolicy);
    }

    @Override
    public String toString() {
        return "CompletionSettings{checkConfluenceInterval=" + checkConfluenceInterval
                + ", maxOverlap=" + show(maxOverlap)
                + ", maxRules=" + show(maxRules)
                + ", overlapPolicy=" + overlapPolicy + "}";
    }

    private static String show(long v) {
        return v == UNBOUNDED ? "inf" : Long.toString(v);
    }

    public static final class Builder {
        private long checkConfluenceInterval = 4_096;
        private long maxOverlap = UNBOUNDED;
        private long maxRules = UNBOUNDED;
        private OverlapPolicy overlapPolicy = OverlapPolicy.ABC;

        public Builder checkConfluenceInterval(long v) { this.checkConfluenceInterval = v; return this; }
        public Builder maxOverlap(long v) { this.maxOverlap = v; return this; }
        public Builder maxRules(long v) { this.maxRules = v; return this; }
        public Builder overlapPolicy(OverlapPolicy v) { this.overlapPolicy = v; return this; }

        public CompletionSettings build() {
            return new CompletionSettings(checkConfluenceInterval, maxOverlap, maxRules, overlapPolicy);
        }
    }
}
