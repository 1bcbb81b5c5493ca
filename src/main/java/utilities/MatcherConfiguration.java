package utilities;

import java.util.Arrays;
import java.util.Objects;

// Immutable configuration shared by the rolling hash, the automaton and the bold tagger.
public final class MatcherConfiguration {

    public static final long[] DEFAULT_ROLLING_BASES = {37L, 53L};
    public static final long DEFAULT_ROLLING_MODULUS = 1_000_000_007L;
    public static final String DEFAULT_OPEN_TAG = "<b>";
    public static final String DEFAULT_CLOSE_TAG = "</b>";

    // base * hash must stay below 2^63 for every reduced hash value.
    private static final long MAX_MODULUS = 1L << 31;

    private static final MatcherConfiguration DEFAULTS = builder().build();

    private final long[] rollingBases;
    private final long rollingModulus;
    private final String openTag;
    private final String closeTag;
    private final int maxPatterns;
    private final boolean logBuildStats;

    private MatcherConfiguration(Builder builder) {
        this.rollingBases = Objects.requireNonNull(builder.rollingBases, "rollingBases").clone();
        this.rollingModulus = builder.rollingModulus;
        this.openTag = builder.openTag;
        this.closeTag = builder.closeTag;
        this.maxPatterns = builder.maxPatterns;
        this.logBuildStats = builder.logBuildStats;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static MatcherConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (rollingBases.length == 0) {
            throw new IllegalArgumentException("rollingBases must not be empty");
        }
        if (rollingModulus <= 1 || rollingModulus > MAX_MODULUS) {
            throw new IllegalArgumentException("rollingModulus must be in (1, 2^31]");
        }
        for (long base : rollingBases) {
            if (base <= 0 || base >= rollingModulus) {
                throw new IllegalArgumentException("rolling base " + base + " must be in (0, rollingModulus)");
            }
        }
        if (openTag == null || openTag.isEmpty()) {
            throw new IllegalArgumentException("openTag must be non-empty");
        }
        if (closeTag == null || closeTag.isEmpty()) {
            throw new IllegalArgumentException("closeTag must be non-empty");
        }
        if (maxPatterns <= 0) {
            throw new IllegalArgumentException("maxPatterns must be positive");
        }
    }

    public long[] rollingBases() { return rollingBases.clone(); }
    public long rollingModulus() { return rollingModulus; }
    public String openTag() { return openTag; }
    public String closeTag() { return closeTag; }
    public int maxPatterns() { return maxPatterns; }
    public boolean logBuildStats() { return logBuildStats; }

    @Override
    public String toString() {
        return "MatcherConfiguration{bases=" + Arrays.toString(rollingBases)
                + ", modulus=" + rollingModulus
                + ", tags=" + openTag + "/" + closeTag
                + ", maxPatterns=" + maxPatterns + "}";
    }

    public static final class Builder {
        private long[] rollingBases = DEFAULT_ROLLING_BASES;
        private long rollingModulus = DEFAULT_ROLLING_MODULUS;
        private String openTag = DEFAULT_OPEN_TAG;
        private String closeTag = DEFAULT_CLOSE_TAG;
        private int maxPatterns = Integer.MAX_VALUE;
        private boolean logBuildStats;

        private Builder() {
        }

        public Builder rollingBases(long... rollingBases) {
            this.rollingBases = rollingBases;
            return this;
        }

        public Builder rollingModulus(long rollingModulus) {
            this.rollingModulus = rollingModulus;
            return this;
        }

        public Builder openTag(String openTag) {
            this.openTag = openTag;
            return this;
        }

        public Builder closeTag(String closeTag) {
            this.closeTag = closeTag;
            return this;
        }

        public Builder maxPatterns(int maxPatterns) {
            this.maxPatterns = maxPatterns;
            return this;
        }

        public Builder logBuildStats(boolean logBuildStats) {
            this.logBuildStats = logBuildStats;
            return this;
        }

        public MatcherConfiguration build() {
            return new MatcherConfiguration(this);
        }
    }
}
