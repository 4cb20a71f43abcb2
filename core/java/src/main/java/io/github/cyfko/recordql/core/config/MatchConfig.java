package io.github.cyfko.recordql.core.config;

import java.util.Objects;

/**
 * Configuration object aggregating the behavioural strategies applied when predicates are evaluated.
 * <p>
 * A builder keeps construction fluent and forward compatible:
 * </p>
 * <pre>{@code
 * MatchConfig config = MatchConfig.builder()
 *         .textMatchMode(TextMatchMode.CASE_INSENSITIVE)
 *         .build();
 * RecordView matches = RecordView.of(accounts).withConfig(config).filter(predicate);
 * }</pre>
 */
public final class MatchConfig {

    private static final MatchConfig DEFAULTS = builder().build();

    private final TextMatchMode textMatchMode;
    private final NullOrderingPolicy nullOrderingPolicy;

    private MatchConfig(Builder builder) {
        this.textMatchMode = builder.textMatchMode;
        this.nullOrderingPolicy = builder.nullOrderingPolicy;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Returns the shared default configuration: case-sensitive text, nulls never ordered.
     */
    public static MatchConfig defaults() { return DEFAULTS; }

    public TextMatchMode getTextMatchMode() { return textMatchMode; }
    public NullOrderingPolicy getNullOrderingPolicy() { return nullOrderingPolicy; }

    @Override
    public String toString() {
        return "MatchConfig[textMatchMode=" + textMatchMode + ", nullOrderingPolicy=" + nullOrderingPolicy + "]";
    }

    /**
     * Builder for {@link MatchConfig}.
     */
    public static final class Builder {
        private TextMatchMode textMatchMode = TextMatchMode.CASE_SENSITIVE; // default
        private NullOrderingPolicy nullOrderingPolicy = NullOrderingPolicy.NO_MATCH; // default

        public Builder textMatchMode(TextMatchMode mode) {
            this.textMatchMode = Objects.requireNonNull(mode, "textMatchMode");
            return this;
        }

        public Builder nullOrderingPolicy(NullOrderingPolicy policy) {
            this.nullOrderingPolicy = Objects.requireNonNull(policy, "nullOrderingPolicy");
            return this;
        }

        public MatchConfig build() { return new MatchConfig(this); }
    }
}
