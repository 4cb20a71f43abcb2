package io.github.cyfko.recordql.core.match;

import io.github.cyfko.recordql.core.config.MatchConfig;
import io.github.cyfko.recordql.core.model.DataRecord;

import java.util.Objects;

/**
 * Logical negation of another predicate.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NotMatch implements RecordPredicate {

    private final RecordPredicate negated;

    NotMatch(RecordPredicate negated) {
        this.negated = Objects.requireNonNull(negated, "negated predicate cannot be null");
    }

    public RecordPredicate getNegated() {
        return negated;
    }

    @Override
    public boolean matches(DataRecord record, MatchConfig config) {
        return !negated.matches(record, config);
    }

    @Override
    public RecordPredicate negate() {
        return negated;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NotMatch that && negated.equals(that.negated);
    }

    @Override
    public int hashCode() {
        return ~negated.hashCode();
    }

    @Override
    public String toString() {
        return "NOT(" + negated + ")";
    }
}
