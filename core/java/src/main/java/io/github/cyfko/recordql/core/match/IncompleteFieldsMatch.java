package io.github.cyfko.recordql.core.match;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.api.Op;
import io.github.cyfko.recordql.core.model.FieldCondition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A field condition awaiting its comparator.
 * <p>
 * This is the intermediate state of the builder: it carries the conditions already completed and
 * the pending field. It is not a {@link RecordPredicate}, so a half-built condition cannot be
 * evaluated. Each comparator method completes the pending condition and returns a new
 * {@link FieldsMatch}; the instance itself is never modified, so calling two comparators on
 * the same instance yields two independent matches.
 * </p>
 *
 * <pre>{@code
 * IncompleteFieldsMatch revenue = Match.field("Revenue");
 * FieldsMatch small = revenue.lessThan(1000);
 * FieldsMatch large = revenue.greaterThanOrEquals(1000);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IncompleteFieldsMatch {

    private final List<FieldCondition> conditions;
    private final FieldRef pending;

    IncompleteFieldsMatch(List<FieldCondition> conditions, FieldRef pending) {
        this.conditions = List.copyOf(conditions);
        this.pending = Objects.requireNonNull(pending, "field cannot be null");
    }

    public FieldRef getPendingField() {
        return pending;
    }

    public FieldsMatch equalTo(Object value) {
        return complete(Op.EQ, value);
    }

    public FieldsMatch notEqualTo(Object value) {
        return complete(Op.NE, value);
    }

    public FieldsMatch lessThan(Object value) {
        return complete(Op.LT, value);
    }

    public FieldsMatch lessThanOrEquals(Object value) {
        return complete(Op.LTE, value);
    }

    public FieldsMatch greaterThan(Object value) {
        return complete(Op.GT, value);
    }

    public FieldsMatch greaterThanOrEquals(Object value) {
        return complete(Op.GTE, value);
    }

    /**
     * Completes the condition with a membership test.
     * <p>
     * The values are copied. Their element type is checked when the condition is evaluated: every
     * non-null element must be of one supported primitive kind compatible with the field, otherwise
     * evaluation raises {@link io.github.cyfko.recordql.core.exception.UnsupportedComparisonTypeException}.
     * </p>
     *
     * @param values the accepted values, may contain {@code null}
     * @return the completed match
     */
    public FieldsMatch isIn(Collection<?> values) {
        return complete(Op.IN, copy(values));
    }

    public FieldsMatch isNotIn(Collection<?> values) {
        return complete(Op.NOT_IN, copy(values));
    }

    public FieldsMatch hasValue() {
        return complete(Op.HAS_VALUE, null);
    }

    /** Alias of {@link #equalTo(Object)}. */
    public FieldsMatch eq(Object value) {
        return equalTo(value);
    }

    /** Alias of {@link #notEqualTo(Object)}. */
    public FieldsMatch ne(Object value) {
        return notEqualTo(value);
    }

    /** Alias of {@link #lessThan(Object)}. */
    public FieldsMatch lt(Object value) {
        return lessThan(value);
    }

    /** Alias of {@link #lessThanOrEquals(Object)}. */
    public FieldsMatch lte(Object value) {
        return lessThanOrEquals(value);
    }

    /** Alias of {@link #greaterThan(Object)}. */
    public FieldsMatch gt(Object value) {
        return greaterThan(value);
    }

    /** Alias of {@link #greaterThanOrEquals(Object)}. */
    public FieldsMatch gte(Object value) {
        return greaterThanOrEquals(value);
    }

    private FieldsMatch complete(Op op, Object value) {
        List<FieldCondition> next = new ArrayList<>(conditions.size() + 1);
        next.addAll(conditions);
        next.add(new FieldCondition(pending, op, value));
        return new FieldsMatch(next);
    }

    private static Collection<?> copy(Collection<?> values) {
        Objects.requireNonNull(values, "values cannot be null");
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    @Override
    public String toString() {
        return "IncompleteFieldsMatch[" + conditions + ", pending=" + pending + "]";
    }
}
