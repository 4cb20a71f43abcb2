package io.github.cyfko.recordql.core.match;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.compare.ValueComparator;
import io.github.cyfko.recordql.core.config.MatchConfig;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldCondition;
import io.github.cyfko.recordql.core.model.FieldDescriptor;
import io.github.cyfko.recordql.core.resolve.FieldPathResolver;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered conjunction of field conditions.
 * <p>
 * A record matches when every condition holds. Conditions are evaluated in declaration order and
 * evaluation stops at the first one that fails, so fields of later conditions may never be read.
 * </p>
 *
 * <pre>{@code
 * FieldsMatch bigFoo = Match.field("Name").equalTo("Foo")
 *         .also("Revenue").greaterThan(1000);
 *
 * // Extending never alters the original
 * FieldsMatch bigFooInParis = bigFoo.also("BillingCity").equalTo("Paris");
 * }</pre>
 *
 * <p>Instances are immutable: {@link #also(String)} starts a new pending condition on a copy of the list.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see IncompleteFieldsMatch
 */
public final class FieldsMatch implements RecordPredicate {

    private final List<FieldCondition> conditions;

    FieldsMatch(List<FieldCondition> conditions) {
        Objects.requireNonNull(conditions, "conditions cannot be null");
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("A FieldsMatch requires at least one condition");
        }
        this.conditions = List.copyOf(conditions);
    }

    /**
     * @return the conditions, in evaluation order
     */
    public List<FieldCondition> getConditions() {
        return conditions;
    }

    /**
     * Starts an additional condition on {@code path}.
     *
     * @param path a field name or dotted relation path
     * @return a pending condition awaiting its comparator
     */
    public IncompleteFieldsMatch also(String path) {
        return also(FieldRef.parse(path));
    }

    public IncompleteFieldsMatch also(FieldDescriptor descriptor) {
        return also(FieldRef.of(descriptor));
    }

    public IncompleteFieldsMatch also(FieldRef field) {
        return new IncompleteFieldsMatch(conditions, field);
    }

    /** Alias of {@link #also(String)}. */
    public IncompleteFieldsMatch field(String path) {
        return also(path);
    }

    /** Alias of {@link #also(FieldDescriptor)}. */
    public IncompleteFieldsMatch field(FieldDescriptor descriptor) {
        return also(descriptor);
    }

    /** Alias of {@link #also(FieldRef)}. */
    public IncompleteFieldsMatch field(FieldRef field) {
        return also(field);
    }

    @Override
    public boolean matches(DataRecord record, MatchConfig config) {
        for (FieldCondition condition : conditions) {
            boolean holds = ValueComparator.compare(
                    FieldPathResolver.resolve(record, condition.field()),
                    condition.op(),
                    condition.value(),
                    config);
            if (!holds) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldsMatch that && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return conditions.stream().map(FieldCondition::toString).collect(Collectors.joining(" AND ", "FieldsMatch[", "]"));
    }
}
