package io.github.cyfko.recordql.core.match;

import io.github.cyfko.recordql.core.config.MatchConfig;
import io.github.cyfko.recordql.core.model.DataRecord;

/**
 * Capability to evaluate a record to {@code true} or {@code false}.
 * <p>
 * The set of predicates is closed:
 * </p>
 * <ul>
 *   <li>{@link FieldsMatch}: a conjunction of field conditions, built through {@link Match#field(String)}</li>
 *   <li>{@link RecordMatch}: partial equality with a prototype record, built through {@link Match#record(DataRecord)}</li>
 *   <li>{@link NotMatch}: the negation of another predicate, built through {@link #negate()}</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations are immutable; a predicate can be shared and evaluated from several threads,
 * provided the evaluated records are not mutated meanwhile.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface RecordPredicate permits FieldsMatch, RecordMatch, NotMatch {

    /**
     * Evaluates this predicate against {@code record}.
     *
     * @param record the record to test, not null
     * @param config the evaluation strategies, not null
     * @return {@code true} if the record satisfies this predicate
     * @throws io.github.cyfko.recordql.core.exception.FieldNotLoadedException             if a needed field was never loaded
     * @throws io.github.cyfko.recordql.core.exception.UnsupportedComparisonTypeException if a condition compares unsupported types
     */
    boolean matches(DataRecord record, MatchConfig config);

    /**
     * Evaluates this predicate with {@link MatchConfig#defaults()}.
     */
    default boolean matches(DataRecord record) {
        return matches(record, MatchConfig.defaults());
    }

    /**
     * Returns a predicate satisfied exactly when this one is not.
     *
     * @return the negation of this predicate
     */
    default RecordPredicate negate() {
        return new NotMatch(this);
    }
}
