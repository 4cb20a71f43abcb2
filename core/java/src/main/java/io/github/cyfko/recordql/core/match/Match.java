package io.github.cyfko.recordql.core.match;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldDescriptor;

import java.util.List;

/**
 * Entry point of the predicate builder.
 *
 * <pre>{@code
 * RecordPredicate foo = Match.field("Name").equalTo("Foo");
 * RecordPredicate bigFoo = Match.field("Name").equalTo("Foo").also("Revenue").greaterThan(1000);
 * RecordPredicate parentIsAcme = Match.field("Parent.Name").equalTo("Acme");
 * RecordPredicate likePrototype = Match.record(prototype);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Match {

    private Match() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Starts a field condition.
     *
     * @param path a field name or dotted relation path such as {@code "Parent.Name"}
     * @return a pending condition awaiting its comparator
     */
    public static IncompleteFieldsMatch field(String path) {
        return field(FieldRef.parse(path));
    }

    public static IncompleteFieldsMatch field(FieldDescriptor descriptor) {
        return field(FieldRef.of(descriptor));
    }

    public static IncompleteFieldsMatch field(FieldRef field) {
        return new IncompleteFieldsMatch(List.of(), field);
    }

    /**
     * Creates a prototype match.
     *
     * @param prototype the record whose populated fields must be equal on matched records
     * @return the prototype match
     */
    public static RecordMatch record(DataRecord prototype) {
        return new RecordMatch(prototype);
    }

    /**
     * @return the negation of {@code predicate}
     */
    public static RecordPredicate not(RecordPredicate predicate) {
        return predicate.negate();
    }
}
