package io.github.cyfko.recordql.core.match;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.api.Op;
import io.github.cyfko.recordql.core.compare.ValueComparator;
import io.github.cyfko.recordql.core.config.MatchConfig;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.resolve.FieldPathResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Matches records equal to a prototype on every field the prototype populates.
 * <p>
 * Fields left unset on the prototype impose no constraint. Values are compared by equality of
 * their declared type, never by reference.
 * </p>
 *
 * <pre>{@code
 * MapRecord prototype = MapRecord.of(account).with("Name", "Test").with("Revenue", 50_000_000);
 * RecordPredicate sameNameAndRevenue = Match.record(prototype);
 * }</pre>
 *
 * <p>The populated fields and their values are captured when the match is created.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RecordMatch implements RecordPredicate {

    private final DataRecord prototype;
    private final Map<String, Object> expected;

    RecordMatch(DataRecord prototype) {
        this.prototype = Objects.requireNonNull(prototype, "prototype cannot be null");
        Map<String, Object> values = new LinkedHashMap<>();
        for (String field : prototype.getPopulatedFields()) {
            values.put(field, prototype.get(field));
        }
        this.expected = Collections.unmodifiableMap(values);
    }

    public DataRecord getPrototype() {
        return prototype;
    }

    /**
     * @return the constrained fields and their expected values, in schema order
     */
    public Map<String, Object> getExpectedValues() {
        return expected;
    }

    @Override
    public boolean matches(DataRecord record, MatchConfig config) {
        for (Map.Entry<String, Object> entry : expected.entrySet()) {
            boolean same = ValueComparator.compare(
                    FieldPathResolver.resolve(record, new FieldRef.Direct(entry.getKey())),
                    Op.EQ,
                    entry.getValue(),
                    config);
            if (!same) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecordMatch that && prototype.equals(that.prototype);
    }

    @Override
    public int hashCode() {
        return prototype.hashCode();
    }

    @Override
    public String toString() {
        return "RecordMatch[" + prototype + "]";
    }
}
