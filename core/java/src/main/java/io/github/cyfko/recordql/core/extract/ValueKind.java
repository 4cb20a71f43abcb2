package io.github.cyfko.recordql.core.extract;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Closed set of primitive value kinds a record field can hold, with the coercion rule of each kind.
 * <p>
 * {@code ValueKind} is a typesafe enumeration: every constant carries the Java type its values are
 * normalized to, so that extraction methods can be written once and parameterized by kind:
 * </p>
 * <pre>{@code
 * List<BigDecimal> revenues = ValueExtractor.pluck(records, FieldRef.parse("Revenue"), ValueKind.NUMERIC);
 * Map<String, List<DataRecord>> byName = ValueExtractor.groupBy(records, FieldRef.parse("Name"), ValueKind.TEXT);
 * }</pre>
 *
 * <h2>Coercion table</h2>
 * <table border="1">
 * <caption>Accepted inputs per kind</caption>
 * <tr><th>Kind</th><th>Normalized type</th><th>Accepted inputs</th></tr>
 * <tr><td>BOOLEAN</td><td>Boolean</td><td>Boolean</td></tr>
 * <tr><td>NUMERIC</td><td>BigDecimal</td><td>any finite Number</td></tr>
 * <tr><td>DATE</td><td>LocalDate</td><td>LocalDate</td></tr>
 * <tr><td>DATETIME</td><td>LocalDateTime</td><td>LocalDateTime, Instant, OffsetDateTime, ZonedDateTime, Date (at UTC)</td></tr>
 * <tr><td>IDENTIFIER</td><td>String</td><td>String, UUID</td></tr>
 * <tr><td>TEXT</td><td>String</td><td>CharSequence, enum constant (its name)</td></tr>
 * </table>
 *
 * <p>All instances are immutable and thread-safe.</p>
 *
 * @param <T> the normalized Java type of values of this kind
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValueKind<T> {

    public static final ValueKind<Boolean> BOOLEAN = new ValueKind<>(
            "BOOLEAN", Boolean.class, false,
            v -> v instanceof Boolean,
            v -> (Boolean) v);

    public static final ValueKind<BigDecimal> NUMERIC = new ValueKind<>(
            "NUMERIC", BigDecimal.class, true,
            ValueKind::isFiniteNumber,
            ValueKind::toBigDecimal);

    public static final ValueKind<LocalDate> DATE = new ValueKind<>(
            "DATE", LocalDate.class, true,
            v -> v instanceof LocalDate,
            v -> (LocalDate) v);

    public static final ValueKind<LocalDateTime> DATETIME = new ValueKind<>(
            "DATETIME", LocalDateTime.class, true,
            v -> v instanceof LocalDateTime || v instanceof Instant || v instanceof OffsetDateTime
                    || v instanceof ZonedDateTime || v instanceof Date,
            ValueKind::toLocalDateTime);

    public static final ValueKind<String> IDENTIFIER = new ValueKind<>(
            "IDENTIFIER", String.class, false,
            v -> v instanceof String || v instanceof UUID,
            Object::toString);

    public static final ValueKind<String> TEXT = new ValueKind<>(
            "TEXT", String.class, true,
            v -> v instanceof CharSequence || v instanceof Enum<?>,
            v -> v instanceof Enum<?> e ? e.name() : v.toString());

    private static final List<ValueKind<?>> VALUES = List.of(BOOLEAN, NUMERIC, DATE, DATETIME, IDENTIFIER, TEXT);

    private final String name;
    private final Class<T> javaType;
    private final boolean orderable;
    private final Predicate<Object> acceptor;
    private final Function<Object, T> converter;

    private ValueKind(String name, Class<T> javaType, boolean orderable,
                      Predicate<Object> acceptor, Function<Object, T> converter) {
        this.name = name;
        this.javaType = javaType;
        this.orderable = orderable;
        this.acceptor = acceptor;
        this.converter = converter;
    }

    /**
     * Returns all kinds, in declaration order.
     *
     * @return an immutable list of every kind
     */
    public static List<ValueKind<?>> values() {
        return VALUES;
    }

    /**
     * Classifies a plain Java value.
     * <p>
     * Strings are classified as {@link #TEXT}; callers that know the value targets an identifier
     * field should check {@link #accepts(Object)} on {@link #IDENTIFIER} instead.
     * </p>
     *
     * @param value the value to classify
     * @return the kind of the value, or empty for {@code null} and unsupported types
     */
    public static Optional<ValueKind<?>> detect(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof UUID) {
            return Optional.of(IDENTIFIER);
        }
        for (ValueKind<?> kind : VALUES) {
            if (kind != IDENTIFIER && kind.accepts(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public String name() {
        return name;
    }

    public Class<T> javaType() {
        return javaType;
    }

    /**
     * Indicates whether values of this kind can be compared with {@code <}, {@code >} and friends.
     *
     * @return {@code true} for NUMERIC, DATE, DATETIME and TEXT
     */
    public boolean isOrderable() {
        return orderable;
    }

    /**
     * Checks whether {@code value} can be coerced to this kind. {@code null} is always accepted.
     *
     * @param value the candidate value
     * @return {@code true} if {@link #coerce(Object)} would succeed
     */
    public boolean accepts(Object value) {
        return value == null || acceptor.test(value);
    }

    /**
     * Coerces a value to the normalized type of this kind.
     *
     * @param value the value to coerce, may be {@code null}
     * @return the normalized value, or {@code null} if {@code value} is {@code null}
     * @throws IllegalArgumentException if the value does not belong to this kind
     */
    public T coerce(Object value) {
        if (value == null) {
            return null;
        }
        if (!acceptor.test(value)) {
            throw new IllegalArgumentException(
                    String.format("Cannot convert value '%s' (type: %s) to kind %s",
                            value, value.getClass().getName(), name));
        }
        return converter.apply(value);
    }

    /**
     * Value equality for this kind. Numerics compare by magnitude, so {@code 1000} equals {@code 1000.0}.
     *
     * @param left  a normalized value, may be {@code null}
     * @param right a normalized value, may be {@code null}
     * @return {@code true} if both are {@code null} or hold the same value
     */
    public boolean sameValue(T left, T right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (this == NUMERIC) {
            return ((BigDecimal) left).compareTo((BigDecimal) right) == 0;
        }
        return left.equals(right);
    }

    /**
     * Orders two non-null normalized values.
     *
     * @param left  a normalized value
     * @param right a normalized value
     * @return a negative integer, zero, or a positive integer as {@code left} is less than,
     * equal to, or greater than {@code right}
     * @throws IllegalStateException if this kind is not orderable
     */
    @SuppressWarnings("unchecked")
    public int compare(T left, T right) {
        if (!orderable) {
            throw new IllegalStateException("Kind " + name + " is not orderable");
        }
        return ((Comparable<T>) left).compareTo(Objects.requireNonNull(right));
    }

    /**
     * Returns a key whose {@code equals}/{@code hashCode} agree with {@link #sameValue(Object, Object)}.
     *
     * @param value a normalized value, may be {@code null}
     * @return the canonical grouping key
     */
    public Object canonicalKey(T value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros();
        }
        return value;
    }

    @Override
    public String toString() {
        return name;
    }

    private static boolean isFiniteNumber(Object value) {
        if (value instanceof Double d) return !d.isNaN() && !d.isInfinite();
        if (value instanceof Float f) return !f.isNaN() && !f.isInfinite();
        return value instanceof Number;
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal bd) return bd;
        if (value instanceof BigInteger bi) return new BigDecimal(bi);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double d) return BigDecimal.valueOf(d);
        return new BigDecimal(value.toString());
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime ldt) return ldt;
        if (value instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
        if (value instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        if (value instanceof ZonedDateTime zdt) return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        // java.sql.Date does not support toInstant()
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneOffset.UTC);
    }
}
