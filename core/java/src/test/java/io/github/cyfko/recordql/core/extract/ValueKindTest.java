package io.github.cyfko.recordql.core.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValueKind Tests")
class ValueKindTest {

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("Should classify plain Java values")
        void shouldClassifyValues() {
            assertEquals(ValueKind.BOOLEAN, ValueKind.detect(true).orElseThrow());
            assertEquals(ValueKind.NUMERIC, ValueKind.detect(42L).orElseThrow());
            assertEquals(ValueKind.DATE, ValueKind.detect(LocalDate.of(2024, 1, 1)).orElseThrow());
            assertEquals(ValueKind.DATETIME, ValueKind.detect(LocalDateTime.of(2024, 1, 1, 0, 0)).orElseThrow());
            assertEquals(ValueKind.IDENTIFIER, ValueKind.detect(UUID.randomUUID()).orElseThrow());
            assertEquals(ValueKind.TEXT, ValueKind.detect("Foo").orElseThrow());
            assertEquals(ValueKind.TEXT, ValueKind.detect(TimeUnit.SECONDS).orElseThrow());
        }

        @Test
        @DisplayName("Should not classify null, objects or non-finite numbers")
        void shouldNotClassifyUnsupported() {
            assertTrue(ValueKind.detect(null).isEmpty());
            assertTrue(ValueKind.detect(new Object()).isEmpty());
            assertTrue(ValueKind.detect(Double.NaN).isEmpty());
            assertTrue(ValueKind.detect(Float.POSITIVE_INFINITY).isEmpty());
        }
    }

    @Nested
    @DisplayName("Coercion")
    class Coercion {

        @Test
        @DisplayName("Numbers coerce to BigDecimal")
        void numbersCoerceToBigDecimal() {
            assertEquals(BigDecimal.valueOf(7), ValueKind.NUMERIC.coerce(7));
            assertEquals(new BigDecimal("12345678901234567890"),
                    ValueKind.NUMERIC.coerce(new BigInteger("12345678901234567890")));
            assertEquals(BigDecimal.valueOf(2.5), ValueKind.NUMERIC.coerce(2.5d));
        }

        @Test
        @DisplayName("Datetimes coerce to UTC local date-times")
        void datetimesCoerceAtUtc() {
            OffsetDateTime paris = OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2));

            assertEquals(LocalDateTime.of(2024, 6, 1, 10, 0), ValueKind.DATETIME.coerce(paris));
            assertEquals(LocalDateTime.of(1970, 1, 1, 0, 0, 1), ValueKind.DATETIME.coerce(new Date(1000)));
        }

        @Test
        @DisplayName("Identifiers and text coerce to strings")
        void identifiersAndTextCoerceToStrings() {
            UUID id = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

            assertEquals("3f2504e0-4f89-11d3-9a0c-0305e82c3301", ValueKind.IDENTIFIER.coerce(id));
            assertEquals("SECONDS", ValueKind.TEXT.coerce(TimeUnit.SECONDS));
            assertEquals("Foo", ValueKind.TEXT.coerce(new StringBuilder("Foo")));
        }

        @Test
        @DisplayName("Should reject values of another kind")
        void shouldRejectOtherKinds() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> ValueKind.DATE.coerce("2024-01-01"));
            assertTrue(ex.getMessage().contains("DATE"));
            assertNull(ValueKind.DATE.coerce(null));
        }
    }

    @Nested
    @DisplayName("Equality and ordering")
    class EqualityAndOrdering {

        @Test
        @DisplayName("Numerics are equal by magnitude and share a canonical key")
        void numericsEqualByMagnitude() {
            BigDecimal plain = new BigDecimal("1000");
            BigDecimal scaled = new BigDecimal("1000.00");

            assertTrue(ValueKind.NUMERIC.sameValue(plain, scaled));
            assertEquals(ValueKind.NUMERIC.canonicalKey(plain), ValueKind.NUMERIC.canonicalKey(scaled));
        }

        @Test
        @DisplayName("Booleans and identifiers are not orderable")
        void nonOrderableKinds() {
            assertFalse(ValueKind.BOOLEAN.isOrderable());
            assertFalse(ValueKind.IDENTIFIER.isOrderable());
            assertThrows(IllegalStateException.class, () -> ValueKind.BOOLEAN.compare(true, false));
        }

        @Test
        @DisplayName("Orderable kinds compare naturally")
        void orderableKindsCompare() {
            assertTrue(ValueKind.DATE.compare(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)) < 0);
            assertTrue(ValueKind.TEXT.compare("b", "a") > 0);
            assertEquals(0, ValueKind.NUMERIC.compare(new BigDecimal("1.0"), BigDecimal.ONE));
        }
    }
}
