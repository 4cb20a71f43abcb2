package io.github.cyfko.recordql.core.model;

import io.github.cyfko.recordql.core.exception.FieldNotLoadedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static io.github.cyfko.recordql.core.Accounts.ACCOUNT;
import static io.github.cyfko.recordql.core.Accounts.CONTACT;
import static io.github.cyfko.recordql.core.Accounts.account;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MapRecord Tests")
class MapRecordTest {

    @Nested
    @DisplayName("Loaded state")
    class LoadedState {

        @Test
        @DisplayName("A field populated with null is loaded")
        void nullFieldIsLoaded() {
            MapRecord record = MapRecord.of(ACCOUNT).with("Name", null);

            assertTrue(record.isLoaded("Name"));
            assertNull(record.get("Name"));
            assertFalse(record.isLoaded("Revenue"));
        }

        @Test
        @DisplayName("Reading a field never populated should fail")
        void readingUnloadedFieldFails() {
            MapRecord record = account("Foo", 1000);

            FieldNotLoadedException ex = assertThrows(FieldNotLoadedException.class, () -> record.get("Active"));
            assertEquals("Account", ex.getSchemaName());
            assertEquals("Active", ex.getFieldName());
        }

        @Test
        @DisplayName("Unknown fields are rejected")
        void unknownFieldsAreRejected() {
            MapRecord record = account("Foo", 1000);

            assertThrows(IllegalArgumentException.class, () -> record.isLoaded("Owner"));
            assertThrows(IllegalArgumentException.class, () -> record.with("Owner", "x"));
        }

        @Test
        @DisplayName("Populated fields follow schema order")
        void populatedFieldsFollowSchemaOrder() {
            MapRecord record = MapRecord.of(ACCOUNT).with("Revenue", 1).with("Id", "001").with("Name", "Foo");

            assertEquals(Set.of("Id", "Name", "Revenue"), record.getPopulatedFields());
            assertEquals("[Id, Name, Revenue]", record.getPopulatedFields().toString());
        }

        @Test
        @DisplayName("without() unsets a field")
        void withoutUnsetsField() {
            MapRecord record = account("Foo", 1000).without("Revenue");

            assertFalse(record.isLoaded("Revenue"));
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Numbers, UUIDs and instants are normalized on write")
        void valuesAreNormalized() {
            UUID id = UUID.randomUUID();
            MapRecord record = MapRecord.of(ACCOUNT, Map.of(
                    "Id", id,
                    "Revenue", 1000,
                    "LastModified", Instant.parse("2024-03-01T10:15:30Z")));

            assertEquals(id.toString(), record.get("Id"));
            assertEquals(new BigDecimal(1000), record.get("Revenue"));
            assertEquals(LocalDateTime.of(2024, 3, 1, 10, 15, 30), record.get("LastModified"));
        }

        @Test
        @DisplayName("A value of the wrong kind is rejected")
        void wrongKindIsRejected() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> MapRecord.of(ACCOUNT).with("Revenue", "a lot"));
            assertTrue(ex.getMessage().contains("Revenue"));
        }

        @Test
        @DisplayName("A relation must hold a record of the related schema")
        void relationMustHoldRelatedRecord() {
            MapRecord contact = MapRecord.of(CONTACT).with("LastName", "Doe");

            assertThrows(IllegalArgumentException.class, () -> MapRecord.of(ACCOUNT).with("Parent", "001"));
            assertThrows(IllegalArgumentException.class, () -> MapRecord.of(ACCOUNT).with("Parent", contact));
            assertDoesNotThrow(() -> MapRecord.of(ACCOUNT).with("Parent", account("Holding", 1)));
        }
    }

    @Nested
    @DisplayName("Copies and equality")
    class CopiesAndEquality {

        @Test
        @DisplayName("copyOnly keeps the listed loaded fields only")
        void copyOnlyKeepsListedFields() {
            MapRecord record = account("001", "Foo", 1000);

            MapRecord copy = record.copyOnly(Set.of("Id", "Name", "Active"));

            assertEquals(Set.of("Id", "Name"), copy.getPopulatedFields());
            assertEquals("Foo", copy.get("Name"));
            assertNotSame(record, copy);
        }

        @Test
        @DisplayName("Numerics equal by magnitude make equal records")
        void numericsCompareByMagnitude() {
            MapRecord left = account("Foo", 1000);
            MapRecord right = account("Foo", new BigDecimal("1000.00"));

            assertEquals(left, right);
            assertEquals(left.hashCode(), right.hashCode());
        }

        @Test
        @DisplayName("A null field differs from an unset one")
        void nullDiffersFromUnset() {
            assertNotEquals(MapRecord.of(ACCOUNT).with("Name", null), MapRecord.of(ACCOUNT));
        }

        @Test
        @DisplayName("toString lists populated fields")
        void toStringListsPopulatedFields() {
            assertEquals("Account{Name=Foo, Revenue=1000}", account("Foo", 1000).toString());
        }
    }
}
