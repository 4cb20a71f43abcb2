package io.github.cyfko.recordql.jpa;

import io.github.cyfko.recordql.core.exception.FieldNotLoadedException;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.jpa.entities.Address;
import io.github.cyfko.recordql.jpa.entities.Company;
import io.github.cyfko.recordql.jpa.entities.Note;
import io.github.cyfko.recordql.jpa.exception.EntityAccessException;
import jakarta.persistence.PersistenceUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@DisplayName("EntityRecord Tests")
class EntityRecordTest {

    @Mock
    private PersistenceUtil persistenceUtil;

    private Company holding;
    private Company acme;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(persistenceUtil.isLoaded(any(), anyString())).thenReturn(true);

        holding = new Company("Holding", new BigDecimal("9000000")).withId(1L);
        acme = new Company("Acme", new BigDecimal("1500.50")).withId(2L)
                .setEmployees(12)
                .setActive(true)
                .setCreatedAt(Instant.parse("2024-01-01T08:00:00Z"))
                .setTier(Company.Tier.GOLD)
                .setAddress(new Address("1 Main St", "Springfield"))
                .setParent(holding);
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("Should read and normalize attribute values")
        void shouldNormalizeValues() {
            EntityRecord record = EntityRecord.of(acme, persistenceUtil);

            assertEquals("2", record.get("id"));
            assertEquals("Acme", record.get("name"));
            assertEquals(new BigDecimal("1500.50"), record.get("revenue"));
            assertEquals(BigDecimal.valueOf(12), record.get("employees"));
            assertEquals(true, record.get("active"));
            assertEquals(LocalDateTime.of(2024, 1, 1, 8, 0), record.get("createdAt"));
            assertEquals("GOLD", record.get("tier"));
            assertNull(record.get("closeDate"));
        }

        @Test
        @DisplayName("Relations are wrapped as records")
        void relationsAreWrapped() {
            EntityRecord record = EntityRecord.of(acme, persistenceUtil);

            DataRecord parent = (DataRecord) record.get("parent");
            DataRecord address = (DataRecord) record.get("address");

            assertEquals("Holding", parent.get("name"));
            assertSame(holding, ((EntityRecord) parent).getEntity());
            assertEquals("Address", address.getSchema().getName());
            assertEquals("Springfield", address.get("city"));
        }

        @Test
        @DisplayName("An attribute the provider reports as not loaded cannot be read")
        void unloadedAttributeFails() {
            when(persistenceUtil.isLoaded(acme, "parent")).thenReturn(false);
            EntityRecord record = EntityRecord.of(acme, persistenceUtil);

            assertFalse(record.isLoaded("parent"));
            assertFalse(record.getPopulatedFields().contains("parent"));
            FieldNotLoadedException ex = assertThrows(FieldNotLoadedException.class, () -> record.get("parent"));
            assertEquals("Account", ex.getSchemaName());
        }

        @Test
        @DisplayName("Unknown attributes are rejected")
        void unknownAttributesAreRejected() {
            EntityRecord record = EntityRecord.of(acme, persistenceUtil);

            assertThrows(IllegalArgumentException.class, () -> record.get("subsidiaries"));
            assertThrows(IllegalArgumentException.class, () -> record.isLoaded("displayName"));
        }

        @Test
        @DisplayName("UUID identifiers read as strings")
        void uuidIdentifiersReadAsStrings() {
            UUID id = UUID.randomUUID();

            assertEquals(id.toString(), EntityRecord.of(new Note(id, "hello"), persistenceUtil).get("id"));
        }
    }

    @Nested
    @DisplayName("Copying")
    class Copying {

        @Test
        @DisplayName("copyOnly populates a fresh instance with the listed attributes")
        void copyOnlyPopulatesFreshInstance() {
            EntityRecord record = EntityRecord.of(acme, persistenceUtil);

            EntityRecord copy = record.copyOnly(Set.of("id", "name"));

            Company copied = (Company) copy.getEntity();
            assertNotSame(acme, copied);
            assertEquals(2L, copied.getId());
            assertEquals("Acme", copied.getName());
            assertNull(copied.getRevenue());
            assertNull(copied.getParent());
            assertEquals(Set.of("id", "name"), copy.getPopulatedFields());
            assertFalse(copy.isLoaded("revenue"));
        }

        @Test
        @DisplayName("copyOnly leaves attributes that were not loaded unset")
        void copyOnlySkipsUnloaded() {
            when(persistenceUtil.isLoaded(eq(acme), eq("parent"))).thenReturn(false);

            EntityRecord copy = EntityRecord.of(acme, persistenceUtil).copyOnly(Set.of("id", "parent"));

            assertEquals(Set.of("id"), copy.getPopulatedFields());
        }

        @Test
        @DisplayName("copyOnly needs a no-argument constructor")
        void copyOnlyNeedsNoArgConstructor() {
            EntityRecord note = EntityRecord.of(new Note(UUID.randomUUID(), "hello"), persistenceUtil);

            assertThrows(EntityAccessException.class, () -> note.copyOnly(Set.of("body")));
        }
    }

    @Test
    @DisplayName("Records wrapping the same instance are equal")
    void equalityFollowsInstance() {
        assertEquals(EntityRecord.of(acme, persistenceUtil), EntityRecord.of(acme, persistenceUtil));
        assertNotEquals(EntityRecord.of(acme, persistenceUtil), EntityRecord.of(holding, persistenceUtil));
    }
}
