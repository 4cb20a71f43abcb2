package io.github.cyfko.recordql.jpa;

import io.github.cyfko.recordql.core.model.FieldDescriptor;
import io.github.cyfko.recordql.core.model.FieldType;
import io.github.cyfko.recordql.core.model.RecordSchema;
import io.github.cyfko.recordql.jpa.entities.Address;
import io.github.cyfko.recordql.jpa.entities.Company;
import io.github.cyfko.recordql.jpa.entities.Note;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntitySchemas Tests")
class EntitySchemasTest {

    @Test
    @DisplayName("Should name the schema after the entity name")
    void shouldUseEntityName() {
        assertEquals("Account", EntitySchemas.schemaName(Company.class));
        assertEquals("Note", EntitySchemas.schemaName(Note.class));
        assertEquals("Address", EntitySchemas.schemaName(Address.class));
    }

    @Test
    @DisplayName("Should map persistent attributes, inherited id first")
    void shouldMapPersistentAttributes() {
        // When
        RecordSchema schema = EntitySchemas.schemaFor(Company.class);

        // Then
        assertEquals("id", schema.getFields().iterator().next().name());
        assertEquals("id", schema.getIdField().orElseThrow().name());
        assertEquals(FieldType.IDENTIFIER, schema.requireField("id").type());
        assertEquals(FieldType.TEXT, schema.requireField("name").type());
        assertEquals(FieldType.NUMERIC, schema.requireField("revenue").type());
        assertEquals(FieldType.NUMERIC, schema.requireField("employees").type());
        assertEquals(FieldType.BOOLEAN, schema.requireField("active").type());
        assertEquals(FieldType.DATE, schema.requireField("closeDate").type());
        assertEquals(FieldType.DATETIME, schema.requireField("createdAt").type());
        assertEquals(FieldType.TEXT, schema.requireField("tier").type());
    }

    @Test
    @DisplayName("Should map associations and embeddables as relations")
    void shouldMapRelations() {
        RecordSchema schema = EntitySchemas.schemaFor(Company.class);

        assertEquals(FieldDescriptor.relation("parent", "Account"), schema.requireField("parent"));
        assertEquals(FieldDescriptor.relation("address", "Address"), schema.requireField("address"));
    }

    @Test
    @DisplayName("Related schemas resolve to the schemas of the related classes")
    void relatedSchemasResolve() {
        RecordSchema schema = EntitySchemas.schemaFor(Company.class);

        assertSame(schema, schema.getRelatedSchema("parent").orElseThrow());
        assertSame(EntitySchemas.schemaFor(Address.class), schema.getRelatedSchema("address").orElseThrow());
    }

    @Test
    @DisplayName("Should skip static, transient, collection and array attributes")
    void shouldSkipNonPersistentAttributes() {
        RecordSchema schema = EntitySchemas.schemaFor(Company.class);

        for (String skipped : List.of("DEFAULT_NAME", "subsidiaries", "displayName", "cache", "logo")) {
            assertFalse(schema.hasField(skipped), skipped);
        }
    }

    @Test
    @DisplayName("Should cache schemas per class")
    void shouldCacheSchemas() {
        assertSame(EntitySchemas.schemaFor(Company.class), EntitySchemas.schemaFor(Company.class));
    }

    @Test
    @DisplayName("Should reject classes that are not mapped")
    void shouldRejectUnmappedClasses() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> EntitySchemas.schemaFor(String.class));
        assertTrue(ex.getMessage().contains("java.lang.String"));
    }

    @Test
    @DisplayName("Should map Java types to field types")
    void shouldMapJavaTypes() {
        assertEquals(Optional.of(FieldType.NUMERIC), EntitySchemas.fieldTypeOf(long.class));
        assertEquals(Optional.of(FieldType.NUMERIC), EntitySchemas.fieldTypeOf(BigDecimal.class));
        assertEquals(Optional.of(FieldType.DATE), EntitySchemas.fieldTypeOf(LocalDate.class));
        assertEquals(Optional.of(FieldType.DATETIME), EntitySchemas.fieldTypeOf(Date.class));
        assertEquals(Optional.of(FieldType.DATETIME), EntitySchemas.fieldTypeOf(Instant.class));
        assertEquals(Optional.of(FieldType.IDENTIFIER), EntitySchemas.fieldTypeOf(UUID.class));
        assertEquals(Optional.of(FieldType.TEXT), EntitySchemas.fieldTypeOf(char.class));
        assertEquals(Optional.empty(), EntitySchemas.fieldTypeOf(Object.class));
    }
}
