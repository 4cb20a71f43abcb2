package io.github.cyfko.recordql.core.resolve;

import io.github.cyfko.recordql.core.api.FieldRef;
import io.github.cyfko.recordql.core.exception.FieldNotLoadedException;
import io.github.cyfko.recordql.core.model.DataRecord;
import io.github.cyfko.recordql.core.model.FieldType;
import io.github.cyfko.recordql.core.model.MapRecord;
import io.github.cyfko.recordql.core.model.RecordSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static io.github.cyfko.recordql.core.Accounts.ACCOUNT;
import static io.github.cyfko.recordql.core.Accounts.CONTACT;
import static io.github.cyfko.recordql.core.Accounts.account;
import static io.github.cyfko.recordql.core.Accounts.contact;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("FieldPathResolver Tests")
class FieldPathResolverTest {

    @Test
    @DisplayName("Should resolve a direct field with its declared type")
    void shouldResolveDirectField() {
        // When
        ResolvedValue resolved = FieldPathResolver.resolve(account("Foo", 1000), FieldRef.parse("Revenue"));

        // Then
        assertEquals(BigDecimal.valueOf(1000), resolved.value());
        assertEquals(FieldType.NUMERIC, resolved.declaredType());
    }

    @Test
    @DisplayName("Should walk relations to the terminal field")
    void shouldWalkRelations() {
        // Given
        MapRecord holding = account("Holding", 1);
        MapRecord doe = contact("Doe", account("Foo", 1000).with("Parent", holding));

        // When
        ResolvedValue resolved = FieldPathResolver.resolve(doe, FieldRef.parse("Account.Parent.Name"));

        // Then
        assertEquals("Holding", resolved.value());
        assertEquals(FieldType.TEXT, resolved.declaredType());
    }

    @Test
    @DisplayName("A null relation yields a null value that keeps the terminal field's declared type")
    void nullRelationKeepsDeclaredType() {
        MapRecord orphan = MapRecord.of(CONTACT).with("Account", null);
        MapRecord noParent = contact("Doe", account("Foo", 1).with("Parent", null));

        ResolvedValue name = FieldPathResolver.resolve(orphan, FieldRef.parse("Account.Name"));
        ResolvedValue parentId = FieldPathResolver.resolve(noParent, FieldRef.parse("Account.Parent.Id"));
        ResolvedValue grandParentRevenue = FieldPathResolver.resolve(orphan, FieldRef.parse("Account.Parent.Parent.Revenue"));

        assertTrue(name.isNull());
        assertEquals(FieldType.TEXT, name.declaredType());
        assertEquals(FieldType.IDENTIFIER, parentId.declaredType());
        assertEquals(FieldType.NUMERIC, grandParentRevenue.declaredType());
    }

    @Test
    @DisplayName("Invalid segments beyond a null relation are still rejected")
    void invalidSegmentsBeyondNullRelationFail() {
        MapRecord orphan = MapRecord.of(CONTACT).with("Account", null);

        assertThrows(IllegalArgumentException.class,
                () -> FieldPathResolver.resolve(orphan, FieldRef.parse("Account.Owner")));
        assertThrows(IllegalArgumentException.class,
                () -> FieldPathResolver.resolve(orphan, FieldRef.parse("Account.Name.Length")));
    }

    @Test
    @DisplayName("A relation declared by name only leaves the type of a null path unknown")
    void relationDeclaredByNameLeavesTypeUnknown() {
        // Given
        RecordSchema loose = RecordSchema.builder("Opportunity").relation("Account", "Account").build();
        MapRecord opportunity = MapRecord.of(loose).with("Account", null);

        // When
        ResolvedValue resolved = FieldPathResolver.resolve(opportunity, FieldRef.parse("Account.Name"));

        // Then
        assertTrue(resolved.isNull());
        assertTrue(resolved.type().isEmpty());
    }

    @Test
    @DisplayName("declaredType works a path out from schemas alone")
    void declaredTypeFromSchemas() {
        assertEquals(Optional.of(FieldType.BOOLEAN), FieldPathResolver.declaredType(ACCOUNT, FieldRef.parse("Active")));
        assertEquals(Optional.of(FieldType.DATE), FieldPathResolver.declaredType(CONTACT, FieldRef.parse("Account.Parent.CloseDate")));
        assertEquals(Optional.of(FieldType.RELATION), FieldPathResolver.declaredType(CONTACT, FieldRef.parse("Account.Parent")));
        assertThrows(IllegalArgumentException.class,
                () -> FieldPathResolver.declaredType(CONTACT, FieldRef.parse("LastName.Length")));
        assertThrows(IllegalArgumentException.class,
                () -> FieldPathResolver.declaredType(ACCOUNT, FieldRef.parse("Owner")));
    }

    @Test
    @DisplayName("A relation never loaded raises FieldNotLoadedException naming the path")
    void unloadedRelationFails() {
        MapRecord doe = MapRecord.of(CONTACT).with("LastName", "Doe");

        FieldNotLoadedException ex = assertThrows(FieldNotLoadedException.class,
                () -> FieldPathResolver.resolve(doe, FieldRef.parse("Account.Name")));

        assertEquals("Account", ex.getFieldName());
        assertEquals("Contact", ex.getSchemaName());
        assertTrue(ex.getMessage().contains("Account.Name"));
    }

    @Test
    @DisplayName("A terminal field never loaded on the related record raises FieldNotLoadedException")
    void unloadedTerminalFieldFails() {
        MapRecord doe = contact("Doe", MapRecord.of(ACCOUNT).with("Name", "Foo"));

        FieldNotLoadedException ex = assertThrows(FieldNotLoadedException.class,
                () -> FieldPathResolver.resolve(doe, FieldRef.parse("Account.Revenue")));

        assertEquals("Revenue", ex.getFieldName());
        assertEquals("Account", ex.getSchemaName());
    }

    @Test
    @DisplayName("Unknown fields and navigation through primitives are rejected")
    void invalidPathsAreRejected() {
        MapRecord foo = account("Foo", 1000);

        assertThrows(IllegalArgumentException.class, () -> FieldPathResolver.resolve(foo, FieldRef.parse("Owner")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> FieldPathResolver.resolve(foo, FieldRef.parse("Name.Length")));
        assertTrue(ex.getMessage().contains("non-relationship"));
    }

    @Test
    @DisplayName("A host relation holding something else than a record is reported")
    void hostRelationHoldingNonRecordFails() {
        // Given
        DataRecord broken = mock(DataRecord.class);
        when(broken.getSchema()).thenReturn(CONTACT);
        when(broken.isLoaded("Account")).thenReturn(true);
        when(broken.get("Account")).thenReturn("001");

        // When / Then
        assertThrows(IllegalStateException.class,
                () -> FieldPathResolver.resolve(broken, FieldRef.parse("Account.Name")));
    }
}
