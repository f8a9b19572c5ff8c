package com.geoengine.data;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttributeTableTest {

    @Test
    void put_preservesInsertionOrderAndReplacesInPlace() {
        AttributeTable table = new AttributeTable()
                .put("a", 1)
                .put("b", "two")
                .put("c", 3.0);

        table.put("a", 10);

        assertEquals(List.of("a", "b", "c"), table.names());
        assertEquals(AttributeValue.ofLong(10), table.get(0));
    }

    @Test
    void get_missingNameReturnsNull() {
        AttributeTable table = AttributeTable.of("a", 1);

        assertNull(table.get("A"));
        assertFalse(table.exists("A"));
    }

    @Test
    void nullName_rejected() {
        AttributeTable table = new AttributeTable();

        assertThrows(IllegalArgumentException.class, () -> table.put(null, "x"));
        assertThrows(IllegalArgumentException.class, () -> table.get((String) null));
    }

    @Test
    void indexAccess_outOfRangeThrows() {
        AttributeTable table = AttributeTable.of("a", 1, "b", 2);

        assertEquals("b", table.nameAt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> table.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> table.set(-1, AttributeValue.NULL));
    }

    @Test
    void set_byIndexKeepsName() {
        AttributeTable table = AttributeTable.of("a", 1, "b", 2);

        table.set(1, AttributeValue.ofString("x"));

        assertEquals("x", table.getString("b").orElseThrow());
    }

    @Test
    void nullValue_storedAsNullKind() {
        AttributeTable table = new AttributeTable().put("a", (Object) null);

        assertTrue(table.exists("a"));
        assertTrue(table.get("a").isNull());
    }

    @Test
    void remove_andClear() {
        AttributeTable table = AttributeTable.of("a", 1, "b", 2);

        assertTrue(table.remove("a"));
        assertFalse(table.remove("a"));
        assertEquals(1, table.size());
        table.clear();
        assertTrue(table.isEmpty());
    }

    @Test
    void typedAccessors_convertWhereUnambiguous() {
        AttributeTable table = AttributeTable.of(
                "count", "42",
                "ratio", "0.5",
                "flag", "TRUE",
                "when", "2024-01-02T03:04:05Z",
                "whole", 7.0,
                "junk", "abc");

        assertEquals(Optional.of(42L), table.getLong("count"));
        assertEquals(Optional.of(0.5), table.getDouble("ratio"));
        assertEquals(Optional.of(Boolean.TRUE), table.getBoolean("flag"));
        assertEquals(Optional.of(Instant.parse("2024-01-02T03:04:05Z")), table.getInstant("when"));
        assertEquals(Optional.of(7L), table.getLong("whole"));
        assertEquals(Optional.empty(), table.getLong("junk"));
        assertEquals(Optional.empty(), table.getDouble("missing"));
    }

    @Test
    void copy_isIndependent() {
        AttributeTable original = AttributeTable.of("a", 1);

        AttributeTable copy = original.copy();
        copy.put("b", 2);

        assertEquals(1, original.size());
        assertEquals(2, copy.size());
    }

    @Test
    void of_rejectsOddArguments() {
        assertThrows(IllegalArgumentException.class, () -> AttributeTable.of("a"));
    }
}
