package com.formwright.core.capability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityTableTest {

    @Test
    @DisplayName("built-in types expose their controls")
    void builtInTypes() {
        var table = new CapabilityTable(Map.of());

        assertTrue(table.supports("short_answer", "placeholder"));
        assertFalse(table.supports("paragraph", "required"));
        assertFalse(table.supports("long_answer", "rows"));
        assertTrue(table.isKnownType("interactive_table"));
    }

    @Test
    @DisplayName("unknown types support nothing")
    void unknownType() {
        var table = new CapabilityTable(Map.of());

        assertFalse(table.isKnownType("hologram"));
        assertFalse(table.supports("hologram", "title"));
        assertEquals(Set.of(), table.controls("hologram"));
    }

    @Test
    @DisplayName("overrides replace the built-in entry and add new types")
    void overrides() {
        var table = new CapabilityTable(Map.of(
                "paragraph", List.of("title"),
                "rating", List.of("title", "scale")));

        assertFalse(table.supports("paragraph", "body"));
        assertTrue(table.supports("rating", "scale"));
        assertEquals(CapabilityTable.DEFAULTS.size() + 1, table.asMap().size());
    }

    @Test
    @DisplayName("asMap is a copy")
    void asMapIsCopy() {
        var table = new CapabilityTable(Map.of());
        table.asMap().get("paragraph").add("required");

        assertFalse(table.supports("paragraph", "required"));
    }
}
