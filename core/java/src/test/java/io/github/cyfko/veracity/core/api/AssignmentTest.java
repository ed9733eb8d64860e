package io.github.cyfko.veracity.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Assignment Tests")
class AssignmentTest {

    private static final Variable P = new Variable("P");
    private static final Variable Q = new Variable("Q");

    @Test
    @DisplayName("Should start empty")
    void testEmpty() {
        Assignment empty = Assignment.empty();

        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertEquals(Optional.empty(), empty.get(P));
        assertEquals(Map.of(), empty.asMap());
    }

    @Test
    @DisplayName("Should leave the parent untouched when binding")
    void testPersistence() {
        // Given
        Assignment parent = Assignment.empty().bind(P, true);

        // When
        Assignment left = parent.bind(Q, true);
        Assignment right = parent.bind(Q, false);

        // Then
        assertFalse(parent.isBound(Q));
        assertEquals(Optional.of(true), left.get(Q));
        assertEquals(Optional.of(false), right.get(Q));
        assertEquals(Optional.of(true), right.get(P));
        assertEquals(2, left.size());
    }

    @Test
    @DisplayName("Should return the same instance when rebinding to the same value")
    void testRebindSameValue() {
        Assignment assignment = Assignment.empty().bind(P, true);

        assertSame(assignment, assignment.bind(P, true));
    }

    @Test
    @DisplayName("Should refuse to rebind a variable to the opposite value")
    void testRebindConflict() {
        Assignment assignment = Assignment.empty().bind(P, true);

        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> assignment.bind(P, false));
        assertTrue(exception.getMessage().contains("'P'"));
    }

    @Test
    @DisplayName("Should expose bindings in binding order")
    void testAsMapOrder() {
        Assignment assignment = Assignment.empty().bind(Q, false).bind(P, true);

        assertEquals(List.of(Q, P), List.copyOf(assignment.asMap().keySet()));
        assertEquals("{Q=false, P=true}", assignment.toString());
        assertThrows(UnsupportedOperationException.class, () -> assignment.asMap().put(P, false));
    }

    @Test
    @DisplayName("Should compare by bindings regardless of order")
    void testEquality() {
        Assignment a = Assignment.empty().bind(P, true).bind(Q, false);
        Assignment b = Assignment.empty().bind(Q, false).bind(P, true);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Assignment.empty().bind(P, true));
    }

    @Test
    @DisplayName("Should build from a map")
    void testOf() {
        Map<Variable, Boolean> bindings = new LinkedHashMap<>();
        bindings.put(P, true);
        bindings.put(Q, false);

        Assignment assignment = Assignment.of(bindings);

        assertEquals(bindings, assignment.asMap());
        assertThrows(NullPointerException.class, () -> Assignment.of(null));
    }
}
