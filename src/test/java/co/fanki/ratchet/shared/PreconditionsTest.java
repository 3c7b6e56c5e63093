package co.fanki.ratchet.shared;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireNonBlank_givenNullString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(null, "String is null"));
    }

    @Test
    void whenRequireNonEmpty_givenElements_shouldReturnSameCollection() {
        final List<String> values = List.of("a");

        assertSame(values, Preconditions.requireNonEmpty(values, "message"));
    }

    @Test
    void whenRequireNonEmpty_givenEmptyCollection_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonEmpty(List.of(), "Empty"));
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowWithMessage() {
        final IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));

        assertEquals("Condition is false", e.getMessage());
    }

    @Test
    void whenRequirePositive_givenPositiveValue_shouldReturnValue() {
        assertEquals(5, Preconditions.requirePositive(5, "message"));
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Not positive"));
    }

}
