package co.fanki.ratchet.autoload.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link NamespacePath}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NamespacePathTest {

    @Test
    void whenParsing_givenQualifiedName_shouldSplitSegments() {
        final NamespacePath path = NamespacePath.parse("Billing::Invoice");

        assertEquals(List.of("Billing", "Invoice"), path.segments());
        assertEquals(2, path.depth());
        assertEquals("Invoice", path.lastSegment());
    }

    @Test
    void whenParsing_givenLeadingSeparator_shouldIgnoreIt() {
        assertEquals(NamespacePath.of("Billing", "Invoice"),
                NamespacePath.parse("::Billing::Invoice"));
    }

    @Test
    void whenParsing_givenEmptyString_shouldReturnRoot() {
        assertTrue(NamespacePath.parse("").isRoot());
    }

    @Test
    void whenCreating_givenLowerCaseSegment_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> NamespacePath.of("Billing", "invoice"));
    }

    @Test
    void whenValidatingSegment_givenVariousNames_shouldAcceptOnlyConstants() {
        assertTrue(NamespacePath.isValidSegment("Invoice"));
        assertTrue(NamespacePath.isValidSegment("V2_Api"));
        assertFalse(NamespacePath.isValidSegment("invoice"));
        assertFalse(NamespacePath.isValidSegment("2Fast"));
        assertFalse(NamespacePath.isValidSegment("Foo-Bar"));
        assertFalse(NamespacePath.isValidSegment(""));
    }

    @Test
    void whenNavigating_givenNestedPath_shouldWalkParentsToRoot() {
        final NamespacePath path = NamespacePath.of("A", "B", "C");

        assertEquals(NamespacePath.of("A", "B"), path.parent());
        assertEquals(NamespacePath.of("A"), path.parent().parent());
        assertTrue(path.parent().parent().parent().isRoot());
    }

    @Test
    void whenAppending_givenSegments_shouldExtendPath() {
        final NamespacePath base = NamespacePath.of("Admin");

        assertEquals(NamespacePath.of("Admin", "Users", "Export"),
                base.append(List.of("Users", "Export")));
        assertEquals(NamespacePath.of("Admin", "Users"), base.child("Users"));
        assertEquals(base, NamespacePath.root().append(base));
    }

    @Test
    void whenCheckingPrefix_givenAncestor_shouldReturnTrue() {
        final NamespacePath path = NamespacePath.of("A", "B", "C");

        assertTrue(path.startsWith(NamespacePath.of("A", "B")));
        assertTrue(path.startsWith(NamespacePath.root()));
        assertFalse(path.startsWith(NamespacePath.of("B")));
    }

    @Test
    void whenFormatting_givenPath_shouldRenderQualifiedAndPlainNames() {
        final NamespacePath path = NamespacePath.of("Billing", "Invoice");

        assertEquals("::Billing::Invoice", path.qualifiedName());
        assertEquals("Billing::Invoice", path.toString());
        assertEquals("", NamespacePath.root().qualifiedName());
    }

    @Test
    void whenComparing_givenSameSegments_shouldBeEqual() {
        assertEquals(NamespacePath.parse("A::B"), NamespacePath.of("A", "B"));
        assertEquals(NamespacePath.parse("A::B").hashCode(),
                NamespacePath.of("A", "B").hashCode());
    }

}
