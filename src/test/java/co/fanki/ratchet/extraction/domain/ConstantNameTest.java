package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.autoload.domain.NamespacePath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ConstantName}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ConstantNameTest {

    private final SyntaxTrees trees = new SyntaxTrees();

    @Test
    void whenParsing_givenLeadingSeparator_shouldBeRootAnchored() {
        final ConstantName name = ConstantName.parse("::Billing::Invoice");

        assertTrue(name.isRootAnchored());
        assertEquals(List.of("Billing", "Invoice"), name.segments());
        assertEquals("::Billing::Invoice", name.toString());
    }

    @Test
    void whenParsing_givenPlainName_shouldBeLexical() {
        final ConstantName name = ConstantName.parse("Invoice");

        assertFalse(name.isRootAnchored());
        assertEquals("Invoice", name.firstSegment());
        assertEquals(NamespacePath.of("Invoice"), name.asPath());
    }

    @Test
    void whenParsing_givenLowerCaseSegment_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> ConstantName.parse("Billing::invoice"));
    }

    @Test
    void whenReadingNode_givenBareConstant_shouldReturnOneSegment() {
        assertEquals(Optional.of(ConstantName.lexical("Order")),
                ConstantName.fromNode(trees.constant("Order")));
    }

    @Test
    void whenReadingNode_givenChain_shouldCollectSegmentsInOrder() {
        assertEquals(Optional.of(ConstantName.lexical("A", "B", "C")),
                ConstantName.fromNode(trees.path("A", "B", "C")));
    }

    @Test
    void whenReadingNode_givenRootAnchoredChain_shouldKeepAnchor() {
        assertEquals(Optional.of(ConstantName.rootAnchored("A", "B")),
                ConstantName.fromNode(trees.rootPath("A", "B")));
    }

    @Test
    void whenReadingNode_givenDynamicScope_shouldReturnEmpty() {
        final SyntaxNode dynamic = trees.scoped(
                trees.call(trees.identifier("klass")), "Nested");

        assertEquals(Optional.empty(), ConstantName.fromNode(dynamic));
    }

    @Test
    void whenReadingNode_givenNonConstant_shouldReturnEmpty() {
        assertEquals(Optional.empty(),
                ConstantName.fromNode(trees.identifier("order")));
    }

    @Test
    void whenComparing_givenDifferentAnchoring_shouldNotBeEqual() {
        assertFalse(ConstantName.lexical("A").equals(
                ConstantName.rootAnchored("A")));
    }

}
