package co.fanki.ratchet.extraction.domain.ruby;

import co.fanki.ratchet.extraction.domain.NodeKind;
import co.fanki.ratchet.extraction.domain.SyntaxNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RubySourceParser}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RubySourceParserTest {

    private final RubySourceParser parser = new RubySourceParser();

    @Test
    void whenCheckingSupport_givenRubyFiles_shouldAcceptThem() {
        assertTrue(parser.supports("order.rb"));
        assertTrue(parser.supports("tasks.rake"));
        assertTrue(parser.supports("Gemfile"));
        assertTrue(parser.supports("config.ru"));
        assertFalse(parser.supports("show.html.erb"));
        assertFalse(parser.supports("logo.png"));
    }

    @Test
    void whenParsing_givenValidSource_shouldReturnProgram() {
        final SyntaxNode root = parser.parse("Order.find(1)", "x.rb")
                .orElseThrow();

        assertEquals(NodeKind.PROGRAM, root.kind());
        assertEquals(List.of("Order"), texts(root, NodeKind.CONSTANT));
    }

    @Test
    void whenParsing_givenSyntaxError_shouldReturnEmpty() {
        assertEquals(Optional.empty(), parser.parse("class Foo <", "x.rb"));
    }

    @Test
    void whenParsing_givenEmptySource_shouldReturnEmptyProgram() {
        final SyntaxNode root = parser.parse("", "x.rb").orElseThrow();

        assertTrue(root.children().isEmpty());
    }

    @Test
    void whenParsing_givenScopedConstant_shouldLabelScopeAndName() {
        final SyntaxNode root = parser.parse("Billing::Invoice", "x.rb")
                .orElseThrow();

        final SyntaxNode chain = first(root, NodeKind.SCOPE_RESOLUTION);
        assertEquals("Billing", chain.child("scope").orElseThrow()
                .text().orElseThrow());
        assertEquals("Invoice", chain.child("name").orElseThrow()
                .text().orElseThrow());
    }

    @Test
    void whenParsing_givenRootAnchoredConstant_shouldHaveNoScope() {
        final SyntaxNode root = parser.parse("::Invoice", "x.rb")
                .orElseThrow();

        final SyntaxNode chain = first(root, NodeKind.SCOPE_RESOLUTION);
        assertTrue(chain.child("scope").isEmpty());
        assertTrue(chain.child("name").isPresent());
    }

    @Test
    void whenParsing_givenClass_shouldLabelNameAndSuperclass() {
        final SyntaxNode root = parser.parse(
                "class Order < ApplicationRecord\nend\n", "x.rb")
                .orElseThrow();

        final SyntaxNode klass = first(root, NodeKind.CLASS);
        assertEquals("Order", klass.child("name").orElseThrow()
                .text().orElseThrow());
        final SyntaxNode superclass = klass.child("superclass").orElseThrow();
        assertEquals(NodeKind.SUPERCLASS, superclass.kind());
        assertEquals(List.of("ApplicationRecord"),
                texts(superclass, NodeKind.CONSTANT));
    }

    @Test
    void whenParsing_givenConstantAssignment_shouldLabelTarget() {
        final SyntaxNode root = parser.parse("LIMIT = 10", "x.rb")
                .orElseThrow();

        final SyntaxNode assignment = first(root, NodeKind.ASSIGNMENT);
        assertEquals(NodeKind.CONSTANT,
                assignment.child("left").orElseThrow().kind());
    }

    @Test
    void whenParsing_givenMultipleLines_shouldComputeLineAndColumn() {
        final SyntaxNode root = parser.parse("x = 1\n  Order\n", "x.rb")
                .orElseThrow();

        final SyntaxNode order = first(root, NodeKind.CONSTANT);
        assertEquals(2, order.span().line());
        assertEquals(2, order.span().column());
        assertEquals(8, order.span().startOffset());
        assertEquals(13, order.span().endOffset());
    }

    @Test
    void whenParsing_givenMultiByteCharacters_shouldUseCharacterOffsets() {
        final String source = "s = \"héllo\"; Order";

        final SyntaxNode order = first(parser.parse(source, "x.rb")
                .orElseThrow(), NodeKind.CONSTANT);

        assertEquals(source.indexOf("Order"), order.span().startOffset());
        assertEquals("Order", source.substring(order.span().startOffset(),
                order.span().endOffset()));
    }

    @Test
    void whenParsingFile_givenUtf8File_shouldParseIt(
            @TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("order.rb");
        Files.writeString(file, "class Order\nend\n");

        assertTrue(parser.parse(file, "order.rb").isPresent());
    }

    @Test
    void whenParsingFile_givenInvalidUtf8_shouldReturnEmpty(
            @TempDir final Path dir) throws IOException {
        final Path file = dir.resolve("binary.rb");
        Files.write(file, new byte[] {(byte) 0xC3, (byte) 0x28, 0x0A});

        assertTrue(parser.parse(file, "binary.rb").isEmpty());
    }

    private static SyntaxNode first(final SyntaxNode root,
            final NodeKind kind) {
        if (root.kind() == kind) {
            return root;
        }
        for (final SyntaxNode child : root.children()) {
            final SyntaxNode found = firstOrNull(child, kind);
            if (found != null) {
                return found;
            }
        }
        throw new AssertionError("No " + kind + " in " + root);
    }

    private static SyntaxNode firstOrNull(final SyntaxNode node,
            final NodeKind kind) {
        if (node.kind() == kind) {
            return node;
        }
        for (final SyntaxNode child : node.children()) {
            final SyntaxNode found = firstOrNull(child, kind);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static List<String> texts(final SyntaxNode root,
            final NodeKind kind) {
        final List<String> result = new ArrayList<>();
        collect(root, kind, result);
        return result;
    }

    private static void collect(final SyntaxNode node, final NodeKind kind,
            final List<String> result) {
        if (node.kind() == kind) {
            node.text().ifPresent(result::add);
        }
        for (final SyntaxNode child : node.children()) {
            collect(child, kind, result);
        }
    }

}
