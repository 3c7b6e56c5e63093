package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.util.List;
import java.util.Optional;

/**
 * Parser independent syntax tree node.
 *
 * <p>Parsers convert their own trees into this shape so the walker,
 * inspectors and resolver never see a concrete parser API. Nodes are
 * immutable and only hold what extraction needs: the kind, the grammar
 * field the node fills in its parent, leaf text for names, the ordered
 * children and the source span.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyntaxNode {

    private final NodeKind kind;

    /** The grammar's own node type, kept for diagnostics. */
    private final String type;

    private final String field;

    private final String text;

    private final List<SyntaxNode> children;

    private final SourceSpan span;

    /**
     * Creates a node.
     *
     * @param theKind the node kind
     * @param theType the parser's node type name
     * @param theField the field this node fills in its parent, or null
     * @param theText the source text for name leaves, or null
     * @param theChildren the ordered children
     * @param theSpan the source span
     */
    public SyntaxNode(final NodeKind theKind, final String theType,
            final String theField, final String theText,
            final List<SyntaxNode> theChildren, final SourceSpan theSpan) {
        this.kind = Preconditions.requireNonNull(theKind, "Kind is required");
        this.type = Preconditions.requireNonBlank(theType, "Type is required");
        this.field = theField;
        this.text = theText;
        this.children = List.copyOf(Preconditions.requireNonNull(theChildren,
                "Children are required"));
        this.span = Preconditions.requireNonNull(theSpan, "Span is required");
    }

    /** @return the node kind */
    public NodeKind kind() {
        return kind;
    }

    /** @return the parser's node type name */
    public String type() {
        return type;
    }

    /**
     * Returns the grammar field this node fills in its parent, such as
     * {@code name}, {@code scope} or {@code superclass}.
     *
     * @return the field name, empty for positional children
     */
    public Optional<String> field() {
        return Optional.ofNullable(field);
    }

    /**
     * Checks whether the node fills the given field in its parent.
     *
     * @param fieldName the field name
     * @return true if it does
     */
    public boolean isField(final String fieldName) {
        return fieldName.equals(field);
    }

    /**
     * Returns the source text of name leaves (constants, identifiers).
     *
     * @return the text, empty for inner nodes
     */
    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    /** @return unmodifiable ordered children */
    public List<SyntaxNode> children() {
        return children;
    }

    /**
     * Returns the first child filling the given field.
     *
     * @param fieldName the field name
     * @return the child, empty if absent
     */
    public Optional<SyntaxNode> child(final String fieldName) {
        for (final SyntaxNode child : children) {
            if (child.isField(fieldName)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /** @return the source span */
    public SourceSpan span() {
        return span;
    }

    @Override
    public String toString() {
        return type + (text != null ? "(" + text + ")" : "") + "@" + span;
    }

}
