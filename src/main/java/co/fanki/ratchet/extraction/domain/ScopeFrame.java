package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.autoload.domain.NamespacePath;
import co.fanki.ratchet.shared.Preconditions;

import java.util.List;

/**
 * One lexically enclosing namespace at a point in the source.
 *
 * <p>A frame is opened by a {@code module} or {@code class} body and
 * records the segments its declaration spells out. {@code module A::B}
 * opens a single frame with the segments {@code A, B}: Ruby's nesting
 * inside it is {@code [A::B]}, so {@code A} alone is not searched.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ScopeFrame {

    private final SyntaxNode opener;

    private final List<String> segments;

    private final NamespacePath namespace;

    private ScopeFrame(final SyntaxNode theOpener,
            final List<String> theSegments, final NamespacePath theNamespace) {
        this.opener = Preconditions.requireNonNull(theOpener,
                "Opening node is required");
        this.segments = List.copyOf(theSegments);
        this.namespace = Preconditions.requireNonNull(theNamespace,
                "Namespace is required");
    }

    /**
     * Creates the top-level frame every scope chain ends with.
     *
     * @param root the root of the parsed tree
     * @return the top-level frame
     */
    public static ScopeFrame topLevel(final SyntaxNode root) {
        return new ScopeFrame(root, List.of(), NamespacePath.root());
    }

    /**
     * Creates the frame a declaration opens inside an enclosing frame.
     *
     * <p>A root-anchored declaration ({@code class ::Foo}) ignores the
     * enclosing namespace.</p>
     *
     * @param declaration the module or class node
     * @param declared the declared name
     * @param enclosing the frame the declaration appears in
     * @return the new frame
     */
    public static ScopeFrame opened(final SyntaxNode declaration,
            final ConstantName declared, final ScopeFrame enclosing) {
        Preconditions.requireNonNull(declared, "Declared name is required");
        Preconditions.requireNonNull(enclosing, "Enclosing frame is required");

        final NamespacePath namespace = declared.isRootAnchored()
                ? declared.asPath()
                : enclosing.namespace().append(declared.segments());
        return new ScopeFrame(declaration, declared.segments(), namespace);
    }

    /** @return the module/class node, or the tree root for the top level */
    public SyntaxNode opener() {
        return opener;
    }

    /** @return the segments the declaration introduces, empty at top level */
    public List<String> segments() {
        return segments;
    }

    /** @return the fully-qualified namespace of this frame */
    public NamespacePath namespace() {
        return namespace;
    }

    /** @return true for the top-level frame */
    public boolean isTopLevel() {
        return segments.isEmpty();
    }

    @Override
    public String toString() {
        return isTopLevel() ? "<top level>" : namespace.toString();
    }

}
