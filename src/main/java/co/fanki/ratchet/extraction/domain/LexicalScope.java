package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.autoload.domain.NamespacePath;
import co.fanki.ratchet.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * The stack of namespaces lexically enclosing a node.
 *
 * <p>Scopes are persistent: {@link #enter} returns a new scope sharing the
 * enclosing frames, so a walker can hand the same instance to every node
 * of a body without copying. The outermost frame is always the top
 * level.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LexicalScope {

    private final ScopeFrame frame;

    private final LexicalScope enclosing;

    private LexicalScope(final ScopeFrame theFrame,
            final LexicalScope theEnclosing) {
        this.frame = theFrame;
        this.enclosing = theEnclosing;
    }

    /**
     * Creates the scope of a tree's top level.
     *
     * @param root the root of the parsed tree
     * @return a scope with only the top-level frame
     */
    public static LexicalScope topLevel(final SyntaxNode root) {
        Preconditions.requireNonNull(root, "Root node is required");
        return new LexicalScope(ScopeFrame.topLevel(root), null);
    }

    /**
     * Returns the scope inside a namespace declaration.
     *
     * @param declaration the module or class node
     * @param declared the declared name
     * @return the nested scope
     */
    public LexicalScope enter(final SyntaxNode declaration,
            final ConstantName declared) {
        return new LexicalScope(
                ScopeFrame.opened(declaration, declared, frame), this);
    }

    /** @return the innermost frame */
    public ScopeFrame innermost() {
        return frame;
    }

    /**
     * Returns the frames, innermost first, ending with the top level.
     *
     * @return the frames
     */
    public List<ScopeFrame> frames() {
        final List<ScopeFrame> frames = new ArrayList<>();
        for (LexicalScope s = this; s != null; s = s.enclosing) {
            frames.add(s.frame);
        }
        return frames;
    }

    /**
     * Returns the namespaces a lexical constant lookup searches, innermost
     * first, ending with the top level.
     *
     * @return the candidate namespaces
     */
    public List<NamespacePath> candidateNamespaces() {
        final List<NamespacePath> namespaces = new ArrayList<>();
        for (LexicalScope s = this; s != null; s = s.enclosing) {
            namespaces.add(s.frame.namespace());
        }
        return namespaces;
    }

    /** @return the nesting depth, 0 at top level */
    public int depth() {
        int depth = 0;
        for (LexicalScope s = enclosing; s != null; s = s.enclosing) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return frames().toString();
    }

}
