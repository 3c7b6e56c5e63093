package co.fanki.ratchet.extraction.domain;

/**
 * Callback of the {@link ScopeTrackingWalker}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * Visits one node.
     *
     * @param node the visited node
     * @param parent its syntactic parent, null for the root
     * @param scope the namespaces lexically enclosing the node
     */
    void visit(SyntaxNode node, SyntaxNode parent, LexicalScope scope);

}
