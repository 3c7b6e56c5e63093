package co.fanki.ratchet.extraction.domain;

import java.util.Optional;

/**
 * Tells the {@link ScopeTrackingWalker} which nodes open a namespace.
 *
 * <p>Keeps the walker free of grammar details: the walker only knows that
 * some nodes push a frame for some of their children.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface NamespaceDeclarationReader {

    /**
     * Reads the namespace a node declares.
     *
     * @param node any node
     * @return the declared name, empty when the node does not open a
     *         namespace or its name is not static
     */
    Optional<ConstantName> declaredName(SyntaxNode node);

    /**
     * Checks whether a child of a declaration is evaluated outside the
     * namespace the declaration opens.
     *
     * @param declaration the declaring node
     * @param child one of its children
     * @return true for the declaration header (name, superclass)
     */
    boolean isHeader(SyntaxNode declaration, SyntaxNode child);

}
