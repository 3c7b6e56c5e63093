package co.fanki.ratchet.extraction.domain;

import java.util.Optional;

/**
 * Reads {@code module} and {@code class} declarations.
 *
 * <p>The declared name is the {@code name} field. Both the name and the
 * {@code superclass} belong to the header: in
 * {@code class Child < Parent}, Ruby resolves {@code Parent} in the
 * enclosing scope, not inside {@code Child}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ClassModuleDeclarations implements NamespaceDeclarationReader {

    /** {@inheritDoc} */
    @Override
    public Optional<ConstantName> declaredName(final SyntaxNode node) {
        if (!node.kind().isNamespaceDeclaration()) {
            return Optional.empty();
        }
        return node.child("name").flatMap(ConstantName::fromNode);
    }

    /** {@inheritDoc} */
    @Override
    public boolean isHeader(final SyntaxNode declaration,
            final SyntaxNode child) {
        return child.isField("name") || child.isField("superclass")
                || child.kind() == NodeKind.SUPERCLASS;
    }

    /**
     * Checks whether a node is the name of the namespace its parent
     * declares.
     *
     * @param node the candidate name node
     * @param parent the node's parent, may be null
     * @return true if the node is a declaration name
     */
    public boolean isDeclarationName(final SyntaxNode node,
            final SyntaxNode parent) {
        return parent != null && parent.kind().isNamespaceDeclaration()
                && node.isField("name");
    }

}
