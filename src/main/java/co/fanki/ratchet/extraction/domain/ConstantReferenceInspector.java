package co.fanki.ratchet.extraction.domain;

import java.util.Optional;

/**
 * Recognizes one way of referring to a constant.
 *
 * <p>Inspectors are registered as an ordered list on the
 * {@link ReferenceExtractor} and each one runs on every node. They must
 * not mutate nodes or perform I/O.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ConstantReferenceInspector {

    /**
     * Inspects a node.
     *
     * @param node the node to inspect
     * @param parent its syntactic parent, null for the root
     * @param scope the namespaces enclosing the node
     * @param relativePath the source label the reference will carry
     * @return the reference the node denotes, if any
     */
    Optional<UnresolvedReference> inspect(SyntaxNode node, SyntaxNode parent,
            LexicalScope scope, String relativePath);

}
