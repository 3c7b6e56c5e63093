package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Pre-order, depth-first traversal that tracks lexical namespace nesting.
 *
 * <p>Every node is visited exactly once together with the
 * {@link LexicalScope} Ruby would use to look up a constant written at
 * that node. Only namespace declarations change the scope, and only for
 * their body; conditionals, method bodies and blocks are traversed
 * without touching it. The traversal uses an explicit stack, so tree
 * depth is bounded by memory rather than the call stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScopeTrackingWalker {

    private final NamespaceDeclarationReader declarations;

    /**
     * Creates a walker.
     *
     * @param theDeclarations recognizes namespace-opening nodes
     */
    public ScopeTrackingWalker(
            final NamespaceDeclarationReader theDeclarations) {
        this.declarations = Preconditions.requireNonNull(theDeclarations,
                "Declaration reader is required");
    }

    /**
     * Walks the tree.
     *
     * @param root the root node
     * @param visitor called once per node, in source order
     */
    public void walk(final SyntaxNode root, final NodeVisitor visitor) {
        Preconditions.requireNonNull(root, "Root node is required");
        Preconditions.requireNonNull(visitor, "Visitor is required");

        final Deque<Step> stack = new ArrayDeque<>();
        stack.push(new Step(root, null, LexicalScope.topLevel(root)));

        while (!stack.isEmpty()) {
            final Step step = stack.pop();
            final SyntaxNode node = step.node();
            visitor.visit(node, step.parent(), step.scope());

            final Optional<ConstantName> declared =
                    declarations.declaredName(node);
            final LexicalScope bodyScope = declared
                    .map(name -> step.scope().enter(node, name))
                    .orElse(step.scope());

            final List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                final SyntaxNode child = children.get(i);
                final LexicalScope childScope =
                        declarations.isHeader(node, child)
                                ? step.scope()
                                : bodyScope;
                stack.push(new Step(child, node, childScope));
            }
        }
    }

    private record Step(SyntaxNode node, SyntaxNode parent,
            LexicalScope scope) {
    }

}
