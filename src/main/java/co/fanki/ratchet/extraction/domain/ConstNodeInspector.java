package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.util.Optional;

/**
 * Finds plain constant reads: {@code Foo}, {@code Foo::Bar} and
 * {@code ::Foo}.
 *
 * <p>Only the outermost node of a {@code ::} chain is reported, so
 * {@code Foo::Bar::Baz} is one reference and {@code Foo::Bar.baz} reports
 * {@code Foo::Bar}. The name of the module or class being declared is a
 * definition and is skipped; its superclass is a reference. Assigning a
 * constant ({@code LIMIT = 10}, {@code A, B = 1, 2}) defines it as well,
 * but the scope of a qualified assignment ({@code Config::LIMIT = 10}) is
 * a reference. A method named like a constant ({@code def Order}) is not a
 * read either.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConstNodeInspector implements ConstantReferenceInspector {

    private final ClassModuleDeclarations declarations;

    /**
     * Creates an inspector.
     *
     * @param theDeclarations recognizes declaration names
     */
    public ConstNodeInspector(final ClassModuleDeclarations theDeclarations) {
        this.declarations = Preconditions.requireNonNull(theDeclarations,
                "Declarations are required");
    }

    /** {@inheritDoc} */
    @Override
    public Optional<UnresolvedReference> inspect(final SyntaxNode node,
            final SyntaxNode parent, final LexicalScope scope,
            final String relativePath) {

        if (!node.kind().isConstantAccess()) {
            return Optional.empty();
        }
        // inner link of a longer chain
        if (parent != null && parent.kind() == NodeKind.SCOPE_RESOLUTION) {
            return Optional.empty();
        }
        if (declarations.isDeclarationName(node, parent)) {
            return Optional.empty();
        }
        if (isMethodName(node, parent)) {
            return Optional.empty();
        }
        if (isAssignmentTarget(node, parent)) {
            return node.child("scope").flatMap(target ->
                    reference(target, scope, relativePath));
        }
        return reference(node, scope, relativePath);
    }

    private static Optional<UnresolvedReference> reference(
            final SyntaxNode node, final LexicalScope scope,
            final String relativePath) {
        return ConstantName.fromNode(node).map(name ->
                new UnresolvedReference(name, scope, relativePath,
                        node.span()));
    }

    private static boolean isAssignmentTarget(final SyntaxNode node,
            final SyntaxNode parent) {
        if (parent == null) {
            return false;
        }
        return parent.kind() == NodeKind.ASSIGNMENT && node.isField("left")
                || parent.kind() == NodeKind.ASSIGNMENT_TARGETS;
    }

    private static boolean isMethodName(final SyntaxNode node,
            final SyntaxNode parent) {
        return parent != null && parent.kind() == NodeKind.METHOD
                && node.isField("name");
    }

}
