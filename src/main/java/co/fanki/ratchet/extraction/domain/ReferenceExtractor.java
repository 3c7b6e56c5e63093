package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects the constant references of a syntax tree and resolves them.
 *
 * <p>Extraction runs in two separate stages. {@link #collect} walks the
 * tree and asks every inspector about every node; {@link #resolve} maps
 * the collected references through a {@link ConstantResolver}. Both keep
 * source order. The extractor holds no per-call state and can serve many
 * files concurrently.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReferenceExtractor {

    private final ScopeTrackingWalker walker;

    private final List<ConstantReferenceInspector> inspectors;

    /**
     * Creates an extractor.
     *
     * @param theWalker the scope-tracking walker
     * @param theInspectors the inspectors, in the order their results are
     *        reported for a single node
     */
    public ReferenceExtractor(final ScopeTrackingWalker theWalker,
            final List<ConstantReferenceInspector> theInspectors) {
        this.walker = Preconditions.requireNonNull(theWalker,
                "Walker is required");
        this.inspectors = List.copyOf(Preconditions.requireNonEmpty(
                theInspectors, "At least one inspector is required"));
    }

    /**
     * Creates the extractor for plain Ruby constant references.
     *
     * @return an extractor with the class/module walker and the constant
     *         node inspector
     */
    public static ReferenceExtractor standard() {
        final ClassModuleDeclarations declarations =
                new ClassModuleDeclarations();
        return new ReferenceExtractor(new ScopeTrackingWalker(declarations),
                List.of(new ConstNodeInspector(declarations)));
    }

    /**
     * Collects the unresolved references of a tree.
     *
     * @param root the root node
     * @param relativePath the source label the references carry
     * @return the references, in source order
     */
    public List<UnresolvedReference> collect(final SyntaxNode root,
            final String relativePath) {
        Preconditions.requireNonNull(root, "Root node is required");
        Preconditions.requireNonBlank(relativePath, "Source path is required");

        final List<UnresolvedReference> references = new ArrayList<>();
        walker.walk(root, (node, parent, scope) -> {
            for (final ConstantReferenceInspector inspector : inspectors) {
                inspector.inspect(node, parent, scope, relativePath)
                        .ifPresent(references::add);
            }
        });
        return references;
    }

    /**
     * Resolves collected references, dropping the ones that do not bind to
     * a project file.
     *
     * @param unresolved the collected references
     * @param resolver the resolver for the project
     * @return the resolved references, in the same order
     */
    public List<Reference> resolve(final List<UnresolvedReference> unresolved,
            final ConstantResolver resolver) {
        Preconditions.requireNonNull(unresolved, "References are required");
        Preconditions.requireNonNull(resolver, "Resolver is required");

        final List<Reference> references = new ArrayList<>();
        for (final UnresolvedReference reference : unresolved) {
            final Optional<ConstantContext> constant =
                    resolver.resolve(reference);
            constant.ifPresent(context -> references.add(new Reference(
                    reference.relativePath(), reference.span(), context)));
        }
        return references;
    }

    /**
     * Collects and resolves the references of a tree.
     *
     * @param root the root node
     * @param relativePath the source label
     * @param resolver the resolver for the project
     * @return the resolved references, in source order
     */
    public List<Reference> extract(final SyntaxNode root,
            final String relativePath, final ConstantResolver resolver) {
        return resolve(collect(root, relativePath), resolver);
    }

}
