package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.autoload.domain.NamespaceIndex;
import co.fanki.ratchet.autoload.domain.NamespacePath;
import co.fanki.ratchet.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides which project constant a reference binds to.
 *
 * <p>Follows Ruby's lexical constant lookup, restricted to what the
 * {@link NamespaceIndex} knows:</p>
 * <ol>
 *   <li>A root-anchored name ({@code ::Foo::Bar}) is taken as written; the
 *       scope is never consulted.</li>
 *   <li>Otherwise the enclosing namespaces are tried innermost first,
 *       ending with the top level. The first namespace {@code P} for which
 *       {@code P::First} is known wins. Only the first segment is looked
 *       up this way.</li>
 *   <li>The remaining segments are appended to the winner as written.</li>
 *   <li>The reference resolves when the resulting path has a defining
 *       file. Pure namespaces and unknown paths are unresolved.</li>
 * </ol>
 *
 * <p>Ancestry lookup (superclasses, included modules) is not simulated.
 * Unresolved references are the normal outcome for constants from gems or
 * the standard library and are not errors.</p>
 *
 * <p>With nested constant resolution enabled, a path the index does not
 * know falls back to the deepest enclosing constant that has a file, so
 * {@code Order::STATUSES} resolves to {@code app/models/order.rb}. The
 * reported constant keeps the written path.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConstantResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            ConstantResolver.class);

    private final NamespaceIndex index;

    private final boolean resolveNestedConstants;

    /**
     * Creates a resolver with nested constant resolution disabled.
     *
     * @param theIndex the namespace index
     */
    public ConstantResolver(final NamespaceIndex theIndex) {
        this(theIndex, false);
    }

    /**
     * Creates a resolver.
     *
     * @param theIndex the namespace index
     * @param isResolveNestedConstants whether constants declared inside an
     *        autoloaded file resolve to that file
     */
    public ConstantResolver(final NamespaceIndex theIndex,
            final boolean isResolveNestedConstants) {
        this.index = Preconditions.requireNonNull(theIndex,
                "Namespace index is required");
        this.resolveNestedConstants = isResolveNestedConstants;
    }

    /**
     * Resolves a reference.
     *
     * @param reference the reference to resolve
     * @return the constant and its defining file, empty if the reference
     *         does not bind to a project file
     */
    public Optional<ConstantContext> resolve(
            final UnresolvedReference reference) {
        Preconditions.requireNonNull(reference, "Reference is required");

        final Optional<NamespacePath> candidate = qualify(reference.name(),
                reference.scope());
        if (candidate.isEmpty()) {
            LOG.trace("Unresolved {} at {}:{}", reference.name(),
                    reference.relativePath(), reference.span());
            return Optional.empty();
        }

        final NamespacePath path = candidate.get();
        final Optional<String> file = index.definingFile(path);
        if (file.isPresent()) {
            return Optional.of(new ConstantContext(path, file.get()));
        }

        if (resolveNestedConstants && !index.isKnown(path)) {
            for (NamespacePath prefix = path.parent(); !prefix.isRoot();
                    prefix = prefix.parent()) {
                final Optional<String> enclosingFile =
                        index.definingFile(prefix);
                if (enclosingFile.isPresent()) {
                    return Optional.of(new ConstantContext(path,
                            enclosingFile.get()));
                }
            }
        }

        LOG.trace("{} resolved to {} which has no defining file",
                reference.name(), path);
        return Optional.empty();
    }

    /**
     * Computes the fully-qualified path a written name binds to.
     *
     * @param name the written name
     * @param scope the enclosing namespaces
     * @return the candidate path, empty if no enclosing namespace (top
     *         level included) knows the first segment
     */
    public Optional<NamespacePath> qualify(final ConstantName name,
            final LexicalScope scope) {
        Preconditions.requireNonNull(name, "Constant name is required");
        Preconditions.requireNonNull(scope, "Scope is required");

        if (name.isRootAnchored()) {
            return Optional.of(name.asPath());
        }

        for (final NamespacePath namespace : scope.candidateNamespaces()) {
            if (index.isKnown(namespace.child(name.firstSegment()))) {
                return Optional.of(namespace.append(name.segments()));
            }
        }
        return Optional.empty();
    }

}
