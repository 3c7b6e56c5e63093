package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.autoload.domain.NamespacePath;
import co.fanki.ratchet.shared.Preconditions;
import co.fanki.ratchet.shared.ValueObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A constant name as written at a reference or declaration site.
 *
 * <p>{@code Foo}, {@code Foo::Bar} and {@code ::Foo::Bar} differ in how
 * they are looked up: lexical names start from the enclosing scopes,
 * root-anchored names start from the top level.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConstantName implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final boolean rootAnchored;

    private final List<String> segments;

    private ConstantName(final boolean isRootAnchored,
            final List<String> theSegments) {
        Preconditions.requireNonEmpty(theSegments,
                "A constant name needs at least one segment");
        for (final String segment : theSegments) {
            Preconditions.require(NamespacePath.isValidSegment(segment),
                    "Invalid constant segment: '" + segment + "'");
        }
        this.rootAnchored = isRootAnchored;
        this.segments = List.copyOf(theSegments);
    }

    /**
     * Creates a lexically scoped name.
     *
     * @param segments the written segments
     * @return the name
     */
    public static ConstantName lexical(final String... segments) {
        return new ConstantName(false, Arrays.asList(segments));
    }

    /**
     * Creates a root-anchored name.
     *
     * @param segments the written segments, without the leading separator
     * @return the name
     */
    public static ConstantName rootAnchored(final String... segments) {
        return new ConstantName(true, Arrays.asList(segments));
    }

    /**
     * Parses a written name such as {@code ::Billing::Invoice}.
     *
     * @param written the name as it appears in source
     * @return the name
     */
    public static ConstantName parse(final String written) {
        Preconditions.requireNonBlank(written, "Constant name is required");
        final String trimmed = written.trim();
        final boolean anchored = trimmed.startsWith(NamespacePath.SEPARATOR);
        final String body = anchored
                ? trimmed.substring(NamespacePath.SEPARATOR.length())
                : trimmed;
        return new ConstantName(anchored,
                Arrays.asList(body.split(NamespacePath.SEPARATOR, -1)));
    }

    /**
     * Reads the constant name denoted by a constant or scope resolution
     * node.
     *
     * <p>Only static chains are readable: {@code Foo::Bar} and
     * {@code ::Foo} are, {@code foo::Bar} and {@code self.class::Bar} are
     * not since their scope is only known at run time.</p>
     *
     * @param node the candidate node
     * @return the name, empty if the node is not a static constant chain
     */
    public static Optional<ConstantName> fromNode(final SyntaxNode node) {
        Preconditions.requireNonNull(node, "Node is required");

        final List<String> segments = new ArrayList<>();
        SyntaxNode current = node;
        while (current.kind() == NodeKind.SCOPE_RESOLUTION) {
            final Optional<SyntaxNode> name = current.child("name");
            if (name.isEmpty() || name.get().kind() != NodeKind.CONSTANT) {
                return Optional.empty();
            }
            segments.add(0, name.get().text().orElse(""));

            final Optional<SyntaxNode> scope = current.child("scope");
            if (scope.isEmpty()) {
                return valid(true, segments);
            }
            current = scope.get();
        }

        if (current.kind() != NodeKind.CONSTANT) {
            return Optional.empty();
        }
        segments.add(0, current.text().orElse(""));
        return valid(false, segments);
    }

    private static Optional<ConstantName> valid(final boolean anchored,
            final List<String> segments) {
        for (final String segment : segments) {
            if (!NamespacePath.isValidSegment(segment)) {
                return Optional.empty();
            }
        }
        return Optional.of(new ConstantName(anchored, segments));
    }

    /**
     * Checks whether the name starts with {@code ::}.
     *
     * @return true for root-anchored names
     */
    public boolean isRootAnchored() {
        return rootAnchored;
    }

    /** @return unmodifiable written segments */
    public List<String> segments() {
        return segments;
    }

    /**
     * Returns the only segment that is looked up through the scope chain.
     *
     * @return the first segment
     */
    public String firstSegment() {
        return segments.get(0);
    }

    /**
     * Returns the written segments as a relative namespace path.
     *
     * @return the path made of the written segments
     */
    public NamespacePath asPath() {
        return NamespacePath.of(segments);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ConstantName that = (ConstantName) obj;
        return rootAnchored == that.rootAnchored
                && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(rootAnchored) + segments.hashCode();
    }

    @Override
    public String toString() {
        return (rootAnchored ? NamespacePath.SEPARATOR : "")
                + String.join(NamespacePath.SEPARATOR, segments);
    }

}
