package co.fanki.ratchet.autoload.domain;

import co.fanki.ratchet.shared.Preconditions;
import co.fanki.ratchet.shared.ValueObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Value object for a fully-qualified Ruby namespace, such as
 * {@code Billing::Invoice}.
 *
 * <p>A path is an ordered list of constant segments. The empty path is the
 * top level ({@code Object} in Ruby terms). Paths are canonical: every
 * segment is a valid constant name, so two paths are equal exactly when
 * they name the same constant.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NamespacePath implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** Separator between namespace segments. */
    public static final String SEPARATOR = "::";

    private static final NamespacePath ROOT = new NamespacePath(List.of());

    private final List<String> segments;

    private NamespacePath(final List<String> theSegments) {
        for (final String segment : theSegments) {
            Preconditions.require(isValidSegment(segment),
                    "Invalid namespace segment: '" + segment + "'");
        }
        this.segments = Collections.unmodifiableList(
                new ArrayList<>(theSegments));
    }

    /**
     * Returns the top-level namespace.
     *
     * @return the empty path
     */
    public static NamespacePath root() {
        return ROOT;
    }

    /**
     * Creates a path from individual segments.
     *
     * @param segments the constant segments, outermost first
     * @return the path
     * @throws IllegalArgumentException if a segment is not a constant name
     */
    public static NamespacePath of(final String... segments) {
        return of(Arrays.asList(segments));
    }

    /**
     * Creates a path from a list of segments.
     *
     * @param segments the constant segments, outermost first
     * @return the path
     * @throws IllegalArgumentException if a segment is not a constant name
     */
    public static NamespacePath of(final List<String> segments) {
        Preconditions.requireNonNull(segments, "Segments are required");
        if (segments.isEmpty()) {
            return ROOT;
        }
        return new NamespacePath(segments);
    }

    /**
     * Parses a {@code ::}-separated name. A leading separator is accepted
     * and ignored, since every namespace path is already fully qualified.
     *
     * @param qualifiedName the name, e.g. {@code "Billing::Invoice"}
     * @return the path; the root path for an empty string
     */
    public static NamespacePath parse(final String qualifiedName) {
        Preconditions.requireNonNull(qualifiedName,
                "Qualified name is required");

        String name = qualifiedName.trim();
        if (name.startsWith(SEPARATOR)) {
            name = name.substring(SEPARATOR.length());
        }
        if (name.isEmpty()) {
            return ROOT;
        }
        return of(name.split(SEPARATOR, -1));
    }

    /**
     * Checks whether the given text can be used as a namespace segment.
     *
     * <p>Ruby constants start with an upper-case letter and continue with
     * word characters.</p>
     *
     * @param segment the candidate segment
     * @return true if it is a valid constant name
     */
    public static boolean isValidSegment(final String segment) {
        if (segment == null || segment.isEmpty()) {
            return false;
        }
        if (!Character.isUpperCase(segment.charAt(0))) {
            return false;
        }
        for (int i = 1; i < segment.length(); i++) {
            final char c = segment.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the segments of this path.
     *
     * @return unmodifiable list of segments, outermost first
     */
    public List<String> segments() {
        return segments;
    }

    /**
     * Returns the number of segments.
     *
     * @return the depth, 0 for the top level
     */
    public int depth() {
        return segments.size();
    }

    /**
     * Checks whether this is the top-level namespace.
     *
     * @return true if the path has no segments
     */
    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Returns the innermost segment.
     *
     * @return the last segment
     * @throws IllegalStateException for the root path
     */
    public String lastSegment() {
        if (isRoot()) {
            throw new IllegalStateException("The top level has no name");
        }
        return segments.get(segments.size() - 1);
    }

    /**
     * Returns the enclosing namespace.
     *
     * @return the path without its last segment; root stays root
     */
    public NamespacePath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new NamespacePath(segments.subList(0, segments.size() - 1));
    }

    /**
     * Returns the path of a constant nested directly in this namespace.
     *
     * @param segment the nested constant name
     * @return the child path
     */
    public NamespacePath child(final String segment) {
        return append(List.of(segment));
    }

    /**
     * Appends segments positionally to this path.
     *
     * @param more the segments to append
     * @return the combined path
     */
    public NamespacePath append(final List<String> more) {
        Preconditions.requireNonNull(more, "Segments are required");
        if (more.isEmpty()) {
            return this;
        }
        final List<String> combined = new ArrayList<>(segments);
        combined.addAll(more);
        return new NamespacePath(combined);
    }

    /**
     * Appends another path to this one.
     *
     * @param other the relative path to append
     * @return the combined path
     */
    public NamespacePath append(final NamespacePath other) {
        Preconditions.requireNonNull(other, "Path is required");
        return append(other.segments);
    }

    /**
     * Checks whether this path equals or is nested inside the given one.
     *
     * @param prefix the candidate enclosing path
     * @return true if {@code prefix} is a leading part of this path
     */
    public boolean startsWith(final NamespacePath prefix) {
        Preconditions.requireNonNull(prefix, "Prefix is required");
        return prefix.depth() <= depth()
                && segments.subList(0, prefix.depth()).equals(prefix.segments);
    }

    /**
     * Returns the root-anchored spelling, e.g. {@code ::Billing::Invoice}.
     *
     * @return the qualified name; an empty string for the root path
     */
    public String qualifiedName() {
        if (isRoot()) {
            return "";
        }
        return SEPARATOR + toString();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final NamespacePath that = (NamespacePath) obj;
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }

}
