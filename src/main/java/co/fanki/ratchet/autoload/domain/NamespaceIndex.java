package co.fanki.ratchet.autoload.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only mapping from fully-qualified namespace paths to the files that
 * are expected, by naming convention, to define them.
 *
 * <p>The index answers the two questions constant resolution needs: is a
 * path known at all (so the lexical search can stop climbing scopes), and
 * which file defines an exact path. It is built once, usually by the
 * {@link DirectoryScanner}, and never changes afterwards, so any number of
 * threads can query it without locking.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NamespaceIndex {

    private static final NamespaceIndex EMPTY = new NamespaceIndex(
            Map.of(), List.of());

    private final Map<NamespacePath, NamespaceEntry> entries;

    /** Inverse lookup, defining file to the constant it defines. */
    private final Map<String, NamespacePath> constantsByFile;

    private final List<AutoloadRoot> roots;

    private NamespaceIndex(final Map<NamespacePath, NamespaceEntry> theEntries,
            final List<AutoloadRoot> theRoots) {
        final List<NamespaceEntry> sorted = new ArrayList<>(
                theEntries.values());
        sorted.sort(Comparator.comparing(e -> e.path().toString()));

        final Map<NamespacePath, NamespaceEntry> ordered =
                new LinkedHashMap<>();
        final Map<String, NamespacePath> byFile = new HashMap<>();
        for (final NamespaceEntry entry : sorted) {
            ordered.put(entry.path(), entry);
            entry.definingFile().ifPresent(
                    file -> byFile.put(file, entry.path()));
        }
        this.entries = Collections.unmodifiableMap(ordered);
        this.constantsByFile = Collections.unmodifiableMap(byFile);
        this.roots = List.copyOf(theRoots);
    }

    /**
     * Returns an index that knows no constants.
     *
     * @return the empty index
     */
    public static NamespaceIndex empty() {
        return EMPTY;
    }

    /**
     * Starts building an index by hand.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks whether the path names a known constant or namespace.
     *
     * <p>The top level is always known.</p>
     *
     * @param path the fully-qualified path
     * @return true if the index has an entry for the path
     */
    public boolean isKnown(final NamespacePath path) {
        Preconditions.requireNonNull(path, "Namespace path is required");
        return path.isRoot() || entries.containsKey(path);
    }

    /**
     * Returns the entry for an exact path.
     *
     * @param path the fully-qualified path
     * @return the entry, empty if unknown
     */
    public Optional<NamespaceEntry> entry(final NamespacePath path) {
        Preconditions.requireNonNull(path, "Namespace path is required");
        return Optional.ofNullable(entries.get(path));
    }

    /**
     * Returns the file that defines an exact path.
     *
     * @param path the fully-qualified path
     * @return the project relative file, empty for unknown paths and for
     *         pure namespaces
     */
    public Optional<String> definingFile(final NamespacePath path) {
        return entry(path).flatMap(NamespaceEntry::definingFile);
    }

    /**
     * Returns the constant a file is expected to define.
     *
     * @param relativeFile the project relative file, '/' separated
     * @return the namespace path, empty if the file is not autoloaded
     */
    public Optional<NamespacePath> constantDefinedIn(
            final String relativeFile) {
        Preconditions.requireNonNull(relativeFile, "File is required");
        return Optional.ofNullable(constantsByFile.get(relativeFile));
    }

    /**
     * Returns all entries ordered by their qualified name.
     *
     * @return unmodifiable list of entries
     */
    public List<NamespaceEntry> entries() {
        return List.copyOf(entries.values());
    }

    /**
     * Returns the autoload roots the index was built from.
     *
     * @return unmodifiable list of roots, empty for hand-built indexes
     */
    public List<AutoloadRoot> roots() {
        return roots;
    }

    /**
     * Returns the number of entries.
     *
     * @return the entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the number of entries backed by a defining file.
     *
     * @return the file count
     */
    public int fileCount() {
        return constantsByFile.size();
    }

    /**
     * Accumulates entries and detects collisions.
     *
     * <p>Adding a path also registers every enclosing namespace, so that
     * {@code Admin::UsersController} makes {@code Admin} known even when
     * no file or directory spells it out. Directories sharing a path are
     * merged; two files for one path are a collision.</p>
     */
    public static final class Builder {

        private final Map<NamespacePath, NamespaceEntry> entries =
                new HashMap<>();

        private final List<AutoloadRoot> roots = new ArrayList<>();

        private Builder() {
        }

        /**
         * Records a root the entries come from.
         *
         * @param root the autoload root
         * @return this builder
         */
        public Builder root(final AutoloadRoot root) {
            roots.add(Preconditions.requireNonNull(root, "Root is required"));
            return this;
        }

        /**
         * Registers a namespace directory.
         *
         * @param path the namespace the directory stands for
         * @return this builder
         */
        public Builder namespace(final NamespacePath path) {
            Preconditions.requireNonNull(path, "Namespace path is required");
            if (path.isRoot()) {
                return this;
            }
            namespace(path.parent());
            entries.merge(path, new NamespaceEntry(path, null, true),
                    (existing, added) -> existing.withDirectory());
            return this;
        }

        /**
         * Registers a file that defines a constant.
         *
         * @param path the constant the file defines
         * @param relativeFile the project relative file, '/' separated
         * @return this builder
         * @throws NamespaceCollisionException if another file already
         *         defines the same path
         */
        public Builder file(final NamespacePath path,
                final String relativeFile) {
            Preconditions.requireNonNull(path, "Namespace path is required");
            Preconditions.require(!path.isRoot(),
                    "A file cannot define the top level: " + relativeFile);
            Preconditions.requireNonBlank(relativeFile,
                    "Defining file is required");

            namespace(path.parent());

            final NamespaceEntry existing = entries.get(path);
            if (existing == null) {
                entries.put(path, new NamespaceEntry(path, relativeFile,
                        false));
            } else if (existing.hasDefiningFile()) {
                if (!existing.definingFile().get().equals(relativeFile)) {
                    throw new NamespaceCollisionException(path,
                            existing.definingFile().get(), relativeFile);
                }
            } else {
                entries.put(path, existing.withDefiningFile(relativeFile));
            }
            return this;
        }

        /**
         * Builds the immutable index.
         *
         * @return the index
         */
        public NamespaceIndex build() {
            return new NamespaceIndex(entries, roots);
        }
    }

}
