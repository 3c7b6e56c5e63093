package co.fanki.ratchet.autoload.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.util.Objects;
import java.util.Optional;

/**
 * One namespace path known to the {@link NamespaceIndex}.
 *
 * <p>An entry backed by a file ({@code app/models/order.rb}) is a leaf
 * definition. An entry backed only by a directory
 * ({@code app/models/billing/}) is an implicit namespace the autoloader
 * creates on demand, with no defining file. A path that has both a
 * directory and a same-named file is a single entry: the file defines the
 * namespace and the directory holds its nested constants.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NamespaceEntry {

    private final NamespacePath path;

    /** Project relative path, '/' separated; null for pure namespaces. */
    private final String definingFile;

    private final boolean directory;

    NamespaceEntry(final NamespacePath thePath, final String theDefiningFile,
            final boolean isDirectory) {
        Preconditions.requireNonNull(thePath, "Namespace path is required");
        Preconditions.require(theDefiningFile != null || isDirectory,
                "Entry " + thePath + " needs a defining file or a directory");
        this.path = thePath;
        this.definingFile = theDefiningFile;
        this.directory = isDirectory;
    }

    /**
     * Returns the fully-qualified namespace path.
     *
     * @return the path
     */
    public NamespacePath path() {
        return path;
    }

    /**
     * Returns the file expected to define this constant.
     *
     * @return the project relative file path, empty for pure namespaces
     */
    public Optional<String> definingFile() {
        return Optional.ofNullable(definingFile);
    }

    /**
     * Checks whether a concrete file defines this constant.
     *
     * @return true if the entry has a defining file
     */
    public boolean hasDefiningFile() {
        return definingFile != null;
    }

    /**
     * Checks whether the path corresponds to a namespace directory.
     *
     * @return true if nested constants may live under this path
     */
    public boolean isDirectory() {
        return directory;
    }

    NamespaceEntry withDirectory() {
        if (directory) {
            return this;
        }
        return new NamespaceEntry(path, definingFile, true);
    }

    NamespaceEntry withDefiningFile(final String file) {
        return new NamespaceEntry(path, file, directory);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final NamespaceEntry that = (NamespaceEntry) obj;
        return directory == that.directory
                && path.equals(that.path)
                && Objects.equals(definingFile, that.definingFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, definingFile, directory);
    }

    @Override
    public String toString() {
        return "NamespaceEntry{" + path
                + (definingFile != null ? " -> " + definingFile : "")
                + (directory ? ", directory" : "") + "}";
    }

}
