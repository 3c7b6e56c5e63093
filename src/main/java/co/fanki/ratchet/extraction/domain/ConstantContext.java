package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.autoload.domain.NamespacePath;
import co.fanki.ratchet.shared.Preconditions;

/**
 * The resolved identity of a referenced constant.
 *
 * <p>Two contexts are equal when they name the same fully-qualified
 * constant, regardless of the file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConstantContext {

    private final NamespacePath path;

    private final String definingFile;

    /**
     * Creates a context.
     *
     * @param thePath the fully-qualified constant
     * @param theDefiningFile the project relative file defining it
     */
    public ConstantContext(final NamespacePath thePath,
            final String theDefiningFile) {
        Preconditions.requireNonNull(thePath, "Constant path is required");
        Preconditions.require(!thePath.isRoot(),
                "The top level is not a constant");
        this.path = thePath;
        this.definingFile = Preconditions.requireNonBlank(theDefiningFile,
                "Defining file is required");
    }

    /** @return the fully-qualified constant path */
    public NamespacePath path() {
        return path;
    }

    /** @return the constant name, e.g. {@code ::Billing::Invoice} */
    public String qualifiedName() {
        return path.qualifiedName();
    }

    /** @return the project relative file defining the constant */
    public String definingFile() {
        return definingFile;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return path.equals(((ConstantContext) obj).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return qualifiedName() + " (" + definingFile + ")";
    }

}
