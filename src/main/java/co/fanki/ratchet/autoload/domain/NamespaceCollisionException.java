package co.fanki.ratchet.autoload.domain;

import co.fanki.ratchet.shared.DomainException;

/**
 * Thrown when two files claim the same namespace path.
 *
 * <p>An ambiguous layout makes every resolution into that namespace
 * untrustworthy, so the index refuses to build instead of picking one of
 * the files.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NamespaceCollisionException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported to REST clients. */
    public static final String ERROR_CODE = "NAMESPACE_COLLISION";

    private final NamespacePath path;

    private final String firstFile;

    private final String secondFile;

    /**
     * Creates a new collision exception.
     *
     * @param thePath the namespace both files map to
     * @param theFirstFile the file registered first
     * @param theSecondFile the conflicting file
     */
    public NamespaceCollisionException(final NamespacePath thePath,
            final String theFirstFile, final String theSecondFile) {
        super("Namespace " + thePath + " is defined by both " + theFirstFile
                + " and " + theSecondFile, ERROR_CODE);
        this.path = thePath;
        this.firstFile = theFirstFile;
        this.secondFile = theSecondFile;
    }

    /**
     * Returns the contested namespace path.
     *
     * @return the path
     */
    public NamespacePath path() {
        return path;
    }

    /**
     * Returns the file registered first for the path.
     *
     * @return the project relative file path
     */
    public String firstFile() {
        return firstFile;
    }

    /**
     * Returns the file that collided with the first one.
     *
     * @return the project relative file path
     */
    public String secondFile() {
        return secondFile;
    }

}
