package co.fanki.ratchet.shared;

/**
 * Base exception for failures that mean the extractor itself is being used
 * or configured incorrectly.
 *
 * <p>Problems in the analyzed source code (syntax errors, references to
 * constants outside the project) are never reported through this type,
 * they produce empty results instead. Every domain exception carries a
 * stable error code that the REST layer hands back to clients.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
