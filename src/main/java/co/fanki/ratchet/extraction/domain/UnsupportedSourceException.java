package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.DomainException;

/**
 * Thrown when no parser is registered for a requested file or language.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class UnsupportedSourceException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported to REST clients. */
    public static final String ERROR_CODE = "UNSUPPORTED_FILE_TYPE";

    /**
     * Creates a new exception.
     *
     * @param source the file path or language tag that has no parser
     */
    public UnsupportedSourceException(final String source) {
        super("Unsupported file type: " + source, ERROR_CODE);
    }

}
