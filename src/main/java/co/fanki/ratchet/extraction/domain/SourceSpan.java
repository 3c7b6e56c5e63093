package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;
import co.fanki.ratchet.shared.ValueObject;

/**
 * Location of a node in its source text.
 *
 * @param startOffset character offset of the first character, 0-based
 * @param endOffset character offset just past the last character
 * @param line line of the first character, 1-based
 * @param column column of the first character in characters, 0-based
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceSpan(int startOffset, int endOffset, int line,
        int column) implements ValueObject {

    /**
     * Validates the span.
     *
     * @param startOffset the start offset
     * @param endOffset the end offset
     * @param line the start line
     * @param column the start column
     */
    public SourceSpan {
        Preconditions.require(startOffset >= 0,
                "Start offset must be non-negative");
        Preconditions.require(endOffset >= startOffset,
                "End offset must not precede start offset");
        Preconditions.requirePositive(line, "Line must be positive");
        Preconditions.require(column >= 0, "Column must be non-negative");
    }

    /**
     * Returns the number of characters covered.
     *
     * @return the span length
     */
    public int length() {
        return endOffset - startOffset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }

}
