package co.fanki.ratchet.extraction.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Turns source text of one file type into a {@link SyntaxNode} tree.
 *
 * <p>Each supported file type has its own subclass, selected by the
 * {@link ParserRegistry} from the file name. A parser reports source it
 * cannot parse as an empty result, never as an exception, so that one
 * malformed file does not abort a project scan.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceParser.class);

    /**
     * Returns the language tag of this parser.
     *
     * @return the language, e.g. "ruby" or "erb"
     */
    public abstract String language();

    /**
     * Checks whether this parser handles a file.
     *
     * @param fileName the file name, without directories
     * @return true if the file type is supported
     */
    public abstract boolean supports(String fileName);

    /**
     * Parses source text.
     *
     * @param source the source text
     * @param label the file label used in log messages
     * @return the syntax tree, empty if the source has syntax errors
     */
    public abstract Optional<SyntaxNode> parse(String source, String label);

    /**
     * Reads and parses a file.
     *
     * <p>Files that are not valid UTF-8 are treated like unparseable
     * source.</p>
     *
     * @param file the file to parse
     * @param label the file label used in log messages
     * @return the syntax tree, empty if the file cannot be parsed
     * @throws IOException if the file cannot be read
     */
    public Optional<SyntaxNode> parse(final Path file, final String label)
            throws IOException {
        final String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (final CharacterCodingException e) {
            LOG.warn("Skipping {}: not valid UTF-8", label);
            return Optional.empty();
        }
        return parse(source, label);
    }

}
