package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Selects the {@link SourceParser} for a file or language tag.
 *
 * <p>Parsers are consulted in registration order; the first one that
 * supports a file wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ParserRegistry {

    private final List<SourceParser> parsers;

    /**
     * Creates a registry.
     *
     * @param theParsers the parsers, in priority order
     */
    public ParserRegistry(final List<SourceParser> theParsers) {
        this.parsers = List.copyOf(Preconditions.requireNonEmpty(theParsers,
                "At least one parser is required"));
    }

    /**
     * Finds the parser for a file.
     *
     * @param file the file path
     * @return the parser, empty if the file type is not supported
     */
    public Optional<SourceParser> forPath(final Path file) {
        Preconditions.requireNonNull(file, "File is required");
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        final String name = fileName.toString();
        return parsers.stream().filter(p -> p.supports(name)).findFirst();
    }

    /**
     * Finds the parser for a language tag, for snippets without a file.
     *
     * @param language the language, e.g. "ruby"
     * @return the parser, empty if no parser has that language
     */
    public Optional<SourceParser> forLanguage(final String language) {
        Preconditions.requireNonBlank(language, "Language is required");
        return parsers.stream()
                .filter(p -> p.language().equalsIgnoreCase(language))
                .findFirst();
    }

    /**
     * Checks whether some parser handles the file.
     *
     * @param file the file path
     * @return true if {@link #forPath} would find a parser
     */
    public boolean supports(final Path file) {
        return forPath(file).isPresent();
    }

}
