package co.fanki.ratchet.extraction.application;

import co.fanki.ratchet.extraction.domain.ConstantResolver;
import co.fanki.ratchet.extraction.domain.ParserRegistry;
import co.fanki.ratchet.extraction.domain.Reference;
import co.fanki.ratchet.extraction.domain.ReferenceExtractor;
import co.fanki.ratchet.extraction.domain.SourceParser;
import co.fanki.ratchet.extraction.domain.SyntaxNode;
import co.fanki.ratchet.extraction.domain.UnsupportedSourceException;
import co.fanki.ratchet.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Public entry point for extracting references to autoloaded constants.
 *
 * <p>Usage:</p>
 * <pre>
 *   service.referencesFromString("Order.find(1)");
 *   service.referencesFromFile("app/models/user.rb");
 * </pre>
 *
 * <p>Only references that resolve to a file inside the project are
 * returned. A missing file or a file with syntax errors yields an empty
 * list; a file type without a parser is an
 * {@link UnsupportedSourceException}. The service is stateless and safe
 * to share between threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReferenceExtractionService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReferenceExtractionService.class);

    /** Source label of references found in snippets. */
    public static final String SNIPPET = "<snippet>";

    private static final String DEFAULT_LANGUAGE = "ruby";

    private final Path projectRoot;

    private final ParserRegistry parsers;

    private final ReferenceExtractor extractor;

    private final ConstantResolver resolver;

    /**
     * Creates a new ReferenceExtractionService.
     *
     * @param theProjectRoot the project root files are resolved against
     * @param theParsers the parser registry
     * @param theExtractor the reference extractor
     * @param theResolver the constant resolver of the project
     */
    public ReferenceExtractionService(final Path theProjectRoot,
            final ParserRegistry theParsers,
            final ReferenceExtractor theExtractor,
            final ConstantResolver theResolver) {
        Preconditions.requireNonNull(theProjectRoot,
                "Project root is required");
        this.projectRoot = theProjectRoot.toAbsolutePath().normalize();
        this.parsers = Preconditions.requireNonNull(theParsers,
                "Parser registry is required");
        this.extractor = Preconditions.requireNonNull(theExtractor,
                "Extractor is required");
        this.resolver = Preconditions.requireNonNull(theResolver,
                "Resolver is required");
    }

    /**
     * Extracts references from a Ruby snippet.
     *
     * @param snippet the Ruby code
     * @return the resolved references, labelled {@code <snippet>}, in
     *         source order
     */
    public List<Reference> referencesFromString(final String snippet) {
        return referencesFromString(snippet, DEFAULT_LANGUAGE);
    }

    /**
     * Extracts references from a snippet in the given language.
     *
     * @param snippet the source code
     * @param language the parser language, e.g. "ruby" or "erb"
     * @return the resolved references, in source order
     * @throws UnsupportedSourceException if no parser has that language
     */
    public List<Reference> referencesFromString(final String snippet,
            final String language) {
        Preconditions.requireNonNull(snippet, "Snippet is required");

        final SourceParser parser = parsers.forLanguage(language)
                .orElseThrow(() -> new UnsupportedSourceException(language));

        return parser.parse(snippet, SNIPPET)
                .map(tree -> extractor.extract(tree, SNIPPET, resolver))
                .orElse(List.of());
    }

    /**
     * Extracts references from a file.
     *
     * @param filePath the file, relative to the project root or absolute
     * @return the resolved references, labelled with the project relative
     *         path, in source order; empty if the file does not exist or
     *         cannot be parsed
     * @throws UnsupportedSourceException if no parser handles the file type
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public List<Reference> referencesFromFile(final String filePath) {
        Preconditions.requireNonBlank(filePath, "File path is required");
        return referencesFromFile(Path.of(filePath));
    }

    /**
     * Extracts references from a file.
     *
     * @param filePath the file, relative to the project root or absolute
     * @return the resolved references, in source order
     * @throws UnsupportedSourceException if no parser handles the file type
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public List<Reference> referencesFromFile(final Path filePath) {
        Preconditions.requireNonNull(filePath, "File path is required");

        final Path absolute = projectRoot.resolve(filePath).normalize();
        if (!Files.exists(absolute)) {
            LOG.debug("File not found, nothing to analyze: {}", absolute);
            return List.of();
        }

        final SourceParser parser = parsers.forPath(absolute)
                .orElseThrow(() -> new UnsupportedSourceException(
                        filePath.toString()));

        final String relativePath = relativize(absolute);
        final Optional<SyntaxNode> tree;
        try {
            tree = parser.parse(absolute, relativePath);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read " + absolute, e);
        }

        if (tree.isEmpty()) {
            LOG.warn("Could not parse {}, no references extracted",
                    relativePath);
            return List.of();
        }

        final List<Reference> references =
                extractor.extract(tree.get(), relativePath, resolver);
        LOG.debug("{}: {} references", relativePath, references.size());
        return references;
    }

    /**
     * Returns the project root files are resolved against.
     *
     * @return the absolute, normalized project root
     */
    public Path projectRoot() {
        return projectRoot;
    }

    private String relativize(final Path absolute) {
        return projectRoot.relativize(absolute).toString().replace('\\', '/');
    }

}
