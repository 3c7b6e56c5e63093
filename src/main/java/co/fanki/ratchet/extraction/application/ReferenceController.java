package co.fanki.ratchet.extraction.application;

import co.fanki.ratchet.extraction.domain.Reference;
import co.fanki.ratchet.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller exposing reference extraction.
 *
 * <p>Snippets and files are analyzed against the namespace index built at
 * startup. Domain errors, such as an unsupported file type, and malformed
 * request bodies answer {@code 400} with an error code.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/references")
@Tag(name = "References",
        description = "Extract references to autoloaded constants")
public class ReferenceController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReferenceController.class);

    /** Error code for malformed request bodies. */
    static final String INVALID_REQUEST = "INVALID_REQUEST";

    private final ReferenceExtractionService extractionService;

    private final ProjectScanService scanService;

    /**
     * Creates a new ReferenceController.
     *
     * @param theExtractionService the extraction service
     * @param theScanService the project scan service
     */
    public ReferenceController(
            final ReferenceExtractionService theExtractionService,
            final ProjectScanService theScanService) {
        this.extractionService = theExtractionService;
        this.scanService = theScanService;
    }

    /**
     * Extracts the references of a snippet.
     *
     * @param request the snippet request
     * @return the references
     */
    @PostMapping("/snippet")
    @Operation(summary = "Extract references from a snippet",
            description = "Parses the given Ruby code and returns the"
                    + " autoloaded constants it references.")
    public ResponseEntity<?> snippet(
            @RequestBody final SnippetRequest request) {

        LOG.debug("Snippet extraction requested");

        try {
            final List<Reference> references = request.language() == null
                    ? extractionService.referencesFromString(request.source())
                    : extractionService.referencesFromString(
                            request.source(), request.language());
            return ResponseEntity.ok(ReferenceView.listOf(references));
        } catch (final DomainException e) {
            return badRequest(e.getMessage(), e.getErrorCode());
        } catch (final IllegalArgumentException e) {
            return badRequest(e.getMessage(), INVALID_REQUEST);
        }
    }

    /**
     * Extracts the references of a project file.
     *
     * @param request the file request
     * @return the references
     */
    @PostMapping("/file")
    @Operation(summary = "Extract references from a file",
            description = "Parses a file, relative to the project root,"
                    + " and returns the autoloaded constants it references."
                    + " Missing files yield an empty list.")
    public ResponseEntity<?> file(@RequestBody final FileRequest request) {

        LOG.info("File extraction: {}", request.path());

        try {
            return ResponseEntity.ok(ReferenceView.listOf(
                    extractionService.referencesFromFile(request.path())));
        } catch (final DomainException e) {
            return badRequest(e.getMessage(), e.getErrorCode());
        } catch (final IllegalArgumentException e) {
            return badRequest(e.getMessage(), INVALID_REQUEST);
        }
    }

    /**
     * Scans the project and returns its file dependency graph.
     *
     * @return the graph as JSON
     */
    @GetMapping(value = "/graph", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Project dependency graph",
            description = "Extracts references from every source file under"
                    + " the autoload roots and returns file to file edges.")
    public ResponseEntity<String> graph() {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(scanService.scan().toJson());
    }

    private ResponseEntity<?> badRequest(final String message,
            final String errorCode) {
        LOG.warn("Reference extraction failed: {}", message);
        return ResponseEntity.badRequest().body(
                Map.of("error", message, "errorCode", errorCode));
    }

    /**
     * Request body for snippet extraction.
     *
     * @param source the source code
     * @param language the parser language, null for ruby
     */
    public record SnippetRequest(String source, String language) {}

    /**
     * Request body for file extraction.
     *
     * @param path the file path, relative to the project root
     */
    public record FileRequest(String path) {}

    /**
     * A reference as returned by the API.
     *
     * @param sourceFile the file holding the reference
     * @param line the 1-based line
     * @param column the 0-based column
     * @param startOffset the start character offset
     * @param endOffset the end character offset
     * @param constant the qualified constant name
     * @param definingFile the file that defines the constant
     */
    public record ReferenceView(String sourceFile, int line, int column,
            int startOffset, int endOffset, String constant,
            String definingFile) {

        static List<ReferenceView> listOf(final List<Reference> references) {
            return references.stream()
                    .map(ReferenceView::of)
                    .toList();
        }

        static ReferenceView of(final Reference reference) {
            return new ReferenceView(reference.sourceFile(),
                    reference.span().line(), reference.span().column(),
                    reference.span().startOffset(),
                    reference.span().endOffset(),
                    reference.constant().qualifiedName(),
                    reference.constant().definingFile());
        }
    }

}
