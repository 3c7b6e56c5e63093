package co.fanki.ratchet.extraction.application;

import co.fanki.ratchet.autoload.domain.AutoloadRoot;
import co.fanki.ratchet.autoload.domain.NamespaceIndex;
import co.fanki.ratchet.autoload.domain.NamespacePath;
import co.fanki.ratchet.extraction.domain.DependencyGraph;
import co.fanki.ratchet.extraction.domain.ParserRegistry;
import co.fanki.ratchet.extraction.domain.Reference;
import co.fanki.ratchet.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Extracts the references of every source file under the autoload roots
 * and assembles them into a {@link DependencyGraph}.
 *
 * <p>Files are analyzed concurrently on a fixed pool; the graph is built
 * on the calling thread in file order, so the result does not depend on
 * scheduling.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProjectScanService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectScanService.class);

    private final ReferenceExtractionService extractionService;

    private final NamespaceIndex index;

    private final ParserRegistry parsers;

    private final int threads;

    /**
     * Creates a new ProjectScanService.
     *
     * @param theExtractionService the per file extraction service
     * @param theIndex the namespace index whose roots are scanned
     * @param theParsers the parsers deciding which files are sources
     * @param theThreads the size of the worker pool, positive
     */
    public ProjectScanService(
            final ReferenceExtractionService theExtractionService,
            final NamespaceIndex theIndex,
            final ParserRegistry theParsers,
            final int theThreads) {
        this.extractionService = Preconditions.requireNonNull(
                theExtractionService, "Extraction service is required");
        this.index = Preconditions.requireNonNull(theIndex,
                "Namespace index is required");
        this.parsers = Preconditions.requireNonNull(theParsers,
                "Parser registry is required");
        this.threads = Preconditions.requirePositive(theThreads,
                "Scan threads must be positive");
    }

    /**
     * Scans the project.
     *
     * <p>A file that cannot be read is logged and kept in the graph
     * without dependencies.</p>
     *
     * @return the dependency graph of all source files under the roots
     * @throws UncheckedIOException if a root cannot be walked
     */
    public DependencyGraph scan() {
        final SortedSet<String> files = sourceFiles();
        LOG.info("Scanning {} source files with {} threads",
                files.size(), threads);

        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        final List<Future<List<Reference>>> futures =
                new ArrayList<>(files.size());
        try {
            for (final String file : files) {
                futures.add(executor.submit(
                        () -> extractionService.referencesFromFile(file)));
            }

            final DependencyGraph graph = new DependencyGraph();
            int position = 0;
            for (final String file : files) {
                graph.addNode(file, constantOf(file));
                final List<Reference> references =
                        await(file, futures.get(position++));
                for (final Reference reference : references) {
                    graph.addReference(reference);
                }
            }

            LOG.info("Dependency graph built: {} files, {} edges",
                    graph.nodeCount(), graph.edgeCount());
            return graph;
        } finally {
            executor.shutdownNow();
        }
    }

    private String constantOf(final String file) {
        final Optional<NamespacePath> constant = index.constantDefinedIn(file);
        return constant.map(NamespacePath::qualifiedName).orElse(null);
    }

    private List<Reference> await(final String file,
            final Future<List<Reference>> future) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Project scan interrupted", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException unreadable) {
                LOG.warn("Could not read {}, scanned without references: {}",
                        file, unreadable.getCause().getMessage());
                return List.of();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Project scan failed", cause);
        }
    }

    private SortedSet<String> sourceFiles() {
        final Path base = extractionService.projectRoot();
        final SortedSet<String> files = new TreeSet<>();

        for (final AutoloadRoot root : index.roots()) {
            final Path directory = base.resolve(root.directory()).normalize();
            if (!Files.isDirectory(directory)) {
                continue;
            }
            try {
                Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(final Path dir,
                            final BasicFileAttributes attrs) {
                        if (!dir.equals(directory) && dir.getFileName()
                                .toString().startsWith(".")) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(final Path file,
                            final BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && parsers.supports(file)) {
                            files.add(base.relativize(file).toString()
                                    .replace('\\', '/'));
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (final IOException e) {
                throw new UncheckedIOException(
                        "Failed to walk autoload root " + directory, e);
            }
        }
        return files;
    }

}
