package co.fanki.ratchet.autoload.domain;

import co.fanki.ratchet.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link NamespaceIndex} by walking autoload root directories.
 *
 * <p>Each directory below a root becomes a namespace and each {@code .rb}
 * file a constant, named through the {@link Inflector}:</p>
 * <pre>
 *   app/models/order.rb             -&gt; Order
 *   app/models/billing/             -&gt; Billing (namespace only)
 *   app/models/billing/invoice.rb   -&gt; Billing::Invoice
 *   app/admin/users_controller.rb   -&gt; Admin::UsersController
 *                                      (root pushed with namespace Admin)
 * </pre>
 *
 * <p>A root nested in another root is only scanned as its own root, the
 * way {@code app/models/concerns} holds top-level constants rather than
 * {@code Concerns::*}. Hidden directories and names that do not camelize
 * into a constant are skipped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DirectoryScanner {

    private static final Logger LOG = LoggerFactory.getLogger(
            DirectoryScanner.class);

    private static final String RUBY_EXTENSION = ".rb";

    private final Inflector inflector;

    /**
     * Creates a scanner.
     *
     * @param theInflector the naming convention for files and directories
     */
    public DirectoryScanner(final Inflector theInflector) {
        this.inflector = Preconditions.requireNonNull(theInflector,
                "Inflector is required");
    }

    /**
     * Scans the roots and builds the index.
     *
     * @param projectRoot the project root; relative roots are resolved
     *        against it and defining files are reported relative to it
     * @param roots the autoload roots, in configuration order
     * @return the immutable index
     * @throws IOException if a directory cannot be read
     * @throws NamespaceCollisionException if two files define the same
     *         namespace path
     */
    public NamespaceIndex scan(final Path projectRoot,
            final List<AutoloadRoot> roots) throws IOException {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        Preconditions.requireNonNull(roots, "Autoload roots are required");

        final Path base = projectRoot.toAbsolutePath().normalize();

        final Set<Path> rootDirectories = new LinkedHashSet<>();
        for (final AutoloadRoot root : roots) {
            rootDirectories.add(base.resolve(root.directory()).normalize());
        }

        final NamespaceIndex.Builder builder = NamespaceIndex.builder();

        for (final AutoloadRoot root : roots) {
            final Path directory = base.resolve(root.directory()).normalize();
            if (!Files.isDirectory(directory)) {
                LOG.warn("Autoload root not found, skipping: {}", directory);
                continue;
            }

            LOG.debug("Scanning autoload root {} (namespace '{}')",
                    directory, root.namespace());

            builder.root(root);
            builder.namespace(root.namespace());
            Files.walkFileTree(directory, new RootVisitor(base, directory,
                    root.namespace(), rootDirectories, builder));
        }

        final NamespaceIndex index = builder.build();
        LOG.info("Namespace index built from {} roots: {} entries,"
                + " {} defining files", index.roots().size(), index.size(),
                index.fileCount());
        return index;
    }

    /** Walks one root, tracking the namespace of every open directory. */
    private final class RootVisitor extends SimpleFileVisitor<Path> {

        private final Path projectRoot;

        private final Path rootDirectory;

        private final Set<Path> allRoots;

        private final NamespaceIndex.Builder builder;

        private final Map<Path, NamespacePath> namespaces = new HashMap<>();

        private RootVisitor(final Path theProjectRoot,
                final Path theRootDirectory, final NamespacePath theNamespace,
                final Set<Path> theAllRoots,
                final NamespaceIndex.Builder theBuilder) {
            this.projectRoot = theProjectRoot;
            this.rootDirectory = theRootDirectory;
            this.allRoots = theAllRoots;
            this.builder = theBuilder;
            namespaces.put(theRootDirectory, theNamespace);
        }

        @Override
        public FileVisitResult preVisitDirectory(final Path dir,
                final BasicFileAttributes attrs) {
            if (dir.equals(rootDirectory)) {
                return FileVisitResult.CONTINUE;
            }
            if (allRoots.contains(dir)) {
                LOG.debug("Skipping nested autoload root {}", dir);
                return FileVisitResult.SKIP_SUBTREE;
            }

            final String name = dir.getFileName().toString();
            if (name.startsWith(".")) {
                return FileVisitResult.SKIP_SUBTREE;
            }

            final String segment = inflector.camelize(name);
            if (!NamespacePath.isValidSegment(segment)) {
                LOG.warn("Directory {} does not map to a constant name,"
                        + " skipping", relative(dir));
                return FileVisitResult.SKIP_SUBTREE;
            }

            final NamespacePath namespace = namespaces.get(dir.getParent())
                    .child(segment);
            namespaces.put(dir, namespace);
            builder.namespace(namespace);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(final Path file,
                final BasicFileAttributes attrs) {
            final String name = file.getFileName().toString();
            if (!attrs.isRegularFile() || !name.endsWith(RUBY_EXTENSION)) {
                return FileVisitResult.CONTINUE;
            }

            final String basename = name.substring(0,
                    name.length() - RUBY_EXTENSION.length());
            final String segment = inflector.camelize(basename);
            if (!NamespacePath.isValidSegment(segment)) {
                LOG.warn("File {} does not map to a constant name, skipping",
                        relative(file));
                return FileVisitResult.CONTINUE;
            }

            final NamespacePath constant = namespaces.get(file.getParent())
                    .child(segment);
            builder.file(constant, relative(file));
            return FileVisitResult.CONTINUE;
        }

        private String relative(final Path path) {
            return projectRoot.relativize(path).toString().replace('\\', '/');
        }
    }

}
