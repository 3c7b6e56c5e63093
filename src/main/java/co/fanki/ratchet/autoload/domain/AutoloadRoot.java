package co.fanki.ratchet.autoload.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.nio.file.Path;

/**
 * A directory whose files are autoloaded, together with the namespace its
 * contents live in.
 *
 * <p>{@code app/models} with the root namespace holds top-level
 * constants; {@code app/admin} pushed with namespace {@code Admin} makes
 * {@code app/admin/users_controller.rb} define
 * {@code Admin::UsersController}.</p>
 *
 * @param directory the root directory, absolute or relative to the project
 *        root
 * @param namespace the namespace files under the directory are nested in
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AutoloadRoot(Path directory, NamespacePath namespace) {

    /**
     * Validates the root.
     *
     * @param directory the root directory
     * @param namespace the base namespace
     */
    public AutoloadRoot {
        Preconditions.requireNonNull(directory,
                "Autoload root directory is required");
        Preconditions.requireNonNull(namespace,
                "Autoload root namespace is required");
    }

    /**
     * Creates a root holding top-level constants.
     *
     * @param directory the root directory
     * @return the autoload root
     */
    public static AutoloadRoot topLevel(final Path directory) {
        return new AutoloadRoot(directory, NamespacePath.root());
    }

    /**
     * Creates a root from configuration values.
     *
     * @param directory the directory, as written in the configuration
     * @param namespace the base namespace, null or blank for the top level
     * @return the autoload root
     */
    public static AutoloadRoot of(final String directory,
            final String namespace) {
        Preconditions.requireNonBlank(directory,
                "Autoload root directory is required");
        final NamespacePath base = namespace == null || namespace.isBlank()
                ? NamespacePath.root()
                : NamespacePath.parse(namespace);
        return new AutoloadRoot(Path.of(directory), base);
    }

}
