package co.fanki.ratchet.config;

import co.fanki.ratchet.autoload.domain.AutoloadRoot;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the project under analysis, bound from {@code ratchet.*}.
 *
 * <pre>
 * ratchet:
 *   root-path: /srv/shop
 *   autoload-paths:
 *     - path: app/models
 *     - path: app/admin
 *       namespace: Admin
 *   acronyms: [HTML, API]
 *   inflections:
 *     oauth: OAuth
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@ConfigurationProperties(prefix = "ratchet")
public class RatchetProperties {

    private String rootPath = ".";

    private List<AutoloadPath> autoloadPaths = new ArrayList<>();

    private List<String> acronyms = new ArrayList<>();

    private Map<String, String> inflections = new LinkedHashMap<>();

    private boolean resolveNestedConstants = false;

    private int scanThreads = Runtime.getRuntime().availableProcessors();

    public String getRootPath() {
        return rootPath;
    }

    public void setRootPath(final String theRootPath) {
        this.rootPath = theRootPath;
    }

    public List<AutoloadPath> getAutoloadPaths() {
        return autoloadPaths;
    }

    public void setAutoloadPaths(final List<AutoloadPath> theAutoloadPaths) {
        this.autoloadPaths = theAutoloadPaths;
    }

    public List<String> getAcronyms() {
        return acronyms;
    }

    public void setAcronyms(final List<String> theAcronyms) {
        this.acronyms = theAcronyms;
    }

    public Map<String, String> getInflections() {
        return inflections;
    }

    public void setInflections(final Map<String, String> theInflections) {
        this.inflections = theInflections;
    }

    public boolean isResolveNestedConstants() {
        return resolveNestedConstants;
    }

    public void setResolveNestedConstants(final boolean value) {
        this.resolveNestedConstants = value;
    }

    public int getScanThreads() {
        return scanThreads;
    }

    public void setScanThreads(final int theScanThreads) {
        this.scanThreads = theScanThreads;
    }

    /**
     * Returns the project root.
     *
     * @return the absolute, normalized root path
     */
    public Path rootPath() {
        return Path.of(rootPath).toAbsolutePath().normalize();
    }

    /**
     * Converts the configured paths into autoload roots.
     *
     * @return the roots, in configuration order
     */
    public List<AutoloadRoot> autoloadRoots() {
        final List<AutoloadRoot> roots = new ArrayList<>();
        for (final AutoloadPath path : autoloadPaths) {
            roots.add(AutoloadRoot.of(path.getPath(), path.getNamespace()));
        }
        return roots;
    }

    /** One autoload directory and the namespace it maps to. */
    public static class AutoloadPath {

        private String path;

        private String namespace;

        public String getPath() {
            return path;
        }

        public void setPath(final String thePath) {
            this.path = thePath;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(final String theNamespace) {
            this.namespace = theNamespace;
        }
    }

}
