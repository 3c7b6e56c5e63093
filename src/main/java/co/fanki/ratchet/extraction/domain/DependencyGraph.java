package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * File level dependency graph assembled from resolved references.
 *
 * <p>Nodes are project relative files; an edge {@code a -> b} means
 * {@code a} references a constant defined in {@code b}. Files that define
 * an autoloaded constant carry its qualified name. References from a file
 * to itself are not edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Maps file to the constant it defines, null when none. */
    private final Map<String, String> nodes;

    /** Maps file to the files it depends on. */
    private final Map<String, Set<String>> edges;

    /**
     * Creates an empty graph.
     */
    public DependencyGraph() {
        this.nodes = new TreeMap<>();
        this.edges = new TreeMap<>();
    }

    /**
     * Adds a file to the graph.
     *
     * @param file the project relative file
     * @param constant the qualified constant it defines, or null
     */
    public void addNode(final String file, final String constant) {
        Preconditions.requireNonBlank(file, "File is required");
        if (constant != null || !nodes.containsKey(file)) {
            nodes.put(file, constant);
        }
    }

    /**
     * Records the references of one file as edges.
     *
     * <p>Target files are added as nodes when they are not known yet.</p>
     *
     * @param reference a resolved reference
     */
    public void addReference(final Reference reference) {
        Preconditions.requireNonNull(reference, "Reference is required");
        final String from = reference.sourceFile();
        final String to = reference.constant().definingFile();

        if (!nodes.containsKey(from)) {
            addNode(from, null);
        }
        if (!nodes.containsKey(to)) {
            addNode(to, reference.constant().qualifiedName());
        }
        if (reference.isSelfReference()) {
            return;
        }
        edges.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
    }

    /**
     * Returns the files a file depends on.
     *
     * @param file the project relative file
     * @return unmodifiable sorted set, empty if unknown
     */
    public Set<String> dependencies(final String file) {
        if (file == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(
                edges.getOrDefault(file, Set.of()));
    }

    /**
     * Returns the files that depend on a file.
     *
     * @param file the project relative file
     * @return unmodifiable set in file order, empty if unknown
     */
    public Set<String> dependents(final String file) {
        if (file == null || !nodes.containsKey(file)) {
            return Set.of();
        }
        final Set<String> result = new LinkedHashSet<>();
        for (final Map.Entry<String, Set<String>> entry : edges.entrySet()) {
            if (entry.getValue().contains(file)) {
                result.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Returns the constant defined by a file.
     *
     * @param file the project relative file
     * @return the qualified constant name, or null
     */
    public String constant(final String file) {
        return nodes.get(file);
    }

    /**
     * Checks whether the graph knows a file.
     *
     * @param file the project relative file
     * @return true if the file is a node
     */
    public boolean contains(final String file) {
        return file != null && nodes.containsKey(file);
    }

    /** @return unmodifiable sorted set of files */
    public Set<String> files() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /** @return the number of files */
    public int nodeCount() {
        return nodes.size();
    }

    /** @return the number of file to file edges */
    public int edgeCount() {
        int count = 0;
        for (final Set<String> targets : edges.values()) {
            count += targets.size();
        }
        return count;
    }

    /**
     * Serializes the graph.
     *
     * <p>Format: {@code {"files": {"app/a.rb": {"constant": "::A",
     * "dependencies": ["app/b.rb"]}}}}.</p>
     *
     * @return the JSON document
     */
    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();
        final ObjectNode files = root.putObject("files");

        for (final Map.Entry<String, String> node : nodes.entrySet()) {
            final ObjectNode file = files.putObject(node.getKey());
            if (node.getValue() != null) {
                file.put("constant", node.getValue());
            } else {
                file.putNull("constant");
            }
            final ArrayNode deps = file.putArray("dependencies");
            for (final String dep : dependencies(node.getKey())) {
                deps.add(dep);
            }
        }

        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize dependency graph", e);
        }
    }

}
