package co.fanki.ratchet.extraction.domain.ruby;

import co.fanki.ratchet.extraction.domain.NodeKind;
import co.fanki.ratchet.extraction.domain.SourceParser;
import co.fanki.ratchet.extraction.domain.SourceSpan;
import co.fanki.ratchet.extraction.domain.SyntaxNode;
import co.fanki.ratchet.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterRuby;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ruby parser backed by the tree-sitter Ruby grammar.
 *
 * <p>Tree-sitter recovers from syntax errors by inserting error nodes; a
 * tree containing any is rejected, so broken files yield no references
 * instead of partial ones. Tree-sitter reports byte offsets, which are
 * converted to character offsets for the {@link SourceSpan}s.</p>
 *
 * <p>{@link TSParser} is not thread safe; each thread gets its own.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RubySourceParser extends SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            RubySourceParser.class);

    private static final Set<String> EXTENSIONS = Set.of(
            ".rb", ".rake", ".builder", ".gemspec", ".ru");

    private static final Set<String> FILE_NAMES = Set.of(
            "Gemfile", "Rakefile");

    private static final Map<String, NodeKind> KINDS = Map.ofEntries(
            Map.entry("program", NodeKind.PROGRAM),
            Map.entry("module", NodeKind.MODULE),
            Map.entry("class", NodeKind.CLASS),
            Map.entry("superclass", NodeKind.SUPERCLASS),
            Map.entry("constant", NodeKind.CONSTANT),
            Map.entry("scope_resolution", NodeKind.SCOPE_RESOLUTION),
            Map.entry("assignment", NodeKind.ASSIGNMENT),
            Map.entry("operator_assignment", NodeKind.ASSIGNMENT),
            Map.entry("left_assignment_list", NodeKind.ASSIGNMENT_TARGETS),
            Map.entry("rest_assignment", NodeKind.ASSIGNMENT_TARGETS),
            Map.entry("destructured_left_assignment",
                    NodeKind.ASSIGNMENT_TARGETS),
            Map.entry("method", NodeKind.METHOD),
            Map.entry("singleton_method", NodeKind.METHOD));

    /** Fields whose children the extraction needs to tell apart. */
    private static final List<String> FIELDS = List.of(
            "name", "scope", "superclass", "left");

    /** Leaf types whose text is kept. */
    private static final Set<String> NAMED_LEAVES = Set.of(
            "constant", "identifier");

    private static final ThreadLocal<TSParser> PARSER =
            ThreadLocal.withInitial(() -> {
                final TSParser parser = new TSParser();
                parser.setLanguage(new TreeSitterRuby());
                return parser;
            });

    /** {@inheritDoc} */
    @Override
    public String language() {
        return "ruby";
    }

    /** {@inheritDoc} */
    @Override
    public boolean supports(final String fileName) {
        if (FILE_NAMES.contains(fileName)) {
            return true;
        }
        for (final String extension : EXTENSIONS) {
            if (fileName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    /** {@inheritDoc} */
    @Override
    public Optional<SyntaxNode> parse(final String source,
            final String label) {
        Preconditions.requireNonNull(source, "Source is required");

        final TSTree tree = PARSER.get().parseString(null, source);
        final TSNode root = tree.getRootNode();

        if (root.hasError()) {
            LOG.debug("Syntax errors in {}, skipping", label);
            return Optional.empty();
        }

        return Optional.of(new Converter(source).convert(root, null));
    }

    /** Copies a tree-sitter tree into {@link SyntaxNode}s. */
    private static final class Converter {

        private final String source;

        /** Character index for every byte offset of the UTF-8 source. */
        private final int[] charIndex;

        /** Character offset at which every line starts. */
        private final int[] lineStarts;

        private Converter(final String theSource) {
            this.source = theSource;
            this.charIndex = charIndexByByte(theSource);
            this.lineStarts = lineStarts(theSource);
        }

        private SyntaxNode convert(final TSNode node, final String field) {
            final String type = node.getType();
            final NodeKind kind = KINDS.getOrDefault(type, NodeKind.OTHER);

            final int start = charIndex[node.getStartByte()];
            final int end = charIndex[node.getEndByte()];
            final int row = node.getStartPoint().getRow();
            final SourceSpan span = new SourceSpan(start, end, row + 1,
                    start - lineStarts[Math.min(row, lineStarts.length - 1)]);

            final String text = NAMED_LEAVES.contains(type)
                    ? source.substring(start, end)
                    : null;

            final List<TSNode> fieldNodes = new ArrayList<>();
            for (final String fieldName : FIELDS) {
                fieldNodes.add(fieldChild(node, fieldName));
            }

            final List<SyntaxNode> children = new ArrayList<>();
            final int count = node.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                final TSNode child = node.getNamedChild(i);
                if (child == null || child.isNull()) {
                    continue;
                }
                children.add(convert(child, fieldOf(child, fieldNodes)));
            }

            return new SyntaxNode(kind, type, field, text, children, span);
        }

        private static TSNode fieldChild(final TSNode node,
                final String fieldName) {
            final TSNode child = node.getChildByFieldName(fieldName);
            if (child == null || child.isNull()) {
                return null;
            }
            return child;
        }

        private static String fieldOf(final TSNode child,
                final List<TSNode> fieldNodes) {
            for (int i = 0; i < FIELDS.size(); i++) {
                final TSNode candidate = fieldNodes.get(i);
                if (candidate != null
                        && candidate.getStartByte() == child.getStartByte()
                        && candidate.getEndByte() == child.getEndByte()
                        && candidate.getType().equals(child.getType())) {
                    return FIELDS.get(i);
                }
            }
            return null;
        }

        private static int[] charIndexByByte(final String text) {
            final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
            final int[] index = new int[bytes.length + 1];
            int byteOffset = 0;
            int charOffset = 0;
            while (charOffset < text.length()) {
                final int codePoint = text.codePointAt(charOffset);
                final int width = utf8Width(codePoint);
                for (int b = 0; b < width; b++) {
                    index[byteOffset + b] = charOffset;
                }
                byteOffset += width;
                charOffset += Character.charCount(codePoint);
            }
            index[bytes.length] = text.length();
            return index;
        }

        private static int utf8Width(final int codePoint) {
            // unpaired surrogates are encoded as a single '?'
            if (codePoint < 0x80 || codePoint <= Character.MAX_VALUE
                    && Character.isSurrogate((char) codePoint)) {
                return 1;
            }
            if (codePoint < 0x800) {
                return 2;
            }
            if (codePoint < 0x10000) {
                return 3;
            }
            return 4;
        }

        private static int[] lineStarts(final String text) {
            final List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            return starts.stream().mapToInt(Integer::intValue).toArray();
        }
    }

}
