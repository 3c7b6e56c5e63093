package co.fanki.ratchet.extraction.domain.ruby;

import co.fanki.ratchet.extraction.domain.SourceParser;
import co.fanki.ratchet.extraction.domain.SyntaxNode;
import co.fanki.ratchet.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Parses the Ruby embedded in ERB templates.
 *
 * <p>The template is rewritten into plain Ruby of exactly the same length:
 * markup becomes spaces (line breaks are kept), the code of
 * {@code <% %>} and {@code <%= %>} tags stays in place and every closing
 * {@code %>} becomes a statement separator. Offsets and lines reported
 * for the Ruby tree therefore point into the original template. Comment
 * tags ({@code <%# %>}) and escaped openers ({@code <%%}) contribute no
 * code.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ErbSourceParser extends SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            ErbSourceParser.class);

    private static final String OPEN = "<%";

    private static final String CLOSE = "%>";

    private final RubySourceParser rubyParser;

    /**
     * Creates an ERB parser.
     *
     * @param theRubyParser parses the extracted Ruby code
     */
    public ErbSourceParser(final RubySourceParser theRubyParser) {
        this.rubyParser = Preconditions.requireNonNull(theRubyParser,
                "Ruby parser is required");
    }

    /** {@inheritDoc} */
    @Override
    public String language() {
        return "erb";
    }

    /** {@inheritDoc} */
    @Override
    public boolean supports(final String fileName) {
        return fileName.endsWith(".erb");
    }

    /** {@inheritDoc} */
    @Override
    public Optional<SyntaxNode> parse(final String source,
            final String label) {
        Preconditions.requireNonNull(source, "Source is required");

        final Optional<String> code = extractCode(source);
        if (code.isEmpty()) {
            LOG.debug("Unterminated ERB tag in {}, skipping", label);
            return Optional.empty();
        }
        return rubyParser.parse(code.get(), label);
    }

    /**
     * Rewrites a template into Ruby code of the same length.
     *
     * @param template the ERB template
     * @return the Ruby code, empty if a tag is not closed
     */
    static Optional<String> extractCode(final String template) {
        final StringBuilder code = new StringBuilder(template.length());
        int position = 0;

        while (position < template.length()) {
            final int open = template.indexOf(OPEN, position);
            if (open < 0) {
                blank(template, position, template.length(), code);
                break;
            }
            blank(template, position, open, code);

            if (template.startsWith("<%%", open)) {
                blank(template, open, open + 3, code);
                position = open + 3;
                continue;
            }

            final int close = template.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                return Optional.empty();
            }

            int codeStart = open + OPEN.length();
            final boolean comment = template.startsWith("#", codeStart);
            if (template.startsWith("==", codeStart)) {
                codeStart += 2;
            } else if (codeStart < close
                    && "=-#".indexOf(template.charAt(codeStart)) >= 0) {
                codeStart++;
            }
            int codeEnd = close;
            if (codeEnd > codeStart && template.charAt(codeEnd - 1) == '-') {
                codeEnd--;
            }

            blank(template, open, codeStart, code);
            if (comment) {
                blank(template, codeStart, codeEnd, code);
            } else {
                code.append(template, codeStart, codeEnd);
            }
            blank(template, codeEnd, close, code);
            code.append("; ");
            position = close + CLOSE.length();
        }

        return Optional.of(code.toString());
    }

    private static void blank(final String template, final int from,
            final int to, final StringBuilder code) {
        for (int i = from; i < to; i++) {
            final char c = template.charAt(i);
            code.append(c == '\n' || c == '\r' ? c : ' ');
        }
    }

}
