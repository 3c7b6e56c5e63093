package co.fanki.ratchet.autoload.domain;

import co.fanki.ratchet.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts file and directory base names into constant names and back.
 *
 * <p>This is the naming convention the autoloader relies on:</p>
 * <ul>
 *   <li>{@code order_item} becomes {@code OrderItem}: every
 *       underscore-separated word is capitalised and the rest of the word
 *       lower-cased.</li>
 *   <li>Runs of underscores and leading or trailing underscores do not
 *       produce empty words: {@code foo__bar} and {@code _foo_bar_} both
 *       become {@code FooBar}.</li>
 *   <li>Digits stay where they are: {@code v2_api} becomes
 *       {@code V2Api}.</li>
 *   <li>Configured acronyms are upper-cased as a whole word:
 *       with {@code html} registered, {@code html_parser} becomes
 *       {@code HTMLParser}.</li>
 *   <li>Explicit inflections ({@code oauth -> OAuth}) win over the rules
 *       above, in both directions.</li>
 * </ul>
 *
 * <p>{@link #underscore(String)} is the inverse for canonical snake-case
 * names: {@code underscore(camelize(x))} equals {@code x} whenever
 * {@code x} is lower-case, has single underscores, and no digit directly
 * after an acronym.</p>
 *
 * <p>Instances are immutable and thread safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Inflector {

    private static final Inflector STANDARD = new Inflector(
            List.of(), Map.of());

    /** Lower-case acronyms. */
    private final List<String> acronyms;

    /** Base name to constant name. */
    private final Map<String, String> inflections;

    /** Constant name to base name. */
    private final Map<String, String> reverseInflections;

    /**
     * Creates an inflector.
     *
     * @param theAcronyms words that are written fully upper-case in constant
     *        names, in any case
     * @param theInflections explicit base name to constant name mappings
     */
    public Inflector(final Collection<String> theAcronyms,
            final Map<String, String> theInflections) {
        Preconditions.requireNonNull(theAcronyms, "Acronyms are required");
        Preconditions.requireNonNull(theInflections,
                "Inflections are required");

        final List<String> normalized = new ArrayList<>();
        for (final String acronym : theAcronyms) {
            Preconditions.requireNonBlank(acronym, "Acronym cannot be blank");
            normalized.add(acronym.trim().toLowerCase(Locale.ROOT));
        }
        // longest first, so "https" wins over "http" when scanning
        normalized.sort(Comparator.comparingInt(String::length).reversed());
        this.acronyms = List.copyOf(normalized);

        final Map<String, String> forward = new HashMap<>();
        final Map<String, String> reverse = new HashMap<>();
        for (final Map.Entry<String, String> entry
                : theInflections.entrySet()) {
            final String basename = Preconditions.requireNonBlank(
                    entry.getKey(), "Inflection base name cannot be blank");
            final String constant = entry.getValue();
            Preconditions.require(NamespacePath.isValidSegment(constant),
                    "Inflection for '" + basename
                            + "' is not a constant name: " + constant);
            forward.put(basename, constant);
            reverse.put(constant, basename);
        }
        this.inflections = Map.copyOf(forward);
        this.reverseInflections = Map.copyOf(reverse);
    }

    /**
     * Returns an inflector with no acronyms and no explicit inflections.
     *
     * @return the standard inflector
     */
    public static Inflector standard() {
        return STANDARD;
    }

    /**
     * Converts a snake-case base name into a constant name.
     *
     * @param basename the file or directory name without extension
     * @return the camel-case constant name, possibly empty when the base
     *         name has no word characters
     */
    public String camelize(final String basename) {
        Preconditions.requireNonNull(basename, "Base name is required");

        final String explicit = inflections.get(basename);
        if (explicit != null) {
            return explicit;
        }

        final StringBuilder result = new StringBuilder();
        for (final String word : basename.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            final String lower = word.toLowerCase(Locale.ROOT);
            if (acronyms.contains(lower)) {
                result.append(lower.toUpperCase(Locale.ROOT));
            } else {
                result.append(Character.toUpperCase(lower.charAt(0)));
                result.append(lower, 1, lower.length());
            }
        }
        return result.toString();
    }

    /**
     * Converts a constant name back into the snake-case base name the
     * autoloader expects on disk.
     *
     * @param constantName a single constant segment, e.g. {@code HTMLParser}
     * @return the base name, e.g. {@code html_parser}
     */
    public String underscore(final String constantName) {
        Preconditions.requireNonBlank(constantName,
                "Constant name is required");

        final String explicit = reverseInflections.get(constantName);
        if (explicit != null) {
            return explicit;
        }

        final List<String> words = new ArrayList<>();
        int i = 0;
        while (i < constantName.length()) {
            if (constantName.charAt(i) == '_') {
                i++;
                continue;
            }
            final String acronym = acronymAt(constantName, i);
            if (acronym != null) {
                words.add(acronym);
                i += acronym.length();
                continue;
            }
            final int end = wordEnd(constantName, i);
            words.add(constantName.substring(i, end)
                    .toLowerCase(Locale.ROOT));
            i = end;
        }
        return String.join("_", words);
    }

    private String acronymAt(final String name, final int start) {
        for (final String acronym : acronyms) {
            final String upper = acronym.toUpperCase(Locale.ROOT);
            if (!name.startsWith(upper, start)) {
                continue;
            }
            final int next = start + upper.length();
            if (next == name.length()
                    || !Character.isLowerCase(name.charAt(next))) {
                return acronym;
            }
        }
        return null;
    }

    private static int wordEnd(final String name, final int start) {
        int i = start;
        if (Character.isUpperCase(name.charAt(i))) {
            int upperEnd = i + 1;
            while (upperEnd < name.length()
                    && Character.isUpperCase(name.charAt(upperEnd))) {
                upperEnd++;
            }
            if (upperEnd - i > 1) {
                // "HTMLParser": the last capital starts the next word
                if (upperEnd < name.length()
                        && Character.isLowerCase(name.charAt(upperEnd))) {
                    return upperEnd - 1;
                }
            }
            i = upperEnd;
        } else {
            i++;
        }
        while (i < name.length() && !Character.isUpperCase(name.charAt(i))
                && name.charAt(i) != '_') {
            i++;
        }
        return i;
    }

}
