package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;

/**
 * A constant mention found by an inspector, before resolution.
 *
 * @param name the name as written
 * @param scope the namespaces enclosing the mention
 * @param relativePath the project relative source file, or
 *        {@code <snippet>}
 * @param span where the mention is
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record UnresolvedReference(
        ConstantName name,
        LexicalScope scope,
        String relativePath,
        SourceSpan span
) {

    /**
     * Validates the reference.
     *
     * @param name the written name
     * @param scope the enclosing scope
     * @param relativePath the source label
     * @param span the source span
     */
    public UnresolvedReference {
        Preconditions.requireNonNull(name, "Constant name is required");
        Preconditions.requireNonNull(scope, "Scope is required");
        Preconditions.requireNonBlank(relativePath, "Source path is required");
        Preconditions.requireNonNull(span, "Source span is required");
    }

}
