package co.fanki.ratchet.extraction.domain;

import co.fanki.ratchet.shared.Preconditions;

/**
 * A resolved edge: a location in one file refers to a constant defined in
 * a project file.
 *
 * @param sourceFile the referencing file, project relative, or
 *        {@code <snippet>}
 * @param span where the reference is written
 * @param constant the constant it resolves to
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Reference(
        String sourceFile,
        SourceSpan span,
        ConstantContext constant
) {

    /**
     * Validates the reference.
     *
     * @param sourceFile the referencing file
     * @param span the source span
     * @param constant the resolved constant
     */
    public Reference {
        Preconditions.requireNonBlank(sourceFile, "Source file is required");
        Preconditions.requireNonNull(span, "Source span is required");
        Preconditions.requireNonNull(constant, "Constant is required");
    }

    /**
     * Checks whether the reference points back into its own file.
     *
     * @return true if the constant is defined in the source file
     */
    public boolean isSelfReference() {
        return sourceFile.equals(constant.definingFile());
    }

}
