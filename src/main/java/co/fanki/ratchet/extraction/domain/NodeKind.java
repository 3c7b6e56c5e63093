package co.fanki.ratchet.extraction.domain;

/**
 * The node kinds constant extraction cares about.
 *
 * <p>Parsers map their grammar onto these kinds; everything else is
 * {@link #OTHER} and is only traversed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /** Root of a parsed file or snippet. */
    PROGRAM,

    /** {@code module Name ... end}. */
    MODULE,

    /** {@code class Name < Superclass ... end}. */
    CLASS,

    /** The {@code < Superclass} part of a class declaration. */
    SUPERCLASS,

    /** A bare constant, {@code Foo}. */
    CONSTANT,

    /** {@code Foo::Bar}, or {@code ::Foo} when there is no scope. */
    SCOPE_RESOLUTION,

    /** {@code target = value} and {@code target ||= value}. */
    ASSIGNMENT,

    /**
     * A group of assignment targets: {@code a, B = ...}, {@code *Rest} or
     * {@code (a, B)} on the left of a multiple assignment.
     */
    ASSIGNMENT_TARGETS,

    /** {@code def name ... end} and {@code def self.name ... end}. */
    METHOD,

    /** Any other syntax. */
    OTHER;

    /**
     * Checks whether nodes of this kind open a namespace for their body.
     *
     * @return true for modules and classes
     */
    public boolean isNamespaceDeclaration() {
        return this == MODULE || this == CLASS;
    }

    /**
     * Checks whether nodes of this kind can denote a constant.
     *
     * @return true for constants and scope resolutions
     */
    public boolean isConstantAccess() {
        return this == CONSTANT || this == SCOPE_RESOLUTION;
    }

}
