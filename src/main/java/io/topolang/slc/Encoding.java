package io.topolang.slc;

/**
 * Rendering scheme used by {@link Converter}. All schemes share the same scope
 * discipline and resolve every bound variable to the same distance.
 */
public enum Encoding {
    /** Binder {@code {{}}}, variables as nested-set numerals, function side as a singleton. */
    NAMED,
    /** Binder {@code λ}, variables as integer distances, function side as a singleton. */
    DE_BRUIJN,
    /** Binder {@code {λ, v}}, variables by name, function side as {@code {⊕, f}}. Free variables allowed. */
    SYMBOLIC
}
