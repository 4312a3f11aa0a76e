package io.rulegate.server.core.filter;

/**
 * How subscription filters are interpreted.
 */
public enum FilterMode {
    /**
     * A single field comparison or an {@code &&} chain of them, each against a literal. Field
     * values are coerced toward the literal's type before comparing.
     */
    RESTRICTED,
    /**
     * The full rule grammar; bare identifiers resolve against the record.
     */
    FULL
}
