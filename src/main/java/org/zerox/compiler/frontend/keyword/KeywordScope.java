package org.zerox.compiler.frontend.keyword;

/**
 * The grammatical position a keyword handler is registered for.
 */
public enum KeywordScope {
    /** The start of a top-level line. */
    TOP_LEVEL,
    /** The start of a line inside a page, component or app body. */
    BODY,
    /** The start of a line inside a UI block. Body positions fall back to this scope. */
    UI
}
