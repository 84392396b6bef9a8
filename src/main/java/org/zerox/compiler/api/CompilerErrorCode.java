package org.zerox.compiler.api;

/**
 * Defines unique, testable error codes for everything the front end can report.
 * This decouples the test logic from the wording of the messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A string literal was not closed before the end of its line. */
    UNTERMINATED_STRING,
    // endregion

    // region Parser Errors
    /** A token appeared where the current production does not allow it. */
    UNEXPECTED_TOKEN,
    /** A character the lexer could not classify reached the parser. */
    UNEXPECTED_CHARACTER,
    /** A word in a keyword position is not a known keyword for that position. */
    UNKNOWN_KEYWORD,
    /** The source ended inside an open block while a token was still required. */
    UNEXPECTED_END,
    // endregion

    // region Validation Findings
    /** A state, derived, prop or fn name was declared twice in the same container. */
    DUPLICATE_DECLARATION,
    /** Derived values depend on each other in a cycle. */
    CIRCULAR_DERIVED,
    /** A state is declared but never read. */
    UNUSED_STATE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a source file. */
    IO_ERROR_READING_FILE,
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
