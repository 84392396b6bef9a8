package org.zerox.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Words.
    /** A reserved word, such as {@code page} or {@code state}. */
    KEYWORD,
    /** An identifier, such as a variable or component name. */
    IDENTIFIER,
    /** One of GET, POST, PUT, DELETE or PATCH. */
    HTTP_METHOD,
    /** A breakpoint or directive prefixed with '@'; the value omits the '@'. */
    AT_KEYWORD,

    // Literals.
    /** An integer or decimal numeral. */
    NUMBER,
    /** A quoted string; the value is unescaped and excludes the quotes. */
    STRING,
    /** A hex color such as {@code #fff}. */
    COLOR,
    /** A style class reference such as {@code .card}. */
    STYLE_CLASS,

    // Symbols.
    OPERATOR,
    PUNCTUATION,

    // Layout.
    /** A line comment; the value is the trimmed text after {@code //}. */
    COMMENT,
    /** The indentation grew compared to the previous line. */
    INDENT,
    /** One indentation level was closed. */
    DEDENT,
    /** The end of a source line. */
    NEWLINE,
    /** Represents the end of the source. */
    EOF,

    /** A character no other rule accepts. The parser reports it when it reaches it. */
    ERROR
}
