package org.zerox.compiler.frontend.lexer;

import org.zerox.compiler.api.SourceLocation;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type   The type of the token (e.g., KEYWORD, STRING, INDENT).
 * @param value  The token value: the processed text for literals, {@code "\n"} for newlines
 *               and the empty string for INDENT, DEDENT and EOF.
 * @param line   The 1-based line number where the token was found.
 * @param column The 1-based column number where the token begins.
 */
public record Token(
        TokenType type,
        String value,
        int line,
        int column
) {

    /**
     * @return The position of this token.
     */
    public SourceLocation location() {
        return new SourceLocation(line, column);
    }

    /**
     * @param expectedType  The type to compare against.
     * @param expectedValue The value to compare against.
     * @return {@code true} if this token has the given type and value.
     */
    public boolean is(TokenType expectedType, String expectedValue) {
        return type == expectedType && value.equals(expectedValue);
    }

    /**
     * Keywords may be used wherever a name is expected ({@code input}, {@code data}, …).
     * @return {@code true} for IDENTIFIER and KEYWORD tokens.
     */
    public boolean isWord() {
        return type == TokenType.IDENTIFIER || type == TokenType.KEYWORD;
    }
}
