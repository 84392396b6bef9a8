package org.zerox.compiler.frontend.parser;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;
import java.util.Map;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides keyword handlers with access to the token stream and to the shared parts of the
 * grammar (expressions, statements, types, blocks and property lists) without coupling them
 * directly to the parser implementation.
 */
public interface ParsingContext {

    // Token stream

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Looks ahead without consuming. Positions past the end yield the EOF token.
     * @param offset The distance from the current token; 0 is the current token.
     * @return The token at the given offset.
     */
    Token peek(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token and returns it. The EOF token is never consumed.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if the current token is EOF.
     */
    boolean isAtEnd();

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    boolean check(TokenType type);

    /**
     * Checks the type and value of the current token without consuming it.
     * @param type  The token type.
     * @param value The token value.
     * @return true on a match.
     */
    boolean check(TokenType type, String value);

    /**
     * @return true if the current token is an IDENTIFIER or a KEYWORD.
     */
    boolean checkWord();

    /**
     * @param value The word.
     * @return true if the current token is an IDENTIFIER or KEYWORD with the given value.
     */
    boolean checkWord(String value);

    /**
     * Consumes the current token if it has the given type and value.
     * @param type  The token type.
     * @param value The token value.
     * @return true if the token was consumed.
     */
    boolean match(TokenType type, String value);

    /**
     * Consumes a token of the given type or fails.
     * @param type The expected type.
     * @return The consumed token.
     * @throws ParseException if the current token has another type.
     */
    Token expect(TokenType type);

    /**
     * Consumes a token of the given type and value or fails.
     * @param type  The expected type.
     * @param value The expected value.
     * @return The consumed token.
     * @throws ParseException if the current token does not match.
     */
    Token expect(TokenType type, String value);

    /**
     * Consumes a name. Keywords are accepted as names ({@code input}, {@code data}, …).
     * @return The name.
     * @throws ParseException if the current token is not a word.
     */
    String expectName();

    /**
     * Consumes names up to the end of the line. Commas between them are optional.
     * @return The names in source order.
     * @throws ParseException if a token on the line is not a word.
     */
    List<String> parseNameList();

    /**
     * Skips any NEWLINE tokens.
     */
    void skipNewlines();

    /**
     * Skips the rest of the current line and any indented block nested under it.
     */
    void skipLine();

    /**
     * @return The location of the current token.
     */
    SourceLocation location();

    /**
     * Creates an error positioned at the current token. An ERROR token turns into an
     * {@code Unexpected character} error, EOF into an unexpected-end error.
     * @param message The message.
     * @return The exception, for the caller to throw.
     */
    ParseException error(String message);

    // Shared grammar

    Expression parseExpression();

    /**
     * Parses an expression that may be an assignment ({@code = += -= *= /=}).
     * @return The expression.
     */
    Expression parseAssignment();

    /**
     * Parses a property value: strings, numbers, colors, booleans, dotted names, arrays and
     * {@code {expr}}; anything else as a full expression.
     * @return The value.
     */
    Expression parseAtomicExpression();

    /**
     * Parses an expression that follows a colon, either on the same line or alone in an
     * indented block, and the line breaks after it.
     */
    Expression parseDataExpression();

    TypeExpr parseTypeExpr();

    /**
     * Parses the right-hand side of a {@code type} declaration: a union of string literals
     * ({@code "a" | "b"}) or any type expression.
     * @return The type.
     */
    TypeExpr parseTypeDefinition();

    Statement parseStatement();

    /**
     * Parses an indented block of statements. A missing INDENT yields an empty list.
     * @return The statements.
     */
    List<Statement> parseStatementBlock();

    /**
     * Parses an indented block of UI elements, keeping comments.
     * @return The elements. A missing INDENT yields an empty list.
     */
    List<AstNode> parseUiBlock();

    /**
     * Parses an indented container body, keeping comments.
     * @return The body items. A missing INDENT yields an empty list.
     */
    List<AstNode> parseBody();

    /**
     * Parses {@code name=value}, bare {@code name} and {@code @bp=value} properties up to the end
     * of the line, an INDENT/DEDENT or {@code ->}.
     * @return The properties in source order.
     */
    Map<String, Expression> parseInlineProps();

    /**
     * Like {@link #parseInlineProps()} but only accepts word properties.
     * @return The properties in source order.
     */
    Map<String, Expression> parseInlinePropsUntilArrow();

    /**
     * Parses inline properties up to a colon and, if present, the colon and an indented UI block.
     * @return The properties and the body.
     */
    GenericBlock parseGenericBlock();

    /**
     * If the current token is a colon, consumes it and parses an indented block of
     * {@code name: expr} lines.
     * @return The properties; empty if there is no colon.
     */
    Map<String, Expression> parseGenericPropsBlock();

    /**
     * Parses an indented block of {@code name: expr} lines, without a leading colon.
     * @return The properties; empty if there is no indented block.
     */
    Map<String, Expression> parsePropsBlock();

    /**
     * Runs {@code lineParser} once per logical line of an indented block, skipping blank lines and
     * comments. Does nothing if the current token is not an INDENT.
     * @param lineParser Parses exactly one line, starting at its first token.
     */
    void forEachBlockLine(Runnable lineParser);
}
