package org.zerox.compiler.frontend.parser;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.ConditionalBranch;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The {@code if/elif/else} and {@code for} grammar shared by UI blocks and statement blocks.
 * The caller supplies the block parser; the result parts are turned into the matching node.
 */
public final class ControlFlowParser {

    private ControlFlowParser() {
    }

    /**
     * The parts of an {@code if} chain.
     *
     * @param location  The position of {@code if}.
     * @param condition The first condition.
     * @param body      The first branch.
     * @param elifs     The {@code elif} branches.
     * @param elseBody  The {@code else} branch, or {@code null}.
     * @param <T>       The kind of block item.
     */
    public record IfParts<T extends AstNode>(
            SourceLocation location,
            Expression condition,
            List<T> body,
            List<ConditionalBranch<T>> elifs,
            List<T> elseBody
    ) {
    }

    /**
     * The parts of a {@code for} loop.
     *
     * @param location The position of {@code for}.
     * @param item     The loop variable.
     * @param index    The index variable, or {@code null}.
     * @param iterable The iterated expression.
     * @param body     The loop body.
     * @param <T>      The kind of block item.
     */
    public record ForParts<T extends AstNode>(
            SourceLocation location,
            String item,
            String index,
            Expression iterable,
            List<T> body
    ) {
    }

    /**
     * Parses {@code if cond: block [elif cond: block]* [else: block]}, starting at {@code if}.
     *
     * @param context The parsing context.
     * @param block   Parses an indented block.
     * @param inline  Parses a single item on the same line as the colon ({@code if x: stmt});
     *                {@code null} if the single-line form is not allowed.
     * @param <T>     The kind of block item.
     * @return The parsed parts. A single-line form has no branches.
     */
    public static <T extends AstNode> IfParts<T> parseIf(ParsingContext context, Supplier<List<T>> block, Supplier<T> inline) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "if").location();
        Expression condition = context.parseExpression();
        if (!context.match(TokenType.PUNCTUATION, ":")) {
            throw context.error("Expected ':' after if condition");
        }
        if (inline != null && !context.check(TokenType.NEWLINE) && !context.check(TokenType.COMMENT)
                && !context.check(TokenType.INDENT) && !context.isAtEnd()) {
            return new IfParts<>(location, condition, List.of(inline.get()), List.of(), null);
        }
        context.skipNewlines();
        List<T> body = block.get();

        List<ConditionalBranch<T>> elifs = new ArrayList<>();
        while (context.match(TokenType.KEYWORD, "elif")) {
            Expression elifCondition = context.parseExpression();
            context.expect(TokenType.PUNCTUATION, ":");
            context.skipNewlines();
            elifs.add(new ConditionalBranch<>(elifCondition, block.get()));
        }

        List<T> elseBody = null;
        if (context.match(TokenType.KEYWORD, "else")) {
            context.expect(TokenType.PUNCTUATION, ":");
            context.skipNewlines();
            elseBody = block.get();
        }
        return new IfParts<>(location, condition, body, elifs, elseBody);
    }

    /**
     * Parses {@code for item[, index] in iterable: block}, starting at {@code for}.
     *
     * @param context The parsing context.
     * @param block   Parses the indented body.
     * @param <T>     The kind of block item.
     * @return The parsed parts.
     */
    public static <T extends AstNode> ForParts<T> parseFor(ParsingContext context, Supplier<List<T>> block) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "for").location();
        String item = context.expectName();
        String index = null;
        if (context.match(TokenType.PUNCTUATION, ",")) {
            index = context.expectName();
        }
        context.expect(TokenType.KEYWORD, "in");
        Expression iterable = context.parseExpression();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new ForParts<>(location, item, index, iterable, block.get());
    }
}
