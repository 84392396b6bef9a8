package org.zerox.compiler.frontend.parser;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.lexer.Keywords;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ast.expression.ArrayExpr;
import org.zerox.compiler.frontend.parser.ast.expression.ArrowExpr;
import org.zerox.compiler.frontend.parser.ast.expression.AssignmentExpr;
import org.zerox.compiler.frontend.parser.ast.expression.AwaitExpr;
import org.zerox.compiler.frontend.parser.ast.expression.BinaryExpr;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.BracedExpr;
import org.zerox.compiler.frontend.parser.ast.expression.CallExpr;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.expression.IdentifierExpr;
import org.zerox.compiler.frontend.parser.ast.expression.IndexExpr;
import org.zerox.compiler.frontend.parser.ast.expression.MemberExpr;
import org.zerox.compiler.frontend.parser.ast.expression.NullLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.NumberLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.ObjectExpr;
import org.zerox.compiler.frontend.parser.ast.expression.OldExpr;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.TernaryExpr;
import org.zerox.compiler.frontend.parser.ast.expression.UnaryExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses expressions by precedence climbing:
 * ternary, {@code ||}, {@code &&}, equality, comparison, additive, multiplicative, unary, postfix, primary.
 */
final class ExpressionParser {

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=");

    private final ParsingContext context;

    ExpressionParser(ParsingContext context) {
        this.context = context;
    }

    Expression parseExpression() {
        return parseTernary();
    }

    /**
     * Assignment is right-associative: {@code a = b = c} assigns {@code b = c} to {@code a}.
     */
    Expression parseAssignment() {
        Expression target = parseExpression();
        if (isAssignmentOperator(context.peek())) {
            String op = context.advance().value();
            Expression value = parseAssignment();
            return new AssignmentExpr(target.location(), target, op, value);
        }
        return target;
    }

    static boolean isAssignmentOperator(Token token) {
        return token.type() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(token.value());
    }

    private Expression parseTernary() {
        Expression condition = parseOr();
        if (context.match(TokenType.PUNCTUATION, "?")) {
            Expression consequent = parseExpression();
            context.expect(TokenType.PUNCTUATION, ":");
            Expression alternate = parseExpression();
            return new TernaryExpr(condition.location(), condition, consequent, alternate);
        }
        return condition;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (context.check(TokenType.OPERATOR, "||")) {
            String op = context.advance().value();
            left = new BinaryExpr(left.location(), op, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (context.check(TokenType.OPERATOR, "&&")) {
            String op = context.advance().value();
            left = new BinaryExpr(left.location(), op, left, parseEquality());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseComparison();
        while (checkOperator("==", "!=")) {
            String op = context.advance().value();
            left = new BinaryExpr(left.location(), op, left, parseComparison());
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();
        while (checkOperator(">", "<", ">=", "<=")) {
            String op = context.advance().value();
            left = new BinaryExpr(left.location(), op, left, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (checkOperator("+", "-")) {
            String op = context.advance().value();
            left = new BinaryExpr(left.location(), op, left, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (checkOperator("*", "/", "%")) {
            String op = context.advance().value();
            left = new BinaryExpr(left.location(), op, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        SourceLocation location = context.location();
        if (checkOperator("!", "-")) {
            String op = context.advance().value();
            return new UnaryExpr(location, op, parseUnary());
        }
        if (context.match(TokenType.KEYWORD, "await")) {
            return new AwaitExpr(location, parseUnary());
        }
        if (context.checkWord("old") && context.peek(1).is(TokenType.PUNCTUATION, "(")) {
            context.advance();
            context.advance();
            Expression inner = parseExpression();
            context.expect(TokenType.PUNCTUATION, ")");
            return new OldExpr(location, inner);
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        while (true) {
            if (context.match(TokenType.PUNCTUATION, ".")) {
                expr = new MemberExpr(expr.location(), expr, propertyName());
            } else if (context.match(TokenType.PUNCTUATION, "[")) {
                Expression index = parseExpression();
                context.expect(TokenType.PUNCTUATION, "]");
                expr = new IndexExpr(expr.location(), expr, index);
            } else if (context.match(TokenType.PUNCTUATION, "(")) {
                expr = new CallExpr(expr.location(), expr, parseArguments());
            } else {
                return expr;
            }
        }
    }

    /**
     * Parses call arguments after the opening parenthesis, through the closing one.
     * A run of {@code name: value} pairs becomes one object argument.
     */
    private List<Expression> parseArguments() {
        List<Expression> args = new ArrayList<>();
        while (!context.check(TokenType.PUNCTUATION, ")") && !context.isAtEnd()) {
            if (context.checkWord() && context.peek(1).is(TokenType.PUNCTUATION, ":")) {
                args.add(parseNamedArguments());
                break;
            }
            args.add(parseArgument());
            context.match(TokenType.PUNCTUATION, ",");
        }
        context.expect(TokenType.PUNCTUATION, ")");
        return args;
    }

    private ObjectExpr parseNamedArguments() {
        SourceLocation location = context.location();
        List<ObjectExpr.Property> properties = new ArrayList<>();
        while (!context.check(TokenType.PUNCTUATION, ")") && !context.isAtEnd()) {
            String key = context.expectName();
            context.expect(TokenType.PUNCTUATION, ":");
            properties.add(new ObjectExpr.Property(key, parseExpression()));
            context.match(TokenType.PUNCTUATION, ",");
        }
        return new ObjectExpr(location, properties);
    }

    /**
     * An argument may be an arrow function: {@code x => expr}, {@code (a, b) => expr} or {@code () => expr}.
     */
    private Expression parseArgument() {
        Expression expr = parseExpression();
        if (context.match(TokenType.OPERATOR, "=>")) {
            List<String> params = new ArrayList<>();
            if (expr instanceof IdentifierExpr identifier) {
                params.add(identifier.name());
            } else if (expr instanceof ArrayExpr tuple) {
                for (Expression element : tuple.elements()) {
                    if (element instanceof IdentifierExpr identifier) {
                        params.add(identifier.name());
                    }
                }
            }
            return new ArrowExpr(expr.location(), params, parseExpression());
        }
        return expr;
    }

    private Expression parsePrimary() {
        Token token = context.peek();
        SourceLocation location = token.location();

        Expression literal = parseLiteral(token);
        if (literal != null) {
            return literal;
        }

        if (isNameToken(token)) {
            context.advance();
            return new IdentifierExpr(location, token.value());
        }

        if (context.match(TokenType.PUNCTUATION, "(")) {
            return parseParenthesized(location);
        }

        if (token.is(TokenType.PUNCTUATION, "[")) {
            return parseArrayLiteral();
        }

        if (context.match(TokenType.PUNCTUATION, "{")) {
            return parseObjectLiteral(location);
        }

        throw context.error("Unexpected token '" + token.value() + "' (" + token.type() + ")");
    }

    /**
     * {@code ()} is an empty array and {@code (a, b)} a tuple array.
     */
    private Expression parseParenthesized(SourceLocation location) {
        if (context.match(TokenType.PUNCTUATION, ")")) {
            return new ArrayExpr(location, List.of());
        }
        Expression first = parseExpression();
        if (context.check(TokenType.PUNCTUATION, ",")) {
            List<Expression> elements = new ArrayList<>();
            elements.add(first);
            while (context.match(TokenType.PUNCTUATION, ",")) {
                if (context.check(TokenType.PUNCTUATION, ")")) {
                    break;
                }
                elements.add(parseExpression());
            }
            context.expect(TokenType.PUNCTUATION, ")");
            return new ArrayExpr(location, elements);
        }
        context.expect(TokenType.PUNCTUATION, ")");
        return first;
    }

    private ArrayExpr parseArrayLiteral() {
        SourceLocation location = context.expect(TokenType.PUNCTUATION, "[").location();
        List<Expression> elements = new ArrayList<>();
        int depth = skipLayout(0);
        while (!context.check(TokenType.PUNCTUATION, "]") && !context.isAtEnd()) {
            elements.add(parseExpression());
            context.match(TokenType.PUNCTUATION, ",");
            depth = skipLayout(depth);
        }
        context.expect(TokenType.PUNCTUATION, "]");
        return new ArrayExpr(location, elements);
    }

    private ObjectExpr parseObjectLiteral(SourceLocation location) {
        List<ObjectExpr.Property> properties = new ArrayList<>();
        int depth = skipLayout(0);
        while (!context.check(TokenType.PUNCTUATION, "}") && !context.isAtEnd()) {
            if (!context.checkWord() && !context.check(TokenType.STRING)) {
                throw context.error("Expected property name, got " + context.peek().type() + " '" + context.peek().value() + "'");
            }
            Token key = context.advance();
            if (context.match(TokenType.PUNCTUATION, ":")) {
                properties.add(new ObjectExpr.Property(key.value(), parseExpression()));
            } else {
                // {name} is short for {name: name}
                properties.add(new ObjectExpr.Property(key.value(), new IdentifierExpr(key.location(), key.value())));
            }
            context.match(TokenType.PUNCTUATION, ",");
            depth = skipLayout(depth);
        }
        context.expect(TokenType.PUNCTUATION, "}");
        return new ObjectExpr(location, properties);
    }

    /**
     * Skips line breaks and comments inside brackets, together with the INDENT and DEDENT tokens
     * of continuation lines. Only DEDENTs that close an INDENT skipped here are consumed.
     * @param depth The number of INDENTs skipped so far inside the brackets.
     * @return The updated depth.
     */
    private int skipLayout(int depth) {
        int open = depth;
        while (true) {
            if (context.check(TokenType.NEWLINE) || context.check(TokenType.COMMENT)) {
                context.advance();
            } else if (context.check(TokenType.INDENT)) {
                context.advance();
                open++;
            } else if (context.check(TokenType.DEDENT) && open > 0) {
                context.advance();
                open--;
            } else {
                return open;
            }
        }
    }

    Expression parseAtomicExpression() {
        Token token = context.peek();
        SourceLocation location = token.location();

        Expression literal = parseLiteral(token);
        if (literal != null) {
            return literal;
        }

        if (isNameToken(token)) {
            context.advance();
            Expression expr = new IdentifierExpr(location, token.value());
            while (context.match(TokenType.PUNCTUATION, ".")) {
                expr = new MemberExpr(location, expr, propertyName());
            }
            return expr;
        }

        if (token.is(TokenType.PUNCTUATION, "[")) {
            return parseArrayLiteral();
        }

        if (context.match(TokenType.PUNCTUATION, "{")) {
            Expression inner = parseExpression();
            context.expect(TokenType.PUNCTUATION, "}");
            return new BracedExpr(location, inner);
        }

        return parseExpression();
    }

    /**
     * Consumes a number, string, color, boolean or null literal.
     * @return The literal, or {@code null} if the token is none of these.
     */
    private Expression parseLiteral(Token token) {
        SourceLocation location = token.location();
        switch (token.type()) {
            case NUMBER -> {
                context.advance();
                return new NumberLiteral(location, Double.parseDouble(token.value()));
            }
            case STRING -> {
                context.advance();
                if (TemplateParser.isTemplate(token.value())) {
                    return TemplateParser.parse(token);
                }
                return new StringLiteral(location, token.value());
            }
            case COLOR -> {
                context.advance();
                return new StringLiteral(location, token.value());
            }
            case KEYWORD -> {
                switch (token.value()) {
                    case "true" -> {
                        context.advance();
                        return new BooleanLiteral(location, true);
                    }
                    case "false" -> {
                        context.advance();
                        return new BooleanLiteral(location, false);
                    }
                    case "null" -> {
                        context.advance();
                        return new NullLiteral(location);
                    }
                    default -> {
                        return null;
                    }
                }
            }
            default -> {
                return null;
            }
        }
    }

    /**
     * Identifiers, and keywords that do not open a construct ({@code error}, {@code data}, …).
     */
    private static boolean isNameToken(Token token) {
        return token.type() == TokenType.IDENTIFIER
                || (token.type() == TokenType.KEYWORD && !Keywords.isStructural(token.value()));
    }

    private String propertyName() {
        Token token = context.peek();
        if (token.isWord() || token.type() == TokenType.NUMBER || token.type() == TokenType.HTTP_METHOD) {
            return context.advance().value();
        }
        throw context.error("Expected property name after '.', got " + token.type() + " '" + token.value() + "'");
    }

    private boolean checkOperator(String... operators) {
        for (String op : operators) {
            if (context.check(TokenType.OPERATOR, op)) {
                return true;
            }
        }
        return false;
    }
}
