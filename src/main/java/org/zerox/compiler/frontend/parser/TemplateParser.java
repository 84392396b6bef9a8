package org.zerox.compiler.frontend.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.CompilerFrontendException;
import org.zerox.compiler.frontend.lexer.Lexer;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.expression.IdentifierExpr;
import org.zerox.compiler.frontend.parser.ast.expression.TemplateExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a string literal with {@code {expr}} segments into text and interpolated expressions.
 * <p>
 * Each segment is tokenized and parsed on its own, with token positions moved to where the
 * segment sits inside the literal. A segment that is not a single well-formed expression is
 * kept as an identifier holding its trimmed text.
 */
final class TemplateParser {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateParser.class);

    private TemplateParser() {
    }

    static boolean isTemplate(String value) {
        return value.indexOf('{') >= 0 && value.indexOf('}') >= 0;
    }

    /**
     * @param literal A STRING token whose value contains interpolation braces.
     * @return The template expression, located at the literal.
     */
    static TemplateExpr parse(Token literal) {
        String template = literal.value();
        List<TemplateExpr.Part> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();

        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c != '{') {
                text.append(c);
                i++;
                continue;
            }
            if (text.length() > 0) {
                parts.add(new TemplateExpr.Text(text.toString()));
                text.setLength(0);
            }
            int start = i + 1;
            int end = start;
            int depth = 1;
            while (end < template.length()) {
                char inner = template.charAt(end);
                if (inner == '{') {
                    depth++;
                } else if (inner == '}' && --depth == 0) {
                    break;
                }
                end++;
            }
            parts.add(new TemplateExpr.Interpolation(parseSegment(template.substring(start, end), literal, start)));
            i = end + 1;
        }
        if (text.length() > 0) {
            parts.add(new TemplateExpr.Text(text.toString()));
        }
        return new TemplateExpr(literal.location(), parts);
    }

    private static Expression parseSegment(String segment, Token literal, int offset) {
        String source = segment.strip();
        int shift = offset + segment.indexOf(source);
        SourceLocation location = new SourceLocation(literal.line(), literal.column() + 1 + shift);
        if (source.isEmpty()) {
            return new IdentifierExpr(location, source);
        }

        try {
            List<Token> tokens = new Lexer(source).scanTokens().stream()
                    .map(token -> new Token(token.type(), token.value(), literal.line(), literal.column() + shift + token.column()))
                    .toList();
            Parser parser = new Parser(tokens);
            Expression expression = parser.parseExpression();
            parser.skipNewlines();
            if (!parser.isAtEnd()) {
                LOG.debug("Template segment '{}' at {} has trailing tokens, keeping it as a name", source, location);
                return new IdentifierExpr(location, source);
            }
            return expression;
        } catch (CompilerFrontendException e) {
            LOG.debug("Template segment '{}' at {} is not an expression, keeping it as a name: {}", source, location, e.getDetail());
            return new IdentifierExpr(location, source);
        }
    }
}
