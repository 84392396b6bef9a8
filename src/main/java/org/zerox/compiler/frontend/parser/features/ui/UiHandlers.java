package org.zerox.compiler.frontend.parser.features.ui;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.ArrayExpr;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handlers for the basic UI elements: layouts, text, buttons, form controls, links, images and
 * component calls.
 */
public final class UiHandlers {

    private static final Set<String> DIRECTIONS = Set.of("row", "col", "grid", "stack");

    private UiHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.UI, "layout", UiHandlers::parseLayout);
        registry.register(KeywordScope.UI, "text", UiHandlers::parseText);
        registry.register(KeywordScope.UI, "button", UiHandlers::parseButton);
        registry.register(KeywordScope.UI, "input", UiHandlers::parseInput);
        registry.register(KeywordScope.UI, "image", UiHandlers::parseImage);
        registry.register(KeywordScope.UI, "link", UiHandlers::parseLink);
        registry.register(KeywordScope.UI, "toggle", UiHandlers::parseToggle);
        registry.register(KeywordScope.UI, "select", UiHandlers::parseSelect);
        registry.register(KeywordScope.UI, "component", UiHandlers::parseComponentCall);
    }

    /**
     * Expected format: {@code layout [row|col|grid|stack] [.class] [name[=value]]... [{expr}]:}
     * followed by an indented UI block. The direction defaults to {@code col}.
     */
    static LayoutNode parseLayout(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "layout").location();
        String direction = "col";
        if (context.check(TokenType.KEYWORD) && DIRECTIONS.contains(context.peek().value())) {
            direction = context.advance().value();
        }

        Map<String, Expression> props = Props.builder();
        String styleClass = null;
        while (!context.check(TokenType.PUNCTUATION, ":") && !context.check(TokenType.NEWLINE) && !context.isAtEnd()) {
            if (context.check(TokenType.STYLE_CLASS)) {
                styleClass = context.advance().value().substring(1);
            } else if (context.checkWord()) {
                SourceLocation propLocation = context.location();
                String name = context.advance().value();
                if (context.match(TokenType.OPERATOR, "=")) {
                    props.put(name, context.parseAtomicExpression());
                } else {
                    props.put(name, new BooleanLiteral(propLocation, true));
                }
            } else if (context.check(TokenType.PUNCTUATION, "{")) {
                props.put("_dynamic", context.parseAtomicExpression());
            } else {
                break;
            }
        }

        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new LayoutNode(location, direction, props, styleClass, context.parseUiBlock());
    }

    static TextNode parseText(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "text").location();
        Expression content = context.parseExpression();
        return new TextNode(location, content, context.parseInlineProps());
    }

    /**
     * Expected format: {@code button LABEL [props] [-> action]}, where the action may be an
     * assignment such as {@code count += 1}.
     */
    static ButtonNode parseButton(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "button").location();
        Expression label = context.parseAtomicExpression();
        Map<String, Expression> props = context.parseInlinePropsUntilArrow();
        Expression action = null;
        if (context.match(TokenType.OPERATOR, "->")) {
            action = context.parseAssignment();
        }
        return new ButtonNode(location, label, action, props);
    }

    static InputNode parseInput(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "input").location();
        String binding = context.expectName();
        return new InputNode(location, binding, context.parseInlineProps());
    }

    static ImageNode parseImage(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "image").location();
        Expression src = context.parseAtomicExpression();
        return new ImageNode(location, src, context.parseInlineProps());
    }

    static LinkNode parseLink(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "link").location();
        Expression label = context.parseAtomicExpression();
        Map<String, Expression> props = context.parseInlineProps();
        Expression href = props.get("href");
        if (href == null) {
            href = new StringLiteral(location, "#");
        }
        return new LinkNode(location, label, href, props);
    }

    static ToggleNode parseToggle(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "toggle").location();
        StringBuilder binding = new StringBuilder();
        if (context.checkWord()) {
            binding.append(context.advance().value());
            while (context.match(TokenType.PUNCTUATION, ".")) {
                binding.append('.').append(context.expectName());
            }
        }
        return new ToggleNode(location, binding.toString(), context.parseInlineProps());
    }

    static SelectNode parseSelect(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "select").location();
        String binding = context.expectName();
        Map<String, Expression> props = context.parseInlineProps();
        Expression options = props.get("options");
        if (options == null) {
            options = new ArrayExpr(location, List.of());
        }
        return new SelectNode(location, binding, options, props);
    }

    /**
     * Expected format: {@code [component] Name[(arg, name=value, ...)][:]}. The leading keyword is
     * optional because an identifier followed by {@code (} in a UI block is dispatched here too.
     * A trailing colon opens an indented block of slot content.
     */
    static ComponentCallNode parseComponentCall(ParsingContext context) {
        SourceLocation location = context.location();
        context.match(TokenType.KEYWORD, "component");
        String name = context.expectName();

        Map<String, Expression> args = Props.builder();
        if (context.match(TokenType.PUNCTUATION, "(")) {
            int position = 0;
            while (!context.check(TokenType.PUNCTUATION, ")")) {
                if (context.checkWord() && context.peek(1).is(TokenType.OPERATOR, "=")) {
                    String argName = context.advance().value();
                    context.advance();
                    args.put(argName, context.parseAtomicExpression());
                } else {
                    args.put("_arg" + position++, context.parseExpression());
                }
                if (!context.match(TokenType.PUNCTUATION, ",")) {
                    break;
                }
            }
            context.expect(TokenType.PUNCTUATION, ")");
        }

        List<AstNode> children = List.of();
        if (context.match(TokenType.PUNCTUATION, ":")) {
            context.skipNewlines();
            children = context.parseUiBlock();
        }
        return new ComponentCallNode(location, name, args, children);
    }
}
