package org.zerox.compiler.frontend.parser.features.data;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.expression.NullLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Handlers for data declarations: <code>model</code> at the top level, and <code>data</code>,
 * <code>form</code>, <code>realtime</code> and <code>emit</code> inside a container.
 */
public final class DataHandlers {

    private DataHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.TOP_LEVEL, "model", DataHandlers::parseModel);
        registry.register(KeywordScope.BODY, "data", DataHandlers::parseData);
        registry.register(KeywordScope.BODY, "form", DataHandlers::parseForm);
        registry.register(KeywordScope.BODY, "realtime", DataHandlers::parseRealtime);
        registry.register(KeywordScope.BODY, "emit", DataHandlers::parseEmit);
    }

    // region model

    /**
     * Parses a model.
     * Expected format:
     * <pre>
     * model User:
     *   name: str
     *   age: int = 0
     *   validate:
     *     age &gt;= 0 "Age must not be negative"
     *   permission:
     *     delete: admin
     *   search: name, email
     * </pre>
     */
    static ModelNode parseModel(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "model").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<ModelNode.Field> fields = new ArrayList<>();
        List<ModelNode.Validation> validations = new ArrayList<>();
        List<ModelNode.Permission> permissions = new ArrayList<>();
        List<String> search = new ArrayList<>();
        List<String> sort = new ArrayList<>();
        List<String> filter = new ArrayList<>();

        context.forEachBlockLine(() -> {
            if (context.match(TokenType.KEYWORD, "validate")) {
                context.expect(TokenType.PUNCTUATION, ":");
                context.skipNewlines();
                context.forEachBlockLine(() -> {
                    Expression condition = context.parseExpression();
                    validations.add(new ModelNode.Validation(condition, context.expect(TokenType.STRING).value()));
                });
            } else if (context.match(TokenType.KEYWORD, "permission")) {
                context.expect(TokenType.PUNCTUATION, ":");
                context.skipNewlines();
                context.forEachBlockLine(() -> {
                    String action = context.expectName();
                    context.expect(TokenType.PUNCTUATION, ":");
                    permissions.add(new ModelNode.Permission(action, context.expectName()));
                });
            } else if (isListOption(context, "search")) {
                search.addAll(parseListOption(context));
            } else if (isListOption(context, "sort")) {
                sort.addAll(parseListOption(context));
            } else if (isListOption(context, "filter")) {
                filter.addAll(parseListOption(context));
            } else {
                String fieldName = context.expectName();
                context.expect(TokenType.PUNCTUATION, ":");
                TypeExpr type = context.parseTypeExpr();
                Expression defaultValue = null;
                if (context.match(TokenType.OPERATOR, "=")) {
                    defaultValue = context.parseExpression();
                }
                fields.add(new ModelNode.Field(fieldName, type, defaultValue));
            }
        });
        return new ModelNode(location, name, fields, validations, permissions, search, sort, filter);
    }

    private static boolean isListOption(ParsingContext context, String option) {
        return context.checkWord(option) && context.peek(1).is(TokenType.PUNCTUATION, ":");
    }

    /**
     * Consumes {@code option: a, b, c} up to the end of the line.
     */
    private static List<String> parseListOption(ParsingContext context) {
        context.advance();
        context.advance();
        return context.parseNameList();
    }

    // endregion

    /**
     * Expected format: {@code data name = query[:]} with an optional block of
     * {@code loading: expr}, {@code error: "msg"} and {@code empty: "msg"}.
     */
    static DataDeclNode parseData(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "data").location();
        String name = context.expectName();
        context.expect(TokenType.OPERATOR, "=");
        Expression query = context.parseExpression();

        Expression[] loading = {null};
        String[] messages = {null, null};
        if (context.match(TokenType.PUNCTUATION, ":")) {
            context.skipNewlines();
            context.forEachBlockLine(() -> {
                String key = context.expectName();
                context.expect(TokenType.PUNCTUATION, ":");
                switch (key) {
                    case "loading" -> loading[0] = context.parseExpression();
                    case "error" -> messages[0] = context.expect(TokenType.STRING).value();
                    case "empty" -> messages[1] = context.expect(TokenType.STRING).value();
                    default -> context.skipLine();
                }
            });
        }
        return new DataDeclNode(location, name, query, loading[0], messages[0], messages[1]);
    }

    // region form

    static FormDeclNode parseForm(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "form").location();
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<FormDeclNode.FormField> fields = new ArrayList<>();
        FormDeclNode.FormSubmit[] submit = {null};
        context.forEachBlockLine(() -> {
            if (context.check(TokenType.KEYWORD, "field")) {
                fields.add(parseFormField(context));
            } else if (context.check(TokenType.KEYWORD, "submit")) {
                submit[0] = parseFormSubmit(context);
            } else {
                context.skipLine();
            }
        });
        return new FormDeclNode(location, name, fields, submit[0]);
    }

    /**
     * Expected format: {@code field name: Type} with an optional block of {@code label: "..."},
     * {@code required: "msg"}, {@code min: expr "msg"}, {@code max: expr "msg"},
     * {@code format: name "msg"}, {@code pattern: "regex" "msg"} and {@code key: expr} lines.
     */
    private static FormDeclNode.FormField parseFormField(ParsingContext context) {
        context.expect(TokenType.KEYWORD, "field");
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        TypeExpr type = context.parseTypeExpr();
        context.skipNewlines();

        String[] label = {name};
        List<FormDeclNode.FormValidation> validations = new ArrayList<>();
        Map<String, Expression> props = Props.builder();
        context.forEachBlockLine(() -> {
            String key = context.expectName();
            context.expect(TokenType.PUNCTUATION, ":");
            switch (key) {
                case "label" -> label[0] = context.expect(TokenType.STRING).value();
                case "required" -> validations.add(new FormDeclNode.FormValidation(
                        key, null, context.expect(TokenType.STRING).value()));
                case "min", "max" -> {
                    Expression bound = context.parseExpression();
                    validations.add(new FormDeclNode.FormValidation(key, bound, context.expect(TokenType.STRING).value()));
                }
                case "format" -> {
                    SourceLocation formatLocation = context.location();
                    Expression format = new StringLiteral(formatLocation, context.expectName());
                    validations.add(new FormDeclNode.FormValidation(key, format, context.expect(TokenType.STRING).value()));
                }
                case "pattern" -> {
                    SourceLocation patternLocation = context.location();
                    Expression pattern = new StringLiteral(patternLocation, context.expect(TokenType.STRING).value());
                    validations.add(new FormDeclNode.FormValidation(key, pattern, context.expect(TokenType.STRING).value()));
                }
                default -> props.put(key, context.parseExpression());
            }
        });
        return new FormDeclNode.FormField(name, type, label[0], validations, props);
    }

    private static FormDeclNode.FormSubmit parseFormSubmit(ParsingContext context) {
        context.expect(TokenType.KEYWORD, "submit");
        String label = context.expect(TokenType.STRING).value();
        context.expect(TokenType.OPERATOR, "->");
        Expression action = context.parseExpression();

        Expression[] outcomes = {null, null};
        if (context.match(TokenType.PUNCTUATION, ":")) {
            context.skipNewlines();
            context.forEachBlockLine(() -> {
                String key = context.expectName();
                context.expect(TokenType.PUNCTUATION, ":");
                Expression reaction = context.parseExpression();
                if (key.equals("success")) {
                    outcomes[0] = reaction;
                } else if (key.equals("error")) {
                    outcomes[1] = reaction;
                }
            });
        }
        return new FormDeclNode.FormSubmit(label, action, outcomes[0], outcomes[1]);
    }

    // endregion

    /**
     * Expected format: {@code realtime name = subscribe(channel)[:]} with an optional block of
     * {@code on event:} handlers. A handler is a statement block or a single statement on the next line.
     */
    static RealtimeDeclNode parseRealtime(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "realtime").location();
        String name = context.expectName();
        context.expect(TokenType.OPERATOR, "=");

        Expression channel;
        if (context.checkWord("subscribe") && context.peek(1).is(TokenType.PUNCTUATION, "(")) {
            context.advance();
            context.advance();
            channel = context.parseExpression();
            context.expect(TokenType.PUNCTUATION, ")");
        } else {
            channel = context.parseExpression();
        }

        List<RealtimeDeclNode.Handler> handlers = new ArrayList<>();
        if (context.match(TokenType.PUNCTUATION, ":")) {
            context.skipNewlines();
            context.forEachBlockLine(() -> {
                if (!context.match(TokenType.KEYWORD, "on")) {
                    context.skipLine();
                    return;
                }
                String event = context.expectName();
                context.expect(TokenType.PUNCTUATION, ":");
                context.skipNewlines();
                List<Statement> body = context.check(TokenType.INDENT)
                        ? context.parseStatementBlock()
                        : List.of(context.parseStatement());
                handlers.add(new RealtimeDeclNode.Handler(event, body));
            });
        }
        return new RealtimeDeclNode(location, name, channel, handlers);
    }

    /**
     * Expected format: {@code emit channel [key=value]...}.
     */
    static EmitNode parseEmit(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "emit").location();
        Expression channel = context.parseExpression();
        Map<String, Expression> props = Props.builder();
        while (context.checkWord() && context.peek(1).is(TokenType.OPERATOR, "=")) {
            String key = context.advance().value();
            context.advance();
            props.put(key, context.parseAtomicExpression());
        }
        Expression data = props.get("data");
        if (data == null) {
            data = new NullLiteral(location);
        }
        return new EmitNode(location, channel, data, props);
    }
}
