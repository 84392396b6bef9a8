package org.zerox.compiler.frontend.parser.features.display;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.ArrayExpr;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.expression.IdentifierExpr;
import org.zerox.compiler.frontend.parser.ast.expression.NumberLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.StringLiteral;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handlers for data display elements: tables, charts, key figures, uploads, modals and toasts.
 */
public final class DisplayHandlers {

    private static final Set<String> CHART_TYPES = Set.of("bar", "line", "pie", "doughnut", "area", "radar", "scatter");

    private DisplayHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.UI, "table", DisplayHandlers::parseTable);
        registry.register(KeywordScope.UI, "chart", DisplayHandlers::parseChart);
        registry.register(KeywordScope.UI, "stat", DisplayHandlers::parseStat);
        registry.register(KeywordScope.UI, "stats", DisplayHandlers::parseStatsGrid);
        registry.register(KeywordScope.UI, "upload", DisplayHandlers::parseUpload);
        registry.register(KeywordScope.UI, "modal", DisplayHandlers::parseModal);
        registry.register(KeywordScope.UI, "toast", DisplayHandlers::parseToast);
    }

    // region table

    static TableNode parseTable(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "table").location();
        String dataSource = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();

        List<TableNode.Column> columns = new ArrayList<>();
        Map<String, Expression> features = Props.builder();
        context.forEachBlockLine(() -> {
            if (context.checkWord("features") && context.peek(1).is(TokenType.PUNCTUATION, ":")) {
                context.advance();
                context.advance();
                context.skipNewlines();
                features.putAll(context.parsePropsBlock());
            } else if (context.checkWord("columns") && context.peek(1).is(TokenType.PUNCTUATION, ":")) {
                context.advance();
                context.advance();
                context.skipNewlines();
                context.forEachBlockLine(() -> parseColumnLine(context, columns));
            } else {
                parseColumnLine(context, columns);
            }
        });
        return new TableNode(location, dataSource, columns, features);
    }

    private static void parseColumnLine(ParsingContext context, List<TableNode.Column> columns) {
        if (context.match(TokenType.KEYWORD, "column")) {
            columns.add(parseFieldColumn(context));
        } else if (context.checkWord("select")) {
            context.advance();
            columns.add(new TableNode.SelectColumn());
        } else if (context.checkWord("actions")) {
            context.advance();
            context.expect(TokenType.PUNCTUATION, ":");
            columns.add(new TableNode.ActionsColumn(actionNames(context.parseExpression())));
        } else {
            context.skipLine();
        }
    }

    private static TableNode.FieldColumn parseFieldColumn(ParsingContext context) {
        String label = context.expect(TokenType.STRING).value();
        StringBuilder field = new StringBuilder(context.expectName());
        while (context.match(TokenType.PUNCTUATION, ".")) {
            field.append('.').append(context.expectName());
        }

        boolean sortable = false;
        boolean searchable = false;
        boolean filterable = false;
        String format = null;
        while (!context.check(TokenType.NEWLINE) && !context.check(TokenType.DEDENT) && !context.isAtEnd()) {
            String modifier = context.expectName();
            switch (modifier) {
                case "sortable" -> sortable = true;
                case "searchable" -> searchable = true;
                case "filterable" -> filterable = true;
                case "format" -> {
                    context.expect(TokenType.OPERATOR, "=");
                    format = context.expectName();
                    if (context.match(TokenType.PUNCTUATION, "(")) {
                        format = format + "(" + context.expectName() + ")";
                        context.expect(TokenType.PUNCTUATION, ")");
                    }
                }
                default -> {
                    // unknown modifiers are ignored
                }
            }
        }
        return new TableNode.FieldColumn(field.toString(), label, sortable, searchable, filterable, format);
    }

    private static List<String> actionNames(Expression actions) {
        List<String> names = new ArrayList<>();
        if (actions instanceof ArrayExpr array) {
            for (Expression element : array.elements()) {
                if (element instanceof IdentifierExpr identifier) {
                    names.add(identifier.name());
                } else if (element instanceof StringLiteral string) {
                    names.add(string.value());
                }
            }
        }
        return names;
    }

    // endregion

    /**
     * Expected format: {@code chart [type] name:} followed by a block of {@code key: expr} lines.
     */
    static ChartNode parseChart(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "chart").location();
        String chartType = "bar";
        if (context.checkWord() && CHART_TYPES.contains(context.peek().value())) {
            chartType = context.advance().value();
        }
        String name = context.expectName();
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new ChartNode(location, chartType, name, context.parsePropsBlock());
    }

    static StatNode parseStat(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "stat").location();
        String label = context.expect(TokenType.STRING).value();

        Expression value = new NumberLiteral(location, 0);
        Expression change = null;
        String icon = null;
        Map<String, Expression> props = Props.builder();
        while (context.checkWord()) {
            SourceLocation keyLocation = context.location();
            String key = context.advance().value();
            if (!context.match(TokenType.OPERATOR, "=")) {
                props.put(key, new BooleanLiteral(keyLocation, true));
                continue;
            }
            Expression expression = context.parseAtomicExpression();
            switch (key) {
                case "value" -> value = expression;
                case "change" -> change = expression;
                case "icon" -> icon = expression instanceof StringLiteral string ? string.value() : null;
                default -> props.put(key, expression);
            }
        }
        return new StatNode(location, label, value, change, icon, props);
    }

    /**
     * Expected format: {@code stats [cols][:]} followed by a block of {@code stat} lines. Other lines
     * are skipped.
     */
    static StatsGridNode parseStatsGrid(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "stats").location();
        int cols = 4;
        if (context.check(TokenType.NUMBER)) {
            cols = (int) Double.parseDouble(context.advance().value());
        }
        if (context.match(TokenType.PUNCTUATION, ":")) {
            context.skipNewlines();
        }
        List<StatNode> stats = new ArrayList<>();
        context.forEachBlockLine(() -> {
            if (context.check(TokenType.KEYWORD, "stat")) {
                stats.add(parseStat(context));
            } else {
                context.skipLine();
            }
        });
        return new StatsGridNode(location, cols, stats);
    }

    /**
     * Expected format: {@code upload name[:]} with an optional block of {@code accept: "mime"},
     * {@code maxSize: number}, {@code preview[: true|false]} and {@code action: expr}.
     */
    static UploadNode parseUpload(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "upload").location();
        String name = context.expectName();

        UploadSettings settings = new UploadSettings();
        if (context.match(TokenType.PUNCTUATION, ":")) {
            context.skipNewlines();
            context.forEachBlockLine(() -> parseUploadSetting(context, settings));
        }
        return new UploadNode(location, name, settings.accept, settings.maxSize, settings.preview, settings.action);
    }

    private static final class UploadSettings {
        private String accept;
        private Double maxSize;
        private boolean preview;
        private Expression action;
    }

    private static void parseUploadSetting(ParsingContext context, UploadSettings settings) {
        String key = context.expectName();
        if (key.equals("preview") && !context.check(TokenType.PUNCTUATION, ":")) {
            settings.preview = true;
            return;
        }
        context.expect(TokenType.PUNCTUATION, ":");
        switch (key) {
            case "accept" -> settings.accept = context.expect(TokenType.STRING).value();
            case "maxSize" -> settings.maxSize = Double.parseDouble(context.expect(TokenType.NUMBER).value());
            case "preview" -> {
                if (context.match(TokenType.KEYWORD, "false")) {
                    settings.preview = false;
                } else {
                    context.match(TokenType.KEYWORD, "true");
                    settings.preview = true;
                }
            }
            case "action" -> settings.action = context.parseExpression();
            default -> context.skipLine();
        }
    }

    /**
     * Expected format: {@code modal name [title="..."] [trigger="..."]:} followed by a UI block.
     */
    static ModalNode parseModal(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "modal").location();
        String name = context.expectName();
        String title = name;
        String trigger = null;
        while (context.checkWord()) {
            String key = context.advance().value();
            if (!context.match(TokenType.OPERATOR, "=")) {
                continue;
            }
            if (key.equals("title")) {
                title = context.expect(TokenType.STRING).value();
            } else if (key.equals("trigger")) {
                trigger = context.expect(TokenType.STRING).value();
            } else {
                context.parseAtomicExpression();
            }
        }
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return new ModalNode(location, name, title, trigger, context.parseUiBlock());
    }

    /**
     * Expected format: {@code toast message [type=kind] [duration=ms]}.
     */
    static ToastNode parseToast(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "toast").location();
        Expression message = context.parseExpression();
        String type = "info";
        Double duration = null;
        while (context.checkWord()) {
            String key = context.advance().value();
            if (!context.match(TokenType.OPERATOR, "=")) {
                continue;
            }
            if (key.equals("type")) {
                type = context.advance().value();
            } else if (key.equals("duration")) {
                duration = Double.parseDouble(context.expect(TokenType.NUMBER).value());
            } else {
                context.parseAtomicExpression();
            }
        }
        return new ToastNode(location, message, type, duration);
    }
}
