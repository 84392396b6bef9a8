package org.zerox.compiler.frontend.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.IKeywordHandler;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.Lexer;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.CommentNode;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;
import org.zerox.compiler.frontend.suggest.KeywordSuggester;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The parser for the 0x language. It consumes a list of tokens from the {@link Lexer}
 * and produces the top-level nodes of the Abstract Syntax Tree (AST).
 * <p>
 * Keyword-introduced constructs are parsed by the handlers of a {@link KeywordHandlerRegistry};
 * the parser itself owns the token stream, block structure, properties and, through its helper
 * parsers, expressions, statements and types. Parsing stops at the first error.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final KeywordHandlerRegistry DEFAULT_REGISTRY = KeywordHandlerRegistry.initialize();

    private final List<Token> tokens;
    private final KeywordHandlerRegistry registry;
    private final KeywordSuggester suggester;
    private final ExpressionParser expressionParser;
    private final StatementParser statementParser;
    private final TypeParser typeParser;
    private int current = 0;

    /**
     * Constructs a parser with the built-in keyword handlers.
     * @param tokens The tokens to parse, ending with EOF.
     */
    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_REGISTRY, new KeywordSuggester());
    }

    /**
     * Constructs a new Parser.
     * @param tokens    The tokens to parse, ending with EOF.
     * @param registry  The keyword handlers.
     * @param suggester Produces hints for rejected keywords.
     */
    public Parser(List<Token> tokens, KeywordHandlerRegistry registry, KeywordSuggester suggester) {
        this.tokens = endingWithEof(tokens);
        this.registry = registry;
        this.suggester = suggester;
        this.expressionParser = new ExpressionParser(this);
        this.statementParser = new StatementParser(this);
        this.typeParser = new TypeParser(this);
    }

    private static List<Token> endingWithEof(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.EOF) {
            return tokens;
        }
        List<Token> terminated = new ArrayList<>(tokens);
        int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line() + 1;
        terminated.add(new Token(TokenType.EOF, "", line, 1));
        return terminated;
    }

    /**
     * Tokenizes and parses a source text with the default settings.
     * @param source The source code.
     * @return The top-level nodes in source order.
     * @throws org.zerox.compiler.frontend.lexer.LexerException on an unterminated string.
     * @throws ParseException on the first syntax error.
     */
    public static List<AstNode> parse(String source) {
        return new Parser(Lexer.tokenize(source)).parse();
    }

    /**
     * @return The shared registry holding the built-in keyword handlers.
     */
    public static KeywordHandlerRegistry defaultRegistry() {
        return DEFAULT_REGISTRY;
    }

    /**
     * Parses the entire token stream and returns a list of top-level AST nodes.
     * @return A list of parsed {@link AstNode}s.
     * @throws ParseException on the first syntax error.
     */
    public List<AstNode> parse() {
        List<AstNode> nodes = new ArrayList<>();
        skipNewlines();
        while (!isAtEnd()) {
            if (check(TokenType.NEWLINE) || check(TokenType.DEDENT) || check(TokenType.COMMENT)) {
                advance();
                continue;
            }
            nodes.add(dispatch(KeywordScope.TOP_LEVEL, "Expected top-level keyword, got '%s'"));
            skipNewlines();
        }
        LOG.debug("Parsed {} top-level nodes from {} tokens", nodes.size(), tokens.size());
        return nodes;
    }

    private AstNode dispatch(KeywordScope scope, String rejection) {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD) {
            Optional<IKeywordHandler> handler = registry.get(scope, token.value());
            if (handler.isEmpty() && scope == KeywordScope.BODY) {
                handler = registry.get(KeywordScope.UI, token.value());
            }
            if (handler.isPresent()) {
                return handler.get().parse(this);
            }
        }
        // Card(title="x") in a UI block is a component call
        if (scope == KeywordScope.UI && token.type() == TokenType.IDENTIFIER && peek(1).is(TokenType.PUNCTUATION, "(")) {
            Optional<IKeywordHandler> call = registry.get(KeywordScope.UI, "component");
            if (call.isPresent()) {
                return call.get().parse(this);
            }
        }
        throw rejectKeyword(token, scope, rejection);
    }

    private ParseException rejectKeyword(Token token, KeywordScope scope, String rejection) {
        if (token.type() == TokenType.INDENT) {
            return ParseException.at(CompilerErrorCode.UNEXPECTED_TOKEN, "Unexpected indentation", token);
        }
        if (token.type() == TokenType.ERROR || token.type() == TokenType.EOF) {
            return error(String.format(rejection, token.value()));
        }
        String message = String.format(rejection, token.value());
        if (!token.isWord()) {
            return ParseException.at(CompilerErrorCode.UNEXPECTED_TOKEN, message, token);
        }
        Optional<String> hint = suggester.hintFor(token.value(), candidates(scope));
        if (hint.isPresent()) {
            message = message + " " + hint.get();
        }
        return ParseException.at(CompilerErrorCode.UNKNOWN_KEYWORD, message, token);
    }

    private Collection<String> candidates(KeywordScope scope) {
        if (scope != KeywordScope.BODY) {
            return registry.keywords(scope);
        }
        Set<String> keywords = new LinkedHashSet<>(registry.keywords(KeywordScope.BODY));
        keywords.addAll(registry.keywords(KeywordScope.UI));
        return keywords;
    }

    // region Token stream

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token peek(int offset) {
        int index = current + offset;
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public boolean check(TokenType type, String value) {
        return peek().is(type, value);
    }

    @Override
    public boolean checkWord() {
        return peek().isWord();
    }

    @Override
    public boolean checkWord(String value) {
        return peek().isWord() && peek().value().equals(value);
    }

    @Override
    public boolean match(TokenType type, String value) {
        if (check(type, value)) {
            advance();
            return true;
        }
        return false;
    }

    @Override
    public Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        Token token = peek();
        throw error("Expected " + type + ", got " + token.type() + " '" + token.value() + "'");
    }

    @Override
    public Token expect(TokenType type, String value) {
        if (check(type, value)) {
            return advance();
        }
        Token token = peek();
        throw error("Expected " + type + " '" + value + "', got " + token.type() + " '" + token.value() + "'");
    }

    @Override
    public String expectName() {
        if (checkWord()) {
            return advance().value();
        }
        Token token = peek();
        throw error("Expected name, got " + token.type() + " '" + token.value() + "'");
    }

    @Override
    public List<String> parseNameList() {
        List<String> names = new ArrayList<>();
        while (!check(TokenType.NEWLINE) && !check(TokenType.COMMENT) && !isAtEnd()) {
            names.add(expectName());
            match(TokenType.PUNCTUATION, ",");
        }
        return names;
    }

    /**
     * Skips NEWLINE tokens and comments that trail code on the same line.
     * Comments on a line of their own are left for the enclosing block.
     */
    @Override
    public void skipNewlines() {
        while (true) {
            if (check(TokenType.NEWLINE)) {
                advance();
            } else if (check(TokenType.COMMENT) && isTrailingComment()) {
                advance();
            } else {
                return;
            }
        }
    }

    private boolean isTrailingComment() {
        if (current == 0) {
            return false;
        }
        Token before = previous();
        return before.line() == peek().line()
                && before.type() != TokenType.NEWLINE
                && before.type() != TokenType.INDENT
                && before.type() != TokenType.DEDENT;
    }

    @Override
    public void skipLine() {
        while (!check(TokenType.NEWLINE) && !isAtEnd()) {
            advance();
        }
        skipNewlines();
        if (check(TokenType.INDENT)) {
            int depth = 0;
            do {
                Token token = advance();
                if (token.type() == TokenType.INDENT) {
                    depth++;
                } else if (token.type() == TokenType.DEDENT) {
                    depth--;
                }
            } while (depth > 0 && !isAtEnd());
        }
    }

    @Override
    public SourceLocation location() {
        return peek().location();
    }

    @Override
    public ParseException error(String message) {
        Token token = peek();
        if (token.type() == TokenType.ERROR) {
            return ParseException.at(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character '" + token.value() + "'", token);
        }
        if (token.type() == TokenType.EOF) {
            return ParseException.at(CompilerErrorCode.UNEXPECTED_END, message, token);
        }
        return ParseException.at(CompilerErrorCode.UNEXPECTED_TOKEN, message, token);
    }

    // endregion

    // region Shared grammar

    @Override
    public Expression parseExpression() {
        return expressionParser.parseExpression();
    }

    @Override
    public Expression parseAssignment() {
        return expressionParser.parseAssignment();
    }

    @Override
    public Expression parseAtomicExpression() {
        return expressionParser.parseAtomicExpression();
    }

    @Override
    public TypeExpr parseTypeExpr() {
        return typeParser.parseTypeExpr();
    }

    @Override
    public TypeExpr parseTypeDefinition() {
        if (check(TokenType.STRING)) {
            return typeParser.parseUnion();
        }
        return typeParser.parseTypeExpr();
    }

    @Override
    public Statement parseStatement() {
        return statementParser.parseStatement();
    }

    @Override
    public Expression parseDataExpression() {
        skipNewlines();
        boolean indented = check(TokenType.INDENT);
        if (indented) {
            advance();
            skipNewlines();
        }
        Expression data = parseExpression();
        skipNewlines();
        if (indented) {
            expect(TokenType.DEDENT);
        }
        return data;
    }

    @Override
    public List<Statement> parseStatementBlock() {
        List<Statement> statements = new ArrayList<>();
        forEachBlockLine(() -> statements.add(parseStatement()));
        return statements;
    }

    @Override
    public List<AstNode> parseUiBlock() {
        return parseBlockKeepingComments(() -> dispatch(KeywordScope.UI, "Expected UI element, got '%s'"));
    }

    @Override
    public List<AstNode> parseBody() {
        return parseBlockKeepingComments(() -> dispatch(KeywordScope.BODY, "Unexpected token '%s'"));
    }

    private List<AstNode> parseBlockKeepingComments(Supplier<AstNode> item) {
        List<AstNode> items = new ArrayList<>();
        if (!check(TokenType.INDENT)) {
            return items;
        }
        advance();
        skipNewlines();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (check(TokenType.NEWLINE)) {
                advance();
                continue;
            }
            if (check(TokenType.COMMENT)) {
                Token comment = advance();
                items.add(new CommentNode(comment.location(), comment.value()));
                skipNewlines();
                continue;
            }
            items.add(item.get());
            skipNewlines();
        }
        if (check(TokenType.DEDENT)) {
            advance();
        }
        return items;
    }

    @Override
    public void forEachBlockLine(Runnable lineParser) {
        if (!check(TokenType.INDENT)) {
            return;
        }
        advance();
        skipNewlines();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (check(TokenType.NEWLINE)) {
                advance();
                continue;
            }
            if (check(TokenType.COMMENT)) {
                advance();
                skipNewlines();
                continue;
            }
            int before = current;
            lineParser.run();
            if (current == before) {
                Token token = peek();
                throw error("Unexpected token '" + token.value() + "'");
            }
            skipNewlines();
        }
        if (check(TokenType.DEDENT)) {
            advance();
        }
    }

    @Override
    public Map<String, Expression> parseInlineProps() {
        Map<String, Expression> props = Props.builder();
        while (!check(TokenType.NEWLINE) && !check(TokenType.INDENT) && !check(TokenType.DEDENT)
                && !check(TokenType.OPERATOR, "->") && !isAtEnd()) {
            if (checkWord()) {
                parseWordProp(props);
            } else if (check(TokenType.AT_KEYWORD)) {
                String breakpoint = "@" + advance().value();
                if (match(TokenType.OPERATOR, "=")) {
                    props.put(breakpoint, parseAtomicExpression());
                }
            } else if (check(TokenType.COLOR)) {
                // a color without a property name carries no meaning
                advance();
            } else {
                break;
            }
        }
        return props;
    }

    @Override
    public Map<String, Expression> parseInlinePropsUntilArrow() {
        Map<String, Expression> props = Props.builder();
        while (!check(TokenType.NEWLINE) && !check(TokenType.OPERATOR, "->") && !isAtEnd() && checkWord()) {
            parseWordProp(props);
        }
        return props;
    }

    /**
     * {@code name=value}, or a bare {@code name} meaning {@code true}.
     */
    private void parseWordProp(Map<String, Expression> props) {
        Token name = advance();
        if (match(TokenType.OPERATOR, "=")) {
            props.put(name.value(), parseAtomicExpression());
        } else {
            props.put(name.value(), new BooleanLiteral(name.location(), true));
        }
    }

    @Override
    public GenericBlock parseGenericBlock() {
        Map<String, Expression> props = Props.builder();
        while (!check(TokenType.PUNCTUATION, ":") && !check(TokenType.NEWLINE) && !isAtEnd() && checkWord()) {
            parseWordProp(props);
        }
        List<AstNode> body = List.of();
        if (match(TokenType.PUNCTUATION, ":")) {
            skipNewlines();
            body = parseUiBlock();
        }
        return new GenericBlock(props, body);
    }

    @Override
    public Map<String, Expression> parseGenericPropsBlock() {
        if (!match(TokenType.PUNCTUATION, ":")) {
            return Props.builder();
        }
        skipNewlines();
        return parsePropsBlock();
    }

    @Override
    public Map<String, Expression> parsePropsBlock() {
        Map<String, Expression> props = Props.builder();
        forEachBlockLine(() -> {
            String key = expectName();
            expect(TokenType.PUNCTUATION, ":");
            props.put(key, parseExpression());
        });
        return props;
    }

    // endregion
}
