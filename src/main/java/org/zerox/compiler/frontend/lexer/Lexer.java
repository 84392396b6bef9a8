package org.zerox.compiler.frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.compiler.api.CompilerErrorCode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * The source is processed line by line. Leading whitespace is compared against a stack of
 * indentation levels to emit INDENT and DEDENT tokens; blank lines emit a single NEWLINE and
 * do not affect indentation. Indentation that does not match an enclosing level is accepted
 * at the new, lower value.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    /** Number of columns a tab contributes to the indentation of a line. */
    public static final int DEFAULT_TAB_WIDTH = 2;

    private static final Set<String> DOUBLE_OPERATORS = Set.of(
            "+=", "-=", "*=", "/=", "->", "=>", "==", "!=", ">=", "<=", "&&", "||");
    private static final String SINGLE_OPERATORS = "+-*/%=><!|";
    private static final String PUNCTUATION = ":,.()[]{}?";

    private final String source;
    private final int tabWidth;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();

    private String lineText;
    private int lineNumber;

    /**
     * Creates a new Lexer with the default tab width.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, DEFAULT_TAB_WIDTH);
    }

    /**
     * Creates a new Lexer.
     * @param source   The source code as a single string.
     * @param tabWidth The number of indentation columns a tab counts for.
     */
    public Lexer(String source, int tabWidth) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("Tab width must be positive, got " + tabWidth);
        }
        this.source = source;
        this.tabWidth = tabWidth;
    }

    /**
     * Tokenizes the given source with the default tab width.
     * @param source The source code.
     * @return The recognized tokens, ending with EOF.
     * @throws LexerException on an unterminated string literal.
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * Performs the tokenization of the entire source code.
     * A lexer instance is meant to be used once.
     * @return A list of the recognized tokens, ending with EOF.
     * @throws LexerException on an unterminated string literal.
     */
    public List<Token> scanTokens() {
        tokens.clear();
        indentStack.clear();
        indentStack.push(0);

        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            // CRLF sources
            lineText = lines[i].endsWith("\r") ? lines[i].substring(0, lines[i].length() - 1) : lines[i];
            lineNumber = i + 1;
            scanLine();
        }

        while (indentStack.size() > 1) {
            indentStack.pop();
            tokens.add(new Token(TokenType.DEDENT, "", lines.length, 1));
        }
        tokens.add(new Token(TokenType.EOF, "", lines.length + 1, 1));

        LOG.debug("Tokenized {} lines into {} tokens", lines.length, tokens.size());
        return tokens;
    }

    private void scanLine() {
        if (lineText.isBlank()) {
            add(TokenType.NEWLINE, "\n", 1);
            return;
        }

        int indentEnd = 0;
        int indent = 0;
        while (indentEnd < lineText.length()) {
            char c = lineText.charAt(indentEnd);
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent += tabWidth;
            } else {
                break;
            }
            indentEnd++;
        }
        trackIndentation(indent);

        String trimmed = lineText.stripLeading();
        if (trimmed.startsWith("//")) {
            add(TokenType.COMMENT, trimmed.substring(2).strip(), lineText.indexOf("//") + 1);
        } else {
            scanContent(indentEnd);
        }
        add(TokenType.NEWLINE, "\n", lineText.length() + 1);
    }

    private void trackIndentation(int indent) {
        int currentIndent = indentStack.peek();
        if (indent > currentIndent) {
            indentStack.push(indent);
            add(TokenType.INDENT, "", 1);
        } else if (indent < currentIndent) {
            while (indentStack.size() > 1 && indentStack.peek() > indent) {
                indentStack.pop();
                add(TokenType.DEDENT, "", 1);
            }
        }
    }

    private void scanContent(int start) {
        int col = start;
        while (col < lineText.length()) {
            char ch = lineText.charAt(col);
            if (ch == ' ' || ch == '\t') {
                col++;
                continue;
            }
            if (ch == '/' && charAt(col + 1) == '/') {
                add(TokenType.COMMENT, lineText.substring(col + 2).strip(), col + 1);
                return;
            }
            col = scanToken(ch, col);
        }
    }

    /**
     * Scans one token starting at {@code col}.
     * @return The index just past the token.
     */
    private int scanToken(char ch, int col) {
        int column = col + 1;

        if (ch == '#' && isHexDigit(charAt(col + 1))) {
            int end = skipWhile(col + 1, Lexer::isHexDigit);
            add(TokenType.COLOR, lineText.substring(col, end), column);
            return end;
        }

        if (ch == '.' && isAsciiLetterOrUnderscore(charAt(col + 1)) && !endsOperand(col - 1)) {
            int end = skipWhile(col + 1, c -> isAsciiAlphanumeric(c) || c == '-');
            add(TokenType.STYLE_CLASS, lineText.substring(col, end), column);
            return end;
        }

        if (ch == '@') {
            int end = skipWhile(col + 1, Lexer::isAsciiAlphanumeric);
            add(TokenType.AT_KEYWORD, lineText.substring(col + 1, end), column);
            return end;
        }

        if (ch == '"' || ch == '\'') {
            return string(ch, col);
        }

        if (isDigit(ch)) {
            return number(col);
        }

        if (col + 1 < lineText.length()) {
            String twoChars = lineText.substring(col, col + 2);
            if (DOUBLE_OPERATORS.contains(twoChars)) {
                add(TokenType.OPERATOR, twoChars, column);
                return col + 2;
            }
        }
        if (SINGLE_OPERATORS.indexOf(ch) >= 0) {
            add(TokenType.OPERATOR, String.valueOf(ch), column);
            return col + 1;
        }
        if (PUNCTUATION.indexOf(ch) >= 0) {
            add(TokenType.PUNCTUATION, String.valueOf(ch), column);
            return col + 1;
        }

        if (isIdentifierStart(ch)) {
            int end = skipWhile(col, Lexer::isIdentifierPart);
            word(lineText.substring(col, end), column);
            return end;
        }

        add(TokenType.ERROR, String.valueOf(ch), column);
        return col + 1;
    }

    private int string(char quote, int col) {
        StringBuilder value = new StringBuilder();
        int j = col + 1;
        while (j < lineText.length()) {
            char c = lineText.charAt(j);
            if (c == '\\' && j + 1 < lineText.length()) {
                char escaped = lineText.charAt(j + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    default -> value.append(escaped);
                }
                j += 2;
            } else if (c == quote) {
                add(TokenType.STRING, value.toString(), col + 1);
                return j + 1;
            } else {
                value.append(c);
                j++;
            }
        }
        throw new LexerException(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string literal", lineNumber, col + 1);
    }

    private int number(int col) {
        int end = skipWhile(col, Lexer::isDigit);

        // 2xl, 3xl: digits directly followed by a letter form a single word
        if (isAsciiLetterOrUnderscore(charAt(end))) {
            end = skipWhile(end, Lexer::isAsciiAlphanumeric);
            add(TokenType.IDENTIFIER, lineText.substring(col, end), col + 1);
            return end;
        }
        if (charAt(end) == '.' && isDigit(charAt(end + 1))) {
            end = skipWhile(end + 1, Lexer::isDigit);
        }
        add(TokenType.NUMBER, lineText.substring(col, end), col + 1);
        return end;
    }

    private void word(String text, int column) {
        if (Keywords.HTTP_METHODS.contains(text)) {
            add(TokenType.HTTP_METHOD, text, column);
        } else if (Keywords.RESERVED.contains(text)) {
            add(TokenType.KEYWORD, text, column);
        } else {
            add(TokenType.IDENTIFIER, text, column);
        }
    }

    /**
     * A '.' directly after a word, a closing parenthesis or a closing bracket is member access.
     */
    private boolean endsOperand(int index) {
        if (index < 0) {
            return false;
        }
        char c = lineText.charAt(index);
        return isIdentifierPart(c) || c == ')' || c == ']';
    }

    private void add(TokenType type, String value, int column) {
        tokens.add(new Token(type, value, lineNumber, column));
    }

    private char charAt(int index) {
        return index >= 0 && index < lineText.length() ? lineText.charAt(index) : '\0';
    }

    private int skipWhile(int from, CharPredicate predicate) {
        int j = from;
        while (j < lineText.length() && predicate.test(lineText.charAt(j))) {
            j++;
        }
        return j;
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAsciiLetterOrUnderscore(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return isAsciiLetterOrUnderscore(c) || isDigit(c);
    }

    private static boolean isIdentifierStart(char c) {
        return isAsciiLetterOrUnderscore(c) || isInternationalLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return isAsciiAlphanumeric(c) || isInternationalLetter(c);
    }

    /**
     * Latin extended, Greek, Cyrillic, Hangul, Kana and CJK ideographs.
     */
    private static boolean isInternationalLetter(char c) {
        return (c >= '\u00C0' && c <= '\u024F')
                || (c >= '\u0370' && c <= '\u03FF')
                || (c >= '\u0400' && c <= '\u052F')
                || (c >= '\u1100' && c <= '\u11FF')
                || (c >= '\u3040' && c <= '\u30FF')
                || (c >= '\u3130' && c <= '\u318F')
                || (c >= '\uAC00' && c <= '\uD7AF')
                || (c >= '\u4E00' && c <= '\u9FFF');
    }
}
