package org.zerox.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.api.CompilerErrorCode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is converted into the expected token stream, including
 * the indentation tokens that give the language its block structure.
 */
public class LexerTest {

    /**
     * Verifies that a state declaration is split into keyword, identifier, punctuation,
     * operator and number tokens with 1-based positions.
     */
    @Test
    @Tag("unit")
    void scansStateDeclarationWithPositions() {
        // Arrange
        String source = "state count: int = 0";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type, Token::value, Token::line, Token::column).containsExactly(
                tuple(TokenType.KEYWORD, "state", 1, 1),
                tuple(TokenType.IDENTIFIER, "count", 1, 7),
                tuple(TokenType.PUNCTUATION, ":", 1, 12),
                tuple(TokenType.IDENTIFIER, "int", 1, 14),
                tuple(TokenType.OPERATOR, "=", 1, 18),
                tuple(TokenType.NUMBER, "0", 1, 20),
                tuple(TokenType.NEWLINE, "\n", 1, 21),
                tuple(TokenType.EOF, "", 2, 1));
    }

    /**
     * Verifies that a deeper line opens a block with INDENT and that the end of the source
     * closes every open block with DEDENT before EOF.
     */
    @Test
    @Tag("unit")
    void emitsIndentAndDedentAroundBlocks() {
        // Arrange
        String source = "page Home:\n  text \"hi\"";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.PUNCTUATION, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.KEYWORD, TokenType.STRING, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.EOF);
    }

    /**
     * Verifies that blank lines produce a single NEWLINE and leave the indentation untouched.
     */
    @Test
    @Tag("unit")
    void blankLinesDoNotAffectIndentation() {
        // Arrange
        String source = "page Home:\n  text a\n\n  text b";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.INDENT).hasSize(1);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.DEDENT).hasSize(1);
        assertThat(tokens.get(8)).extracting(Token::type, Token::line).containsExactly(TokenType.NEWLINE, 3);
    }

    /**
     * Verifies that a tab counts for the configured number of columns, so a tab-indented line and
     * a line indented with the same number of spaces belong to the same block.
     */
    @Test
    @Tag("unit")
    void tabCountsForConfiguredWidth() {
        // Arrange
        String source = "page Home:\n\ttext a\n    text b";

        // Act
        List<Token> defaultWidth = Lexer.tokenize(source);
        List<Token> wideTabs = new Lexer(source, 4).scanTokens();

        // Assert
        assertThat(defaultWidth).filteredOn(t -> t.type() == TokenType.INDENT).hasSize(2);
        assertThat(wideTabs).filteredOn(t -> t.type() == TokenType.INDENT).hasSize(1);
    }

    /**
     * Verifies that dedenting to a column that was never an indentation level is accepted and
     * still closes the inner block.
     */
    @Test
    @Tag("unit")
    void acceptsDedentToUnknownLevel() {
        // Arrange
        String source = "page Home:\n    text a\n  text b";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type).containsSubsequence(
                TokenType.INDENT, TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.KEYWORD);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.EOF).hasSize(1);
    }

    /**
     * Verifies the special literal forms: colors, style classes, breakpoints and member access.
     */
    @Test
    @Tag("unit")
    void scansColorsStyleClassesAndBreakpoints() {
        // Arrange
        String source = "layout .card-grid bg=#1a2b3c @mobile user.name";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type, Token::value).startsWith(
                tuple(TokenType.KEYWORD, "layout"),
                tuple(TokenType.STYLE_CLASS, ".card-grid"),
                tuple(TokenType.IDENTIFIER, "bg"),
                tuple(TokenType.OPERATOR, "="),
                tuple(TokenType.COLOR, "#1a2b3c"),
                tuple(TokenType.AT_KEYWORD, "mobile"),
                tuple(TokenType.IDENTIFIER, "user"),
                tuple(TokenType.PUNCTUATION, "."),
                tuple(TokenType.IDENTIFIER, "name"));
    }

    /**
     * Verifies that string escapes are resolved and both quote styles are accepted.
     */
    @Test
    @Tag("unit")
    void unescapesStringLiterals() {
        // Arrange
        String source = "text \"say \\\"hi\\\"\\n\" 'it\\'s'";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens.get(1)).extracting(Token::type, Token::value).containsExactly(TokenType.STRING, "say \"hi\"\n");
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.STRING, "it's");
    }

    /**
     * Verifies number scanning: decimals continue after a dot and digits followed by letters form
     * one identifier, as in the size token {@code 2xl}.
     */
    @Test
    @Tag("unit")
    void scansNumbersAndSizeTokens() {
        // Arrange
        String source = "3.14 2xl 42";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type, Token::value).startsWith(
                tuple(TokenType.NUMBER, "3.14"),
                tuple(TokenType.IDENTIFIER, "2xl"),
                tuple(TokenType.NUMBER, "42"));
    }

    /**
     * Verifies that two-character operators are preferred over their one-character prefixes.
     */
    @Test
    @Tag("unit")
    void matchesTwoCharacterOperatorsGreedily() {
        // Arrange
        String source = "a += 1 -> b => c == d != e >= f <= g && h || i";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.OPERATOR).extracting(Token::value)
                .containsExactly("+=", "->", "=>", "==", "!=", ">=", "<=", "&&", "||");
    }

    /**
     * Verifies the word classification into HTTP methods, keywords and identifiers.
     */
    @Test
    @Tag("unit")
    void classifiesWords() {
        // Arrange
        String source = "api users = GET \"/api/users\"";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type).startsWith(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.HTTP_METHOD, TokenType.STRING);
    }

    /**
     * Verifies that a Korean identifier is scanned as a single identifier token.
     */
    @Test
    @Tag("unit")
    void scansKoreanIdentifierAsOneToken() {
        // Arrange
        String source = "state 카운트: int = 0";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens.get(1)).extracting(Token::type, Token::value).containsExactly(TokenType.IDENTIFIER, "카운트");
    }

    /**
     * Verifies that comments become COMMENT tokens, both on their own line and after code.
     */
    @Test
    @Tag("unit")
    void scansComments() {
        // Arrange
        String source = "// header\nstate x: int = 0 // trailing";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.COMMENT)
                .extracting(Token::value, Token::line)
                .containsExactly(tuple("header", 1), tuple("trailing", 2));
    }

    /**
     * Verifies that a character no rule accepts becomes an ERROR token instead of failing.
     */
    @Test
    @Tag("unit")
    void unknownCharacterBecomesErrorToken() {
        // Arrange
        String source = "text $";

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        assertThat(tokens.get(1)).extracting(Token::type, Token::value, Token::column)
                .containsExactly(TokenType.ERROR, "$", 6);
    }

    /**
     * Verifies that an unterminated string is a fatal error positioned at its opening quote.
     */
    @Test
    @Tag("unit")
    void unterminatedStringFails() {
        // Arrange
        String source = "page Home:\n  text \"abc";

        // Act & Assert
        assertThatThrownBy(() -> Lexer.tokenize(source))
                .isInstanceOf(LexerException.class)
                .hasMessage("Line 2, Col 8: Unterminated string literal")
                .satisfies(e -> assertThat(((LexerException) e).getCode()).isEqualTo(CompilerErrorCode.UNTERMINATED_STRING));
    }

    /**
     * Verifies that a non-positive tab width is rejected.
     */
    @Test
    @Tag("unit")
    void rejectsNonPositiveTabWidth() {
        assertThatThrownBy(() -> new Lexer("x", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies the stream invariants over a multi-block source: INDENT and DEDENT balance, lines
     * never decrease, and the columns of the content tokens on a line strictly increase.
     */
    @Test
    @Tag("unit")
    void tokenStreamIsBalancedAndMonotonic() {
        // Arrange
        String source = String.join("\n",
                "page Dashboard:",
                "  state items: list[str] = []",
                "  layout col gap=4:",
                "    for item, i in items:",
                "      text \"{i}: {item}\" bold",
                "    // done",
                "  fn add(x: str):",
                "    items = items + [x]",
                "",
                "component Card:",
                "  prop title: str");

        // Act
        List<Token> tokens = Lexer.tokenize(source);

        // Assert
        long indents = tokens.stream().filter(t -> t.type() == TokenType.INDENT).count();
        long dedents = tokens.stream().filter(t -> t.type() == TokenType.DEDENT).count();
        assertThat(indents).isEqualTo(dedents).isEqualTo(5);

        Token previous = null;
        for (Token token : tokens) {
            if (previous != null) {
                assertThat(token.line()).isGreaterThanOrEqualTo(previous.line());
            }
            previous = token;
        }

        List<Token> content = tokens.stream()
                .filter(t -> t.type() != TokenType.INDENT && t.type() != TokenType.DEDENT
                        && t.type() != TokenType.NEWLINE && t.type() != TokenType.EOF)
                .toList();
        for (int i = 1; i < content.size(); i++) {
            if (content.get(i).line() == content.get(i - 1).line()) {
                assertThat(content.get(i).column()).isGreaterThan(content.get(i - 1).column());
            }
        }
    }

    /**
     * Verifies that Windows line endings produce the same tokens as Unix ones.
     */
    @Test
    @Tag("unit")
    void treatsCrlfLikeLf() {
        // Arrange
        String unix = "page Home:\n  state n: int = 0\n  text \"hi\"\n";
        String windows = unix.replace("\n", "\r\n");

        // Act
        List<Token> expected = Lexer.tokenize(unix);
        List<Token> actual = Lexer.tokenize(windows);

        // Assert
        assertThat(actual).extracting(Token::type).doesNotContain(TokenType.ERROR);
        assertThat(actual).isEqualTo(expected);
    }
}
