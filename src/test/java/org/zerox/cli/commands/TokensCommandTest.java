package org.zerox.cli.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.cli.CommandLineInterface;
import org.zerox.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@code tokens} subcommand.
 */
public class TokensCommandTest {

    @TempDir
    Path directory;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);
    }

    /**
     * Verifies that each token is printed as line:column, type and escaped value.
     */
    @Test
    @Tag("unit")
    void printsOneTokenPerLine() throws IOException {
        // Arrange
        Path file = directory.resolve("home.0x");
        Files.writeString(file, "page Home:", StandardCharsets.UTF_8);

        // Act
        int exitCode = commandLine.execute("tokens", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "1:1 KEYWORD 'page'",
                "1:6 IDENTIFIER 'Home'",
                "1:10 PUNCTUATION ':'",
                "1:11 NEWLINE '\\n'",
                "2:1 EOF ''");
    }

    /**
     * Verifies that a lexical error is reported on the error stream with exit code 1.
     */
    @Test
    @Tag("unit")
    void lexicalErrorExitsWithOne() throws IOException {
        // Arrange
        Path file = directory.resolve("broken.0x");
        Files.writeString(file, "page Home:\n  text \"hi", StandardCharsets.UTF_8);

        // Act
        int exitCode = commandLine.execute("tokens", file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString().strip()).isEqualTo(file + ":2:8: [ERROR] Unterminated string literal");
    }

    /**
     * Verifies that an unreadable file exits with code 2.
     */
    @Test
    @Tag("unit")
    void missingFileExitsWithTwo() {
        int exitCode = commandLine.execute("tokens", directory.resolve("absent.0x").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("cannot read file");
    }
}
