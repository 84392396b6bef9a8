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
 * Contains unit tests for the {@code check} subcommand.
 */
public class CheckCommandTest {

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
        // getConfig applies the logging section of reference.conf to the shared logback context
        LoggingConfigurator.reset();
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);
    }

    /**
     * Verifies that a clean file prints nothing and exits with 0.
     */
    @Test
    @Tag("unit")
    void cleanFileExitsWithZero() throws IOException {
        // Arrange
        Path file = write("home.0x", "page Home:\n  state count: int = 0\n  button \"+\" -> count += 1\n");

        // Act
        int exitCode = commandLine.execute("check", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that syntax errors are printed in the file:line:column format and exit with 1.
     */
    @Test
    @Tag("unit")
    void syntaxErrorExitsWithOne() throws IOException {
        // Arrange
        Path file = write("typo.0x", "paeg Home:\n");

        // Act
        int exitCode = commandLine.execute("check", file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString().strip()).isEqualTo(
                file + ":1:1: [ERROR] Expected top-level keyword, got 'paeg' Did you mean 'page'?");
    }

    /**
     * Verifies that warnings alone pass, but fail the check with {@code -W}.
     */
    @Test
    @Tag("unit")
    void warningsFailOnlyWhenRequested() throws IOException {
        // Arrange
        Path file = write("unused.0x", "page Home:\n  state count: int = 0\n  text \"hi\"\n");

        // Act
        int lenient = commandLine.execute("check", file.toString());
        int strict = CommandLineInterface.createCommandLine()
                .setOut(new PrintWriter(new StringWriter()))
                .execute("check", "-W", file.toString());

        // Assert
        assertThat(lenient).isZero();
        assertThat(out.toString())
                .startsWith(file + ":2:")
                .contains("[WARNING] State 'count' is declared but never used");
        assertThat(strict).isEqualTo(1);
    }

    /**
     * Verifies that an unreadable file stops the check with exit code 2.
     */
    @Test
    @Tag("unit")
    void missingFileExitsWithTwo() {
        Path missing = directory.resolve("absent.0x");

        int exitCode = commandLine.execute("check", missing.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith(missing + ": cannot read file: ");
    }

    /**
     * Verifies that files after an unreadable one are still checked and that the worst exit code
     * is returned.
     */
    @Test
    @Tag("unit")
    void continuesAfterUnreadableFile() throws IOException {
        // Arrange
        Path missing = directory.resolve("absent.0x");
        Path typo = write("typo.0x", "paeg Home:\n");

        // Act
        int exitCode = commandLine.execute("check", missing.toString(), typo.toString());

        // Assert
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith(missing + ": cannot read file: ");
        assertThat(out.toString()).startsWith(typo + ":1:1: [ERROR] Expected top-level keyword");
    }

    /**
     * Verifies that a missing configuration file is reported as invalid configuration.
     */
    @Test
    @Tag("unit")
    void missingConfigExitsWithTwo() throws IOException {
        // Arrange
        Path file = write("home.0x", "page Home:\n  text \"hi\"\n");

        // Act
        int exitCode = commandLine.execute("check", "--config", directory.resolve("none.conf").toString(), file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith("Invalid configuration: Configuration file not found: ");
    }

    private Path write(String name, String content) throws IOException {
        Path file = directory.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
