package org.zerox.cli.commands;

import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.cli.CommandLineInterface;
import org.zerox.compiler.Compiler;
import org.zerox.compiler.CompilerOptions;
import org.zerox.compiler.diagnostics.Diagnostic;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs the front end over each file and prints one line per diagnostic:
 * {@code file:line:column: [ERROR|WARNING] message}.
 * <p>
 * Every file is checked even if an earlier one fails. Exit codes: 0 when no file has errors,
 * 1 when any file has errors, 2 when any file cannot be read or the configuration is invalid.
 */
@Command(name = "check", description = "Tokenizes, parses and validates 0x source files.")
public class CheckCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CheckCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_IO_FAILURE = 2;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The 0x source files to check.")
    private List<Path> files;

    @Option(names = {"-c", "--config"}, description = "Path to a HOCON configuration file.")
    private File configFile;

    @Option(names = {"-W", "--warnings-as-errors"}, description = "Treat warnings such as unused state as errors.")
    private boolean warningsAsErrors;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final CompilerOptions options;
        try {
            options = CompilerOptions.fromConfig(parent.getConfig(configFile));
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_IO_FAILURE;
        }
        final Compiler compiler = new Compiler(warningsAsErrors ? options.withWarningsAsErrors(true) : options);
        final boolean strict = compiler.getOptions().warningsAsErrors();

        int exitCode = EXIT_OK;
        for (Path file : files) {
            final String source;
            try {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.debug("Failed to read {}", file, e);
                err.println(file + ": cannot read file: " + e.getMessage());
                exitCode = EXIT_IO_FAILURE;
                continue;
            }

            final List<Diagnostic> diagnostics = compiler.check(source, file.toString());
            for (Diagnostic diagnostic : diagnostics) {
                out.printf("%s:%d:%d: [%s] %s%n", file, diagnostic.line(), diagnostic.column(),
                        diagnostic.type(), diagnostic.message());
                if (diagnostic.type() == Diagnostic.Type.ERROR
                        || (strict && diagnostic.type() == Diagnostic.Type.WARNING)) {
                    exitCode = Math.max(exitCode, EXIT_ERRORS);
                }
            }
        }
        out.flush();
        return exitCode;
    }
}
