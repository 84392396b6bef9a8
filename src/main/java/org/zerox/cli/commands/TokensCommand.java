package org.zerox.cli.commands;

import org.zerox.cli.CommandLineInterface;
import org.zerox.compiler.Compiler;
import org.zerox.compiler.CompilerOptions;
import org.zerox.compiler.frontend.CompilerFrontendException;
import org.zerox.compiler.frontend.lexer.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the token stream of a 0x source file, one token per line.")
public class TokensCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The 0x source file to tokenize.")
    private Path file;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println(file + ": cannot read file: " + e.getMessage());
            return CheckCommand.EXIT_IO_FAILURE;
        }

        final Compiler compiler = new Compiler(CompilerOptions.fromConfig(parent.getConfig()));
        try {
            for (Token token : compiler.tokenize(source)) {
                out.printf("%d:%d %s '%s'%n", token.line(), token.column(), token.type(), escape(token.value()));
            }
        } catch (CompilerFrontendException e) {
            err.println(file + ":" + e.getLine() + ":" + e.getColumn() + ": [ERROR] " + e.getDetail());
            return CheckCommand.EXIT_ERRORS;
        }
        out.flush();
        return CheckCommand.EXIT_OK;
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t");
    }
}
