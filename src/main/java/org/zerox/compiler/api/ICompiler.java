package org.zerox.compiler.api;

import org.zerox.compiler.diagnostics.Diagnostic;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the 0x compiler front end.
 */
public interface ICompiler {

    /**
     * Tokenizes, parses and validates the given source.
     * Compilation fails closed on errors and proceeds on warnings.
     *
     * @param source     The complete source text.
     * @param sourceName A name for the source, used in diagnostics.
     * @return The validated AST together with any warnings.
     * @throws CompilationException if a lexical or syntax error occurs, or validation reports errors.
     */
    CompilationResult compile(String source, String sourceName) throws CompilationException;

    /**
     * Runs the same pipeline as {@link #compile(String, String)} but never throws for source problems.
     * A lexical or syntax error yields exactly one error diagnostic; otherwise all validation
     * errors and warnings are returned.
     *
     * @param source     The complete source text.
     * @param sourceName A name for the source, used in diagnostics.
     * @return All diagnostics in report order.
     */
    List<Diagnostic> check(String source, String sourceName);

    /**
     * Compiles a source file.
     * @param sourcePath The path to the source file.
     * @return The compilation result.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default CompilationResult compile(Path sourcePath) throws CompilationException, IOException {
        return compile(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString());
    }
}
