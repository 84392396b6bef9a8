package org.zerox.compiler.api;

import org.zerox.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during compilation.
 * <p>
 * It is part of the public API and hides the internal exception types of the front end.
 * The diagnostics that caused the failure are available through {@link #getDiagnostics()}.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of(), null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    /**
     * Constructs a new compilation exception carrying the diagnostics that failed the compilation.
     * @param message The detail message.
     * @param diagnostics The blocking diagnostics.
     * @param cause The cause, or {@code null}.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused the failure; empty if the failure was not tied to a source position.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
