package org.zerox.compiler.diagnostics;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.api.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * for one source text.
 * <p>
 * This decouples error reporting from the analysis logic. One engine belongs to one
 * compilation and is never shared between threads.
 */
public class DiagnosticsEngine {

    /** Name used when the caller does not name its source. */
    public static final String ANONYMOUS_SOURCE = "<input>";

    private final String sourceName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates an engine for an unnamed source.
     */
    public DiagnosticsEngine() {
        this(ANONYMOUS_SOURCE);
    }

    /**
     * Creates an engine for the given source.
     *
     * @param sourceName The source name used in every reported diagnostic.
     */
    public DiagnosticsEngine(String sourceName) {
        this.sourceName = sourceName != null ? sourceName : ANONYMOUS_SOURCE;
    }

    /**
     * Reports an error.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param location The location of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceLocation location) {
        report(Diagnostic.Type.ERROR, code, message, location);
    }

    /**
     * Reports a warning.
     *
     * @param code     The warning code.
     * @param message  The warning message.
     * @param location The location of the warning.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourceLocation location) {
        report(Diagnostic.Type.WARNING, code, message, location);
    }

    private void report(Diagnostic.Type type, CompilerErrorCode code, String message, SourceLocation location) {
        diagnostics.add(new Diagnostic(type, code, message, sourceName, location.line(), location.column()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics, in report order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The reported errors, in report order.
     */
    public List<Diagnostic> getErrors() {
        return ofType(Diagnostic.Type.ERROR);
    }

    /**
     * @return The reported warnings, in report order.
     */
    public List<Diagnostic> getWarnings() {
        return ofType(Diagnostic.Type.WARNING);
    }

    private List<Diagnostic> ofType(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
