package org.zerox.compiler.diagnostics;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.api.EditorPosition;
import org.zerox.compiler.api.SourceLocation;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while tokenizing, parsing or validating a 0x source.
 *
 * @param type       The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code       The machine-readable error code.
 * @param message    The diagnostic message.
 * @param sourceName The name of the source the issue occurred in.
 * @param line       The 1-based line of the issue.
 * @param column     The 1-based column of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String sourceName,
        int line,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * @return The location of this diagnostic.
     */
    public SourceLocation location() {
        return new SourceLocation(line, column);
    }

    /**
     * A diagnostic without a source position (line 0) maps to the start of the document.
     *
     * @return The 0-based editor position of this diagnostic.
     */
    public EditorPosition toEditorPosition() {
        return location().toEditorPosition();
    }

    /**
     * Formats the diagnostic the way front-end exceptions are worded: {@code Line L, Col C: message}.
     *
     * @return The formatted message.
     */
    public String formatted() {
        return location() + ": " + message;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, sourceName, line, column, message);
    }
}
