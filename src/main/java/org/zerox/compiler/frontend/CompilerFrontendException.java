package org.zerox.compiler.frontend;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.api.SourceLocation;

/**
 * Base class for the fatal errors raised while tokenizing or parsing.
 * <p>
 * The message is prefixed with the position, {@code Line L, Col C: message}; the bare
 * message, the position and a machine-readable code are available separately.
 */
public class CompilerFrontendException extends RuntimeException {

    private final CompilerErrorCode code;
    private final String detail;
    private final int line;
    private final int column;

    /**
     * @param code    The error code.
     * @param detail  The message without the position prefix.
     * @param line    The 1-based line.
     * @param column  The 1-based column.
     */
    public CompilerFrontendException(CompilerErrorCode code, String detail, int line, int column) {
        super("Line " + line + ", Col " + column + ": " + detail);
        this.code = code;
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public CompilerErrorCode getCode() {
        return code;
    }

    /**
     * @return The message without the {@code Line L, Col C: } prefix.
     */
    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public SourceLocation getLocation() {
        return new SourceLocation(line, column);
    }
}
