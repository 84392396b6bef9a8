package org.zerox.compiler.api;

/**
 * A 1-based position in a 0x source text. Every token and every AST node carries one.
 *
 * @param line   The 1-based line number.
 * @param column The 1-based column number.
 */
public record SourceLocation(int line, int column) {

    /**
     * Converts this location to the 0-based position used by editors and language servers.
     * Each axis is clamped at zero, so synthetic locations never map to negative positions.
     *
     * @return The editor position.
     */
    public EditorPosition toEditorPosition() {
        return new EditorPosition(Math.max(0, line - 1), Math.max(0, column - 1));
    }

    @Override
    public String toString() {
        return "Line " + line + ", Col " + column;
    }
}
