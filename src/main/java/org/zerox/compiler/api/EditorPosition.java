package org.zerox.compiler.api;

/**
 * A 0-based editor position, as used by the Language Server Protocol.
 *
 * @param line      The 0-based line.
 * @param character The 0-based character offset within the line.
 */
public record EditorPosition(int line, int character) {
}
