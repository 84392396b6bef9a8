package org.zerox.compiler.frontend.parser.ast;

import org.zerox.compiler.api.SourceLocation;

/**
 * A line comment kept inside a declaration or UI block.
 *
 * @param location The position of the {@code //}.
 * @param text     The trimmed comment text.
 */
public record CommentNode(SourceLocation location, String text) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.COMMENT;
    }
}
