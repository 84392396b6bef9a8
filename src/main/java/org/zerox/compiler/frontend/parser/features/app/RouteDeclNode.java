package org.zerox.compiler.frontend.parser.features.app;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * Maps a path to a page: {@code route "/users/:id":} with {@code page Name} and {@code guard: role} lines.
 *
 * @param target The page name; empty if the block names none.
 * @param guard  The required role, or {@code null}.
 */
public record RouteDeclNode(
        SourceLocation location,
        String path,
        String target,
        String guard
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.ROUTE_DECL;
    }
}
