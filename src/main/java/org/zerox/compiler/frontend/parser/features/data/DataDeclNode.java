package org.zerox.compiler.frontend.parser.features.data;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A fetched value: {@code data users = api.users()} with optional {@code loading:}, {@code error:}
 * and {@code empty:} lines.
 *
 * @param location The position of <code>data</code>.
 * @param name     The name the result is bound to.
 * @param query    The fetching expression.
 * @param loading  What to show while loading, or {@code null}.
 * @param error    The error message, or {@code null}.
 * @param empty    The message for an empty result, or {@code null}.
 */
public record DataDeclNode(
        SourceLocation location,
        String name,
        Expression query,
        Expression loading,
        String error,
        String empty
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.DATA_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(query, loading);
    }
}
