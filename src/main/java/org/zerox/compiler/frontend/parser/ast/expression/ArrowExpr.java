package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An arrow function {@code x => body}, only recognized as a call argument.
 *
 * @param location The position of the parameter.
 * @param params   The parameter names; empty if the left side was not a plain name.
 * @param body     The body expression.
 */
public record ArrowExpr(SourceLocation location, List<String> params, Expression body) implements Expression {

    public ArrowExpr {
        params = List.copyOf(params);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARROW;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }
}
