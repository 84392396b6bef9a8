package org.zerox.compiler.frontend.parser.features.testing;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Named test data.
 */
public record FixtureNode(
        SourceLocation location,
        String name,
        Expression data
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.FIXTURE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(data);
    }
}
