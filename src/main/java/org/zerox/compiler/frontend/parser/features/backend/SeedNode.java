package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Seed data for a model: {@code seed User 10:} followed by the data expression.
 *
 * @param count The number of records to generate, or {@code null}.
 */
public record SeedNode(
        SourceLocation location,
        String model,
        Expression count,
        Expression data
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.SEED;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(count, data);
    }
}
