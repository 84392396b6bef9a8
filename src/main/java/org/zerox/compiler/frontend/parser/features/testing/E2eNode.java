package org.zerox.compiler.frontend.parser.features.testing;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A browser-level scenario made of {@code action target [= value]} steps.
 */
public record E2eNode(
        SourceLocation location,
        String name,
        List<Step> steps
) implements AstNode {

    public E2eNode {
        steps = List.copyOf(steps);
    }

    /**
     * One scenario step; {@code value} is {@code null} for steps without {@code =}.
     */
    public record Step(String action, Expression target, Expression value) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return Children.of(target, value);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.E2E;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(steps);
    }
}
