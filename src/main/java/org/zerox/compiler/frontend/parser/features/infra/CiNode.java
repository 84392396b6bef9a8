package org.zerox.compiler.frontend.parser.features.infra;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A continuous integration pipeline.
 *
 * @param provider The CI provider, {@code github} when omitted.
 * @param triggers Events from {@code trigger push} or {@code on pull_request} lines.
 * @param steps    Named commands from {@code name = expr} lines.
 */
public record CiNode(
        SourceLocation location,
        String provider,
        List<String> triggers,
        List<Step> steps
) implements AstNode {

    public CiNode {
        triggers = List.copyOf(triggers);
        steps = List.copyOf(steps);
    }

    /**
     * A named pipeline step.
     */
    public record Step(String name, Expression command) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return List.of(command);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CI;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(steps);
    }
}
