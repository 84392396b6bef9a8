package org.zerox.compiler.frontend.parser.features.infra;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Environment variables for a stage.
 *
 * @param stage The stage name, {@code all} when omitted.
 * @param vars  The variables in source order.
 */
public record EnvNode(
        SourceLocation location,
        String stage,
        List<EnvVar> vars
) implements AstNode {

    public EnvNode {
        vars = List.copyOf(vars);
    }

    /**
     * A variable; {@code secret} variables are never exposed to the client.
     */
    public record EnvVar(String name, Expression value, boolean secret) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return List.of(value);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ENV;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(vars);
    }
}
