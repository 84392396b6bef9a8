package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * An AI-powered element: {@code ai chat:} or {@code ai.summarize:}.
 *
 * @param aiType The capability, {@code chat} by default.
 */
public record AiNode(
        SourceLocation location,
        String aiType,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public AiNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AI;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, body);
    }
}
