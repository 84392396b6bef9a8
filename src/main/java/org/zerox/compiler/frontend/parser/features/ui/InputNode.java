package org.zerox.compiler.frontend.parser.features.ui;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A text input bound two-way to a state variable: {@code input name placeholder="Name"}.
 */
public record InputNode(
        SourceLocation location,
        String binding,
        Map<String, Expression> props
) implements AstNode {

    public InputNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INPUT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
