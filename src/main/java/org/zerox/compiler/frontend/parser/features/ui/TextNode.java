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
 * Displays text: {@code text "Hello {name}" size=xl bold}.
 */
public record TextNode(
        SourceLocation location,
        Expression content,
        Map<String, Expression> props
) implements AstNode {

    public TextNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(content, props);
    }
}
