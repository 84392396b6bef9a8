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
 * An image: {@code image "/logo.png" alt="Logo"}.
 */
public record ImageNode(
        SourceLocation location,
        Expression src,
        Map<String, Expression> props
) implements AstNode {

    public ImageNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMAGE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(src, props);
    }
}
