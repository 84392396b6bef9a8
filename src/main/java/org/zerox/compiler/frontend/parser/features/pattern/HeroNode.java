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
 * A landing page hero section.
 */
public record HeroNode(
        SourceLocation location,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public HeroNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HERO;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, body);
    }
}
