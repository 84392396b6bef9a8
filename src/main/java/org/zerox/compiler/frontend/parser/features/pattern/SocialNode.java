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
 * A social interaction such as likes or comments on a target.
 *
 * @param socialType One of like, bookmark, comments, follow, share or feed; like by default.
 */
public record SocialNode(
        SourceLocation location,
        String socialType,
        Expression target,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public SocialNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SOCIAL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(target, props, body);
    }
}
