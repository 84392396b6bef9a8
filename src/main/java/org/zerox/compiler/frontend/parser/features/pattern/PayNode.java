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
 * A payment element.
 *
 * @param provider The {@code provider} property if it is a string, otherwise {@code stripe}.
 * @param payType  One of checkout, pricing, portal or buyButton; checkout by default.
 */
public record PayNode(
        SourceLocation location,
        String provider,
        String payType,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public PayNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PAY;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, body);
    }
}
