package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * Shows or hides its children at a breakpoint: {@code mobile hide:} or {@code responsive lg show:}.
 *
 * @param breakpoint The breakpoint, the keyword itself for {@code mobile}, {@code tablet} and {@code desktop}.
 * @param action     {@code show} or {@code hide}; show by default.
 */
public record ResponsiveNode(
        SourceLocation location,
        String breakpoint,
        String action,
        List<AstNode> body
) implements AstNode {

    public ResponsiveNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RESPONSIVE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
