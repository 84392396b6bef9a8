package org.zerox.compiler.frontend.parser.features.resilience;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A loading placeholder; the style is one of skeleton, spinner, shimmer or global.
 */
public record LoadingNode(
        SourceLocation location,
        String loadingType,
        List<AstNode> body
) implements AstNode {

    public LoadingNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOADING;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
