package org.zerox.compiler.frontend.parser.features.testing;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Canned responses for a service: {@code GET "/users" => [...]} lines.
 */
public record MockNode(
        SourceLocation location,
        String target,
        List<Route> routes
) implements AstNode {

    public MockNode {
        routes = List.copyOf(routes);
    }

    /**
     * A mocked route; the method defaults to GET and the path to {@code /}.
     */
    public record Route(String method, String path, Expression response) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return List.of(response);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MOCK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(routes);
    }
}
