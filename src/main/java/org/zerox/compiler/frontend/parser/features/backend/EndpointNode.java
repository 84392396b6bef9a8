package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * A server endpoint: {@code endpoint POST "/api/users" middleware auth guard admin:}.
 *
 * @param method     The upper-case HTTP method, {@code GET} when omitted.
 * @param path       The route path; a bare name {@code users} becomes {@code /users}.
 * @param middleware Middleware names in declaration order.
 * @param guard      The role guarding the endpoint, or {@code null}.
 * @param body       The handler statements.
 */
public record EndpointNode(
        SourceLocation location,
        String method,
        String path,
        List<String> middleware,
        String guard,
        List<Statement> body
) implements AstNode {

    public EndpointNode {
        middleware = List.copyOf(middleware);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ENDPOINT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
