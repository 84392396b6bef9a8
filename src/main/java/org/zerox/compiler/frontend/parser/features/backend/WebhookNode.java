package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * An incoming webhook.
 *
 * @param path The route path, {@code /webhooks/<name>} when omitted.
 */
public record WebhookNode(
        SourceLocation location,
        String name,
        String path,
        List<Statement> body
) implements AstNode {

    public WebhookNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WEBHOOK;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
