package org.zerox.compiler.frontend.parser.features.data;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * A subscription: {@code realtime messages = subscribe("chat"):} with {@code on event:} handlers.
 *
 * @param location The position of <code>realtime</code>.
 * @param name     The name the live value is bound to.
 * @param channel  The channel expression.
 * @param handlers The event handlers in source order.
 */
public record RealtimeDeclNode(
        SourceLocation location,
        String name,
        Expression channel,
        List<Handler> handlers
) implements AstNode {

    public RealtimeDeclNode {
        handlers = List.copyOf(handlers);
    }

    /**
     * {@code on event:} followed by a statement block or a single statement.
     */
    public record Handler(String event, List<Statement> body) implements AstFragment {

        public Handler {
            body = List.copyOf(body);
        }

        @Override
        public List<AstNode> getChildren() {
            return List.copyOf(body);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.REALTIME_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(channel, handlers);
    }
}
