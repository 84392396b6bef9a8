package org.zerox.compiler.frontend.parser.features.resilience;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;
import java.util.Map;

/**
 * An error boundary.
 *
 * @param errorType One of boundary, global or fallback; boundary by default.
 * @param handlers  {@code on event:} statement blocks.
 * @param fallback  The UI shown instead of the failed subtree.
 * @param props     {@code name = expr} settings.
 */
public record ErrorNode(
        SourceLocation location,
        String errorType,
        List<Handler> handlers,
        List<AstNode> fallback,
        Map<String, Expression> props
) implements AstNode {

    public ErrorNode {
        handlers = List.copyOf(handlers);
        fallback = List.copyOf(fallback);
        props = Props.copyOf(props);
    }

    /**
     * Statements run when the boundary catches {@code event}.
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
        return NodeKind.ERROR;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(handlers, fallback, props);
    }
}
