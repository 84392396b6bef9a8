package org.zerox.compiler.frontend.parser.features.resilience;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Retry policy: {@code retry 3 linear:} followed by {@code delay} and {@code action} settings.
 *
 * @param maxRetries The attempt limit.
 * @param backoff    {@code linear} or {@code exponential}; exponential by default.
 * @param delay      The {@code delay} setting, or {@code null}.
 * @param action     The {@code action} setting, a null literal when absent.
 */
public record RetryNode(
        SourceLocation location,
        Expression maxRetries,
        String backoff,
        Expression delay,
        Expression action
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.RETRY;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(maxRetries, delay, action);
    }
}
