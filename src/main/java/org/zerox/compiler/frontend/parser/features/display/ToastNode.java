package org.zerox.compiler.frontend.parser.features.display;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A transient notification: {@code toast "Saved" type=success duration=3000}.
 *
 * @param toastType The toast style, {@code info} by default.
 * @param duration  The display time in milliseconds, or {@code null}.
 */
public record ToastNode(
        SourceLocation location,
        Expression message,
        String toastType,
        Double duration
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.TOAST;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(message);
    }
}
