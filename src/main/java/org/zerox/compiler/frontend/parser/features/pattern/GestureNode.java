package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A touch gesture on a target: {@code gesture swipe card -> dismiss()}.
 *
 * @param gestureType One of drag, pinch, longPress, doubleTap or swipe; drag by default.
 * @param action      The reaction, a null literal when absent.
 */
public record GestureNode(
        SourceLocation location,
        String gestureType,
        Expression target,
        Expression action
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.GESTURE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(target, action);
    }
}
