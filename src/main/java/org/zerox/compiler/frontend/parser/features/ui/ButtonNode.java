package org.zerox.compiler.frontend.parser.features.ui;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A button: {@code button "Save" primary -> save()}.
 *
 * @param location The position of <code>button</code>.
 * @param label    The label.
 * @param action   The click action, an {@code AssignmentExpr} for {@code -> count += 1}; {@code null} if absent.
 * @param props    The properties between label and arrow.
 */
public record ButtonNode(
        SourceLocation location,
        Expression label,
        Expression action,
        Map<String, Expression> props
) implements AstNode {

    public ButtonNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BUTTON;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(label, action, props);
    }
}
