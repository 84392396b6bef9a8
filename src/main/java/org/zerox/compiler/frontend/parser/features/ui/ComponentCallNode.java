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
 * An instance of a user component: {@code component Card(title="Hi")} or {@code Card(title="Hi")}.
 *
 * @param location The position of the call.
 * @param name     The component name.
 * @param args     Named arguments under their names, positional ones as {@code _arg0}, {@code _arg1}, ...
 * @param children Slot content given as an indented block after a colon; usually empty.
 */
public record ComponentCallNode(
        SourceLocation location,
        String name,
        Map<String, Expression> args,
        List<AstNode> children
) implements AstNode {

    public ComponentCallNode {
        args = Props.copyOf(args);
        children = List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPONENT_CALL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(args, children);
    }
}
