package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A complete create/read/update/delete screen for a model: {@code crud Product [props][:]}.
 *
 * @param model The model name.
 * @param body  Customizations given as a UI block.
 */
public record CrudNode(
        SourceLocation location,
        String model,
        Map<String, Expression> props,
        List<AstNode> body
) implements AstNode {

    public CrudNode {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CRUD;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props, body);
    }
}
