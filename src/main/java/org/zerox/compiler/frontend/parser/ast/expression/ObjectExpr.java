package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An object literal. A shorthand entry {@code {name}} is stored as {@code name: name}.
 *
 * @param location   The position of the opening brace, or of the first named argument.
 * @param properties The entries in source order.
 */
public record ObjectExpr(SourceLocation location, List<Property> properties) implements Expression {

    public ObjectExpr {
        properties = List.copyOf(properties);
    }

    /**
     * One {@code key: value} entry.
     */
    public record Property(String key, Expression value) {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OBJECT_EXPR;
    }

    @Override
    public List<AstNode> getChildren() {
        return properties.stream().<AstNode>map(Property::value).toList();
    }
}
