package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;

/**
 * A reactive variable: {@code state name: Type = initial}.
 *
 * @param location  The position of the <code>state</code> keyword.
 * @param name      The variable name.
 * @param valueType The declared type.
 * @param initial   The initial value.
 */
public record StateDeclNode(SourceLocation location, String name, TypeExpr valueType, Expression initial) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.STATE_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(valueType, initial);
    }
}
