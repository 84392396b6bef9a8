package org.zerox.compiler.frontend.parser.ast.statement;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;

/**
 * A local variable {@code name: Type = value}.
 */
public record VarDeclStatement(SourceLocation location, String name, TypeExpr type, Expression value) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.VAR_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(type, value);
    }
}
