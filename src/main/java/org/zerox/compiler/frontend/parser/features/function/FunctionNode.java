package org.zerox.compiler.frontend.parser.features.function;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;

/**
 * An AST node that represents a function declaration, {@code [async] fn name(params):}.
 * <p>
 * The <code>requires:</code> and <code>ensures:</code> lines of the body are kept apart from the
 * statements as pre- and postconditions. They are recorded, not enforced.
 *
 * @param location The position of <code>fn</code>, or of <code>async</code> if present.
 * @param name     The function name.
 * @param params   The formal parameters.
 * @param body     The statements of the body.
 * @param async    Whether the function was declared with <code>async</code>.
 * @param requires The preconditions.
 * @param ensures  The postconditions; they may use {@code old(expr)}.
 */
public record FunctionNode(
        SourceLocation location,
        String name,
        List<Param> params,
        List<Statement> body,
        boolean async,
        List<Expression> requires,
        List<Expression> ensures
) implements AstNode {

    public FunctionNode {
        params = List.copyOf(params);
        body = List.copyOf(body);
        requires = List.copyOf(requires);
        ensures = List.copyOf(ensures);
    }

    /**
     * A formal parameter: {@code name[: Type][= default]}.
     *
     * @param name         The parameter name.
     * @param type         The declared type, or {@code null}.
     * @param defaultValue The default value, or {@code null}.
     */
    public record Param(String name, TypeExpr type, Expression defaultValue) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return Children.of(type, defaultValue);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FN_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(params, requires, ensures, body);
    }
}
