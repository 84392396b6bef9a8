package org.zerox.compiler.frontend.parser.ast;

import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * An {@code elif} branch, shared by the UI and statement forms of {@code if}.
 *
 * @param condition The branch condition.
 * @param body      The branch body.
 * @param <T>       UI nodes or statements.
 */
public record ConditionalBranch<T extends AstNode>(Expression condition, List<T> body) implements AstFragment {

    public ConditionalBranch {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(condition, body);
    }
}
