package org.zerox.compiler.frontend.parser.ast.statement;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * {@code target op value} at statement level, where op is one of {@code = += -= *= /=}.
 */
public record AssignmentStatement(SourceLocation location, Expression target, String op, Expression value) implements Statement {

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGNMENT_STMT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }
}
