package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * The {@code null} literal. Also stands for an absent button or gesture action.
 */
public record NullLiteral(SourceLocation location) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.NULL;
    }
}
