package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

public record BooleanLiteral(SourceLocation location, boolean value) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.BOOLEAN;
    }
}
