package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * A numeric literal. Integers and decimals share one representation.
 *
 * @param location The literal position.
 * @param value    The numeric value.
 */
public record NumberLiteral(SourceLocation location, double value) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.NUMBER;
    }
}
