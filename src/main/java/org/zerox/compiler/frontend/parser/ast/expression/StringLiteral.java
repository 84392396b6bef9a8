package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * A string without interpolation; colors are read as strings too.
 */
public record StringLiteral(SourceLocation location, String value) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.STRING;
    }
}
