package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * A reference to a name. Non-structural keywords such as {@code error} or {@code query}
 * are read as identifiers in expression position.
 *
 * @param location The position of the name.
 * @param name     The referenced name.
 */
public record IdentifierExpr(SourceLocation location, String name) implements Expression {

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER;
    }
}
