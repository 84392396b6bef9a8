package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * One of {@code int float str bool date time datetime}, or {@code any} for the item type of a bare {@code list}.
 */
public record PrimitiveType(SourceLocation location, String name) implements TypeExpr {

    /** Item type of an unparameterized list. */
    public static final String ANY = "any";

    @Override
    public NodeKind kind() {
        return NodeKind.PRIMITIVE_TYPE;
    }
}
