package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * A reference to a declared type or model.
 */
public record NamedType(SourceLocation location, String name) implements TypeExpr {

    @Override
    public NodeKind kind() {
        return NodeKind.NAMED_TYPE;
    }
}
