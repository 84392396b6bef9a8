package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A union of string literals, {@code "todo" | "done"}. Only declared through {@code type}.
 */
public record UnionType(SourceLocation location, List<String> members) implements TypeExpr {

    public UnionType {
        members = List.copyOf(members);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNION_TYPE;
    }
}
