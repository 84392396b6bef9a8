package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An inline object type {@code {name: str, age: int}}.
 */
public record ObjectType(SourceLocation location, List<Field> fields) implements TypeExpr {

    public ObjectType {
        fields = List.copyOf(fields);
    }

    /** One named field. */
    public record Field(String name, TypeExpr fieldType) {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OBJECT_TYPE;
    }

    @Override
    public List<AstNode> getChildren() {
        return fields.stream().<AstNode>map(Field::fieldType).toList();
    }
}
