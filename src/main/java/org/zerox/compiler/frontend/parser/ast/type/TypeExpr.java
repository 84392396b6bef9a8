package org.zerox.compiler.frontend.parser.ast.type;

import org.zerox.compiler.frontend.parser.ast.AstNode;

/**
 * A type annotation.
 */
public sealed interface TypeExpr extends AstNode permits
        PrimitiveType, ListType, MapType, SetType, ObjectType, UnionType, NullableType, NamedType {
}
