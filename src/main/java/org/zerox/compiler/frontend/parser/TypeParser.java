package org.zerox.compiler.frontend.parser;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.lexer.Keywords;
import org.zerox.compiler.frontend.lexer.Token;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ast.type.ListType;
import org.zerox.compiler.frontend.parser.ast.type.MapType;
import org.zerox.compiler.frontend.parser.ast.type.NamedType;
import org.zerox.compiler.frontend.parser.ast.type.NullableType;
import org.zerox.compiler.frontend.parser.ast.type.ObjectType;
import org.zerox.compiler.frontend.parser.ast.type.PrimitiveType;
import org.zerox.compiler.frontend.parser.ast.type.SetType;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;
import org.zerox.compiler.frontend.parser.ast.type.UnionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses type expressions: primitives, {@code list[T]}, {@code map[K, V]}, {@code set[T]},
 * {@code {field: T, ...}} and named types, each optionally followed by {@code ?}.
 */
final class TypeParser {

    private final ParsingContext context;

    TypeParser(ParsingContext context) {
        this.context = context;
    }

    TypeExpr parseTypeExpr() {
        SourceLocation location = context.location();
        TypeExpr type;
        if (context.match(TokenType.KEYWORD, "list")) {
            // a bare list is list[any]
            TypeExpr itemType = new PrimitiveType(location, PrimitiveType.ANY);
            if (context.match(TokenType.PUNCTUATION, "[")) {
                itemType = parseTypeExpr();
                context.expect(TokenType.PUNCTUATION, "]");
            }
            type = new ListType(location, itemType);
        } else if (context.checkWord("map")) {
            context.advance();
            context.expect(TokenType.PUNCTUATION, "[");
            TypeExpr keyType = parseTypeExpr();
            context.expect(TokenType.PUNCTUATION, ",");
            TypeExpr valueType = parseTypeExpr();
            context.expect(TokenType.PUNCTUATION, "]");
            type = new MapType(location, keyType, valueType);
        } else if (context.checkWord("set")) {
            context.advance();
            context.expect(TokenType.PUNCTUATION, "[");
            TypeExpr itemType = parseTypeExpr();
            context.expect(TokenType.PUNCTUATION, "]");
            type = new SetType(location, itemType);
        } else if (context.check(TokenType.PUNCTUATION, "{")) {
            type = parseObjectType();
        } else {
            Token name = context.peek();
            if (!name.isWord()) {
                throw context.error("Expected type, got " + name.type() + " '" + name.value() + "'");
            }
            context.advance();
            type = Keywords.PRIMITIVE_TYPES.contains(name.value())
                    ? new PrimitiveType(location, name.value())
                    : new NamedType(location, name.value());
        }

        if (context.match(TokenType.PUNCTUATION, "?")) {
            type = new NullableType(location, type);
        }
        return type;
    }

    ObjectType parseObjectType() {
        SourceLocation location = context.expect(TokenType.PUNCTUATION, "{").location();
        List<ObjectType.Field> fields = new ArrayList<>();
        while (!context.check(TokenType.PUNCTUATION, "}") && !context.isAtEnd()) {
            String name = context.expectName();
            context.expect(TokenType.PUNCTUATION, ":");
            fields.add(new ObjectType.Field(name, parseTypeExpr()));
            context.match(TokenType.PUNCTUATION, ",");
        }
        context.expect(TokenType.PUNCTUATION, "}");
        return new ObjectType(location, fields);
    }

    /**
     * Parses {@code "a" | "b" | ...} into a union of its string members.
     */
    UnionType parseUnion() {
        SourceLocation location = context.location();
        List<String> members = new ArrayList<>();
        members.add(context.expect(TokenType.STRING).value());
        while (context.match(TokenType.OPERATOR, "|")) {
            members.add(context.expect(TokenType.STRING).value());
        }
        return new UnionType(location, members);
    }
}
