package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.frontend.parser.ast.AstNode;

/**
 * An expression of the embedded expression language.
 */
public sealed interface Expression extends AstNode permits
        NumberLiteral, StringLiteral, BooleanLiteral, NullLiteral,
        IdentifierExpr, MemberExpr, IndexExpr, CallExpr,
        BinaryExpr, UnaryExpr, TernaryExpr, ArrowExpr,
        ArrayExpr, ObjectExpr, TemplateExpr, AssignmentExpr,
        AwaitExpr, OldExpr, BracedExpr {
}
