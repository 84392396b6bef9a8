package org.zerox.compiler.frontend.parser.ast.statement;

import org.zerox.compiler.frontend.parser.ast.AstNode;

/**
 * A statement in a function, lifecycle hook, watch block or backend handler.
 */
public sealed interface Statement extends AstNode permits
        ExpressionStatement, ReturnStatement, IfStatement, ForStatement,
        VarDeclStatement, AssignmentStatement {
}
