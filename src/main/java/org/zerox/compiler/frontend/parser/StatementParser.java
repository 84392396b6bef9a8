package org.zerox.compiler.frontend.parser;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ast.expression.AssignmentExpr;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.statement.AssignmentStatement;
import org.zerox.compiler.frontend.parser.ast.statement.ExpressionStatement;
import org.zerox.compiler.frontend.parser.ast.statement.ForStatement;
import org.zerox.compiler.frontend.parser.ast.statement.IfStatement;
import org.zerox.compiler.frontend.parser.ast.statement.ReturnStatement;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;
import org.zerox.compiler.frontend.parser.ast.statement.VarDeclStatement;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

/**
 * Parses the imperative statements found in function bodies, lifecycle hooks and watch blocks.
 */
final class StatementParser {

    private final ParsingContext context;

    StatementParser(ParsingContext context) {
        this.context = context;
    }

    Statement parseStatement() {
        SourceLocation location = context.location();

        if (context.match(TokenType.KEYWORD, "return")) {
            if (context.check(TokenType.NEWLINE) || context.check(TokenType.DEDENT) || context.isAtEnd()) {
                return new ReturnStatement(location, null);
            }
            return new ReturnStatement(location, context.parseExpression());
        }

        if (context.check(TokenType.KEYWORD, "if")) {
            ControlFlowParser.IfParts<Statement> parts =
                    ControlFlowParser.parseIf(context, context::parseStatementBlock, this::parseStatement);
            return new IfStatement(parts.location(), parts.condition(), parts.body(), parts.elifs(), parts.elseBody());
        }

        if (context.check(TokenType.KEYWORD, "for")) {
            ControlFlowParser.ForParts<Statement> parts = ControlFlowParser.parseFor(context, context::parseStatementBlock);
            return new ForStatement(parts.location(), parts.item(), parts.index(), parts.iterable(), parts.body());
        }

        // name: Type = value
        if (context.check(TokenType.IDENTIFIER) && context.peek(1).is(TokenType.PUNCTUATION, ":")) {
            String name = context.advance().value();
            context.advance();
            TypeExpr type = context.parseTypeExpr();
            context.expect(TokenType.OPERATOR, "=");
            return new VarDeclStatement(location, name, type, context.parseExpression());
        }

        Expression expression = context.parseAssignment();
        if (expression instanceof AssignmentExpr assignment) {
            return new AssignmentStatement(location, assignment.target(), assignment.op(), assignment.value());
        }
        return new ExpressionStatement(location, expression);
    }
}
