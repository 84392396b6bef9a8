package org.zerox.compiler.frontend.parser.features.control;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.keyword.KeywordHandlerRegistry;
import org.zerox.compiler.frontend.keyword.KeywordScope;
import org.zerox.compiler.frontend.lexer.TokenType;
import org.zerox.compiler.frontend.parser.ControlFlowParser;
import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Handlers for UI control flow. {@code if} and {@code for} share their grammar with the
 * statement forms through {@link ControlFlowParser}.
 */
public final class ControlFlowHandlers {

    private ControlFlowHandlers() {
    }

    public static void register(KeywordHandlerRegistry registry) {
        registry.register(KeywordScope.UI, "if", ControlFlowHandlers::parseIf);
        registry.register(KeywordScope.UI, "for", ControlFlowHandlers::parseFor);
        registry.register(KeywordScope.UI, "show", ControlFlowHandlers::parseShow);
        registry.register(KeywordScope.UI, "hide", ControlFlowHandlers::parseHide);
    }

    static IfBlockNode parseIf(ParsingContext context) {
        ControlFlowParser.IfParts<AstNode> parts = ControlFlowParser.parseIf(context, context::parseUiBlock, null);
        return new IfBlockNode(parts.location(), parts.condition(), parts.body(), parts.elifs(), parts.elseBody());
    }

    static ForBlockNode parseFor(ParsingContext context) {
        ControlFlowParser.ForParts<AstNode> parts = ControlFlowParser.parseFor(context, context::parseUiBlock);
        return new ForBlockNode(parts.location(), parts.item(), parts.index(), parts.iterable(), parts.body());
    }

    static ShowBlockNode parseShow(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "show").location();
        Expression condition = context.parseExpression();
        return new ShowBlockNode(location, condition, parseGuardedBlock(context));
    }

    static HideBlockNode parseHide(ParsingContext context) {
        SourceLocation location = context.expect(TokenType.KEYWORD, "hide").location();
        Expression condition = context.parseExpression();
        return new HideBlockNode(location, condition, parseGuardedBlock(context));
    }

    private static List<AstNode> parseGuardedBlock(ParsingContext context) {
        context.expect(TokenType.PUNCTUATION, ":");
        context.skipNewlines();
        return context.parseUiBlock();
    }
}
