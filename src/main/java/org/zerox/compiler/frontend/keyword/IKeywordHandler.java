package org.zerox.compiler.frontend.keyword;

import org.zerox.compiler.frontend.parser.ParsingContext;
import org.zerox.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for all keyword handlers.
 * Each handler is responsible for parsing the construct introduced by a specific keyword (e.g., "state").
 */
@FunctionalInterface
public interface IKeywordHandler {

    /**
     * Parses the construct. The context is positioned at the keyword itself, which the handler consumes.
     *
     * @param context The context that provides access to the token stream and the shared grammar.
     * @return The AST node for the construct.
     */
    AstNode parse(ParsingContext context);
}
