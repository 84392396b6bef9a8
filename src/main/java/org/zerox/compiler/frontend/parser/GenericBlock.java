package org.zerox.compiler.frontend.parser;

import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * The result of {@link ParsingContext#parseGenericBlock()}: inline properties and an optional UI body.
 *
 * @param props The properties before the colon.
 * @param body  The UI children, empty if there was no colon or no indented block.
 */
public record GenericBlock(Map<String, Expression> props, List<AstNode> body) {

    public GenericBlock {
        props = Props.copyOf(props);
        body = List.copyOf(body);
    }
}
