package org.zerox.compiler.frontend.parser.features.container;

import org.zerox.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A named top-level container with a body of declarations and UI elements.
 * The validator analyses each container independently.
 */
public interface ContainerNode extends AstNode {

    /**
     * @return The container name.
     */
    String name();

    /**
     * @return The body items in source order, including comments.
     */
    List<AstNode> body();
}
