package org.zerox.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A structured part of a node that is not a node itself, such as a function parameter or a
 * form field. {@link Children} flattens fragments into the owning node's children.
 */
public interface AstFragment {

    /**
     * @return The nodes contained in this fragment, in source order.
     */
    List<AstNode> getChildren();
}
