package org.zerox.compiler.frontend.parser.features.interop;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * Inline JavaScript, {@code js { ... }}. The code is rebuilt from token values joined by single
 * spaces, so the original formatting is not preserved.
 */
public record JsBlockNode(SourceLocation location, String code) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.JS_BLOCK;
    }
}
