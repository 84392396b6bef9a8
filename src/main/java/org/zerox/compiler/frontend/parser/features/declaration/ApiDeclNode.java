package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * An HTTP resource: {@code api name = GET "/url"}.
 *
 * @param location The position of the <code>api</code> keyword.
 * @param name     The name the resource is referenced by.
 * @param method   The HTTP method in upper case.
 * @param url      The request URL.
 */
public record ApiDeclNode(SourceLocation location, String name, String method, String url) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.API_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of();
    }
}
