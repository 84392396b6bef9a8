package org.zerox.compiler.frontend.parser.features.declaration;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * Imports a component from another source file: {@code use Name from "path"}.
 */
public record UseImportNode(SourceLocation location, String name, String source) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.USE_IMPORT;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of();
    }
}
