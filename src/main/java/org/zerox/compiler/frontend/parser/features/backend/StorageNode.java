package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A file storage bucket; the provider is one of s3, r2, gcs or local and defaults to s3.
 */
public record StorageNode(
        SourceLocation location,
        String name,
        String provider,
        Map<String, Expression> props
) implements AstNode {

    public StorageNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STORAGE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
