package org.zerox.compiler.frontend.parser.features.infra;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * Container image settings.
 *
 * @param baseImage The base image, {@code node:20-alpine} when omitted.
 */
public record DockerNode(
        SourceLocation location,
        String baseImage,
        Map<String, Expression> props
) implements AstNode {

    public DockerNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DOCKER;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
