package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A media element: {@code media video src autoplay} or {@code gallery images}.
 *
 * @param mediaType One of gallery, video, audio or carousel; gallery by default.
 */
public record MediaNode(
        SourceLocation location,
        String mediaType,
        Expression src,
        Map<String, Expression> props
) implements AstNode {

    public MediaNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MEDIA;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(src, props);
    }
}
