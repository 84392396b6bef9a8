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
 * Backup policy; the strategy defaults to {@code daily}.
 */
public record BackupNode(
        SourceLocation location,
        String strategy,
        Map<String, Expression> props
) implements AstNode {

    public BackupNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BACKUP;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
