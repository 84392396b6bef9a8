package org.zerox.compiler.frontend.parser.features.backend;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.statement.Statement;

import java.util.List;

/**
 * A scheduled job.
 *
 * @param schedule The cron expression, {@code 0 * * * *} when omitted.
 */
public record CronNode(
        SourceLocation location,
        String name,
        String schedule,
        List<Statement> body
) implements AstNode {

    public CronNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CRON;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
