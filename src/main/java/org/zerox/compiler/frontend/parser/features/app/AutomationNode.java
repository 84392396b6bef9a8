package org.zerox.compiler.frontend.parser.features.app;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * Event- and time-driven actions.
 *
 * @param location  The position of <code>automation</code>.
 * @param triggers  {@code trigger event} blocks.
 * @param schedules {@code schedule "cron"} blocks.
 */
public record AutomationNode(
        SourceLocation location,
        List<Trigger> triggers,
        List<Schedule> schedules
) implements AstNode {

    public AutomationNode {
        triggers = List.copyOf(triggers);
        schedules = List.copyOf(schedules);
    }

    /**
     * Actions run when an event fires.
     */
    public record Trigger(String event, List<Expression> actions) implements AstFragment {

        public Trigger {
            actions = List.copyOf(actions);
        }

        @Override
        public List<AstNode> getChildren() {
            return List.copyOf(actions);
        }
    }

    /**
     * Actions run on a cron schedule, {@code * * * * *} by default.
     */
    public record Schedule(String cron, List<Expression> actions) implements AstFragment {

        public Schedule {
            actions = List.copyOf(actions);
        }

        @Override
        public List<AstNode> getChildren() {
            return List.copyOf(actions);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AUTOMATION;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(triggers, schedules);
    }
}
