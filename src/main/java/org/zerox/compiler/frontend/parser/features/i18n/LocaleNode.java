package org.zerox.compiler.frontend.parser.features.i18n;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * Locale formatting settings such as currency and date format.
 */
public record LocaleNode(
        SourceLocation location,
        Map<String, Expression> props
) implements AstNode {

    public LocaleNode {
        props = Props.copyOf(props);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOCALE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(props);
    }
}
