package org.zerox.compiler.frontend.parser.ast.expression;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A string with {@code {expr}} interpolation segments.
 *
 * @param location The position of the string literal.
 * @param parts    Literal text and interpolated expressions, in order.
 */
public record TemplateExpr(SourceLocation location, List<Part> parts) implements Expression {

    public TemplateExpr {
        parts = List.copyOf(parts);
    }

    /**
     * A segment of a template.
     */
    public sealed interface Part permits Text, Interpolation {
    }

    /** Literal text between interpolations. */
    public record Text(String value) implements Part {
    }

    /** An interpolated expression. */
    public record Interpolation(Expression expression) implements Part {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEMPLATE;
    }

    @Override
    public List<AstNode> getChildren() {
        return parts.stream()
                .filter(Interpolation.class::isInstance)
                .<AstNode>map(part -> ((Interpolation) part).expression())
                .toList();
    }
}
