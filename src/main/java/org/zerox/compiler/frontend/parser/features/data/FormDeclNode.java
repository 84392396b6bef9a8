package org.zerox.compiler.frontend.parser.features.data;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;
import java.util.Map;

/**
 * A form with typed fields, per-field validation and a submit action.
 *
 * @param location The position of <code>form</code>.
 * @param name     The form name.
 * @param fields   The fields in source order.
 * @param submit   The submit button, or {@code null}.
 */
public record FormDeclNode(
        SourceLocation location,
        String name,
        List<FormField> fields,
        FormSubmit submit
) implements AstNode {

    public FormDeclNode {
        fields = List.copyOf(fields);
    }

    /**
     * {@code field name: Type} with an optional block of label, validations and properties.
     *
     * @param label       The label; the field name if none was given.
     * @param validations The rules in source order.
     * @param props       Any other {@code key: expr} lines.
     */
    public record FormField(
            String name,
            TypeExpr type,
            String label,
            List<FormValidation> validations,
            Map<String, Expression> props
    ) implements AstFragment {

        public FormField {
            validations = List.copyOf(validations);
            props = Props.copyOf(props);
        }

        @Override
        public List<AstNode> getChildren() {
            return Children.of(type, validations, props);
        }
    }

    /**
     * One rule of a field.
     *
     * @param rule    {@code required}, {@code min}, {@code max}, {@code format} or {@code pattern}.
     * @param value   The bound, format name or pattern; {@code null} for {@code required}.
     * @param message The message shown when the rule fails.
     */
    public record FormValidation(String rule, Expression value, String message) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return Children.of(value);
        }
    }

    /**
     * {@code submit "Label" -> action} with optional {@code success:} and {@code error:} reactions.
     */
    public record FormSubmit(String label, Expression action, Expression success, Expression error) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return Children.of(action, success, error);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FORM_DECL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(fields, submit);
    }
}
