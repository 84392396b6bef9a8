package org.zerox.compiler.frontend.parser.features.data;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstFragment;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;
import org.zerox.compiler.frontend.parser.ast.type.TypeExpr;

import java.util.List;

/**
 * A data model: typed fields plus optional {@code validate:}, {@code permission:} blocks and
 * {@code search:}, {@code sort:}, {@code filter:} field lists.
 *
 * @param location    The position of <code>model</code>.
 * @param name        The model name.
 * @param fields      The fields in source order.
 * @param validations The model-level rules.
 * @param permissions The role required for each action.
 * @param search      The searchable field names.
 * @param sort        The sortable field names.
 * @param filter      The filterable field names.
 */
public record ModelNode(
        SourceLocation location,
        String name,
        List<Field> fields,
        List<Validation> validations,
        List<Permission> permissions,
        List<String> search,
        List<String> sort,
        List<String> filter
) implements AstNode {

    public ModelNode {
        fields = List.copyOf(fields);
        validations = List.copyOf(validations);
        permissions = List.copyOf(permissions);
        search = List.copyOf(search);
        sort = List.copyOf(sort);
        filter = List.copyOf(filter);
    }

    /**
     * A field, {@code name: Type [= default]}.
     *
     * @param defaultValue The default, or {@code null}.
     */
    public record Field(String name, TypeExpr type, Expression defaultValue) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return Children.of(type, defaultValue);
        }
    }

    /**
     * A rule, {@code condition "message"}.
     */
    public record Validation(Expression condition, String message) implements AstFragment {

        @Override
        public List<AstNode> getChildren() {
            return List.of(condition);
        }
    }

    /**
     * {@code action: role}, e.g. {@code delete: admin}.
     */
    public record Permission(String action, String role) {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODEL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(fields, validations);
    }
}
