package org.zerox.compiler.frontend.parser.features.display;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.Props;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;
import java.util.Map;

/**
 * A data table bound to a collection.
 * <p>
 * Columns come from {@code column "Label" field [sortable] [searchable] [filterable] [format=name(arg)]},
 * {@code select} and {@code actions: [edit, delete]} lines, directly or inside a {@code columns:} block.
 * A {@code features:} block holds table-wide options.
 *
 * @param location   The position of <code>table</code>.
 * @param dataSource The name of the displayed collection. It counts as a use of that name.
 * @param columns    The columns in source order.
 * @param features   The table options.
 */
public record TableNode(
        SourceLocation location,
        String dataSource,
        List<Column> columns,
        Map<String, Expression> features
) implements AstNode {

    public TableNode {
        columns = List.copyOf(columns);
        features = Props.copyOf(features);
    }

    /**
     * A table column.
     */
    public sealed interface Column permits FieldColumn, SelectColumn, ActionsColumn {
    }

    /**
     * Displays one field of each row.
     *
     * @param field  The field path, possibly dotted.
     * @param label  The header text.
     * @param format The display format such as {@code currency(KRW)}, or {@code null}.
     */
    public record FieldColumn(
            String field,
            String label,
            boolean sortable,
            boolean searchable,
            boolean filterable,
            String format
    ) implements Column {
    }

    /**
     * A row selection checkbox.
     */
    public record SelectColumn() implements Column {
    }

    /**
     * Row action buttons.
     */
    public record ActionsColumn(List<String> actions) implements Column {

        public ActionsColumn {
            actions = List.copyOf(actions);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(features);
    }
}
