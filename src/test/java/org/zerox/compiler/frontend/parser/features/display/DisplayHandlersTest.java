package org.zerox.compiler.frontend.parser.features.display;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.zerox.compiler.frontend.parser.Parser;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.BooleanLiteral;
import org.zerox.compiler.frontend.parser.ast.expression.NumberLiteral;
import org.zerox.compiler.frontend.parser.features.container.PageNode;
import org.zerox.compiler.frontend.parser.features.ui.TextNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the data display elements.
 */
public class DisplayHandlersTest {

    private static List<AstNode> body(String... lines) {
        List<String> source = new ArrayList<>();
        source.add("page P:");
        for (String line : lines) {
            source.add("  " + line);
        }
        return ((PageNode) Parser.parse(String.join("\n", source)).get(0)).body();
    }

    /**
     * Verifies the column kinds of a table and its feature settings.
     */
    @Test
    @Tag("unit")
    void tableColumns() {
        // Act
        TableNode table = (TableNode) body(
                "table users:",
                "  column \"Name\" name sortable searchable",
                "  column \"Joined\" createdAt format=date",
                "  select",
                "  actions: [edit, delete]",
                "  features:",
                "    pagination: 20").get(0);

        // Assert
        assertThat(table.dataSource()).isEqualTo("users");
        assertThat(table.columns()).hasSize(4);
        assertThat(table.columns().get(0)).isEqualTo(
                new TableNode.FieldColumn("name", "Name", true, true, false, null));
        assertThat(table.columns().get(1)).isEqualTo(
                new TableNode.FieldColumn("createdAt", "Joined", false, false, false, "date"));
        assertThat(table.columns().get(2)).isInstanceOf(TableNode.SelectColumn.class);
        assertThat(table.columns().get(3)).isEqualTo(new TableNode.ActionsColumn(List.of("edit", "delete")));
        assertThat(table.features()).containsOnlyKeys("pagination");
    }

    /**
     * Verifies chart types and stat cards in a grid.
     */
    @Test
    @Tag("unit")
    void chartsAndStats() {
        // Act
        List<AstNode> body = body(
                "chart line sales:",
                "  data: revenue",
                "stats 3:",
                "  stat \"Users\" value=count change=5 icon=\"user\"",
                "  stat \"Revenue\" highlighted");

        // Assert
        ChartNode chart = (ChartNode) body.get(0);
        assertThat(chart.chartType()).isEqualTo("line");
        assertThat(chart.name()).isEqualTo("sales");
        assertThat(chart.props()).containsOnlyKeys("data");

        StatsGridNode grid = (StatsGridNode) body.get(1);
        assertThat(grid.cols()).isEqualTo(3);
        assertThat(grid.stats()).extracting(StatNode::label).containsExactly("Users", "Revenue");
        StatNode users = grid.stats().get(0);
        assertThat(users.icon()).isEqualTo("user");
        assertThat(users.change()).isInstanceOf(NumberLiteral.class);
        StatNode revenue = grid.stats().get(1);
        assertThat(revenue.value()).isInstanceOfSatisfying(NumberLiteral.class,
                value -> assertThat(value.value()).isZero());
        assertThat(revenue.props().get("highlighted")).isInstanceOf(BooleanLiteral.class);
    }

    /**
     * Verifies upload settings, including the bare preview flag.
     */
    @Test
    @Tag("unit")
    void uploadSettings() {
        UploadNode upload = (UploadNode) body(
                "upload avatar:",
                "  accept: \"image/*\"",
                "  maxSize: 5",
                "  preview",
                "  action: save(file)").get(0);

        assertThat(upload.accept()).isEqualTo("image/*");
        assertThat(upload.maxSize()).isEqualTo(5.0);
        assertThat(upload.preview()).isTrue();
        assertThat(upload.action()).isNotNull();
    }

    /**
     * Verifies modal title and trigger, and toast type and duration.
     */
    @Test
    @Tag("unit")
    void modalAndToast() {
        // Act
        List<AstNode> body = body(
                "modal confirmDelete title=\"Delete?\" trigger=\"Delete\":",
                "  text \"Are you sure?\"",
                "toast \"Saved\" type=success duration=3000");

        // Assert
        ModalNode modal = (ModalNode) body.get(0);
        assertThat(modal.title()).isEqualTo("Delete?");
        assertThat(modal.trigger()).isEqualTo("Delete");
        assertThat(modal.body()).singleElement().isInstanceOf(TextNode.class);

        ToastNode toast = (ToastNode) body.get(1);
        assertThat(toast.toastType()).isEqualTo("success");
        assertThat(toast.duration()).isEqualTo(3000.0);
    }
}
