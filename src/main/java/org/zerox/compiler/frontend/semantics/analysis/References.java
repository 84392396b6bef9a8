package org.zerox.compiler.frontend.semantics.analysis;

import org.zerox.compiler.frontend.TreeWalker;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.expression.IdentifierExpr;
import org.zerox.compiler.frontend.parser.features.display.TableNode;
import org.zerox.compiler.frontend.parser.features.lifecycle.WatchNode;
import org.zerox.compiler.frontend.parser.features.pattern.FilterNode;
import org.zerox.compiler.frontend.parser.features.pattern.SearchNode;
import org.zerox.compiler.frontend.parser.features.ui.InputNode;
import org.zerox.compiler.frontend.parser.features.ui.SelectNode;
import org.zerox.compiler.frontend.parser.features.ui.ToggleNode;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Collects the names a subtree refers to, using a {@link TreeWalker}.
 */
final class References {

    private References() {
    }

    /**
     * @param root The subtree, usually an expression.
     * @return The names of every identifier expression in the subtree.
     */
    static Set<String> identifiers(AstNode root) {
        Set<String> names = new LinkedHashSet<>();
        new TreeWalker(Map.of(IdentifierExpr.class, node -> names.add(((IdentifierExpr) node).name()))).walk(root);
        return names;
    }

    /**
     * Collects every name read by the given nodes: identifier expressions, the bindings of
     * {@code input} and {@code select}, the first segment of a {@code toggle} binding, watched
     * variables, table data sources, and the targets of {@code search} and {@code filter}.
     *
     * @param nodes The nodes to scan.
     * @return The referenced names.
     */
    static Set<String> used(List<AstNode> nodes) {
        Set<String> names = new LinkedHashSet<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(IdentifierExpr.class, node -> names.add(((IdentifierExpr) node).name()));
        handlers.put(InputNode.class, node -> names.add(((InputNode) node).binding()));
        handlers.put(SelectNode.class, node -> names.add(((SelectNode) node).binding()));
        handlers.put(ToggleNode.class, node -> names.add(firstSegment(((ToggleNode) node).binding())));
        handlers.put(WatchNode.class, node -> names.add(((WatchNode) node).variable()));
        handlers.put(TableNode.class, node -> names.add(((TableNode) node).dataSource()));
        handlers.put(SearchNode.class, node -> names.add(((SearchNode) node).target()));
        handlers.put(FilterNode.class, node -> names.add(((FilterNode) node).target()));
        new TreeWalker(handlers).walk(nodes);
        return names;
    }

    private static String firstSegment(String binding) {
        int dot = binding.indexOf('.');
        return dot < 0 ? binding : binding.substring(0, dot);
    }
}
