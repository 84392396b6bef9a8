package org.zerox.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Builds child lists for {@link AstNode#getChildren()}.
 */
public final class Children {

    private Children() {
    }

    /**
     * Flattens the given parts into one list, in argument order.
     * Accepts nodes, fragments, collections and maps (their values); {@code null} and any other
     * value, such as a name string, is skipped.
     *
     * @param parts The parts of a node.
     * @return An unmodifiable list of child nodes.
     */
    public static List<AstNode> of(Object... parts) {
        List<AstNode> children = new ArrayList<>();
        for (Object part : parts) {
            collect(part, children);
        }
        return List.copyOf(children);
    }

    private static void collect(Object part, List<AstNode> into) {
        if (part instanceof AstNode node) {
            into.add(node);
        } else if (part instanceof AstFragment fragment) {
            into.addAll(fragment.getChildren());
        } else if (part instanceof Collection<?> collection) {
            for (Object element : collection) {
                collect(element, into);
            }
        } else if (part instanceof Map<?, ?> map) {
            for (Object value : map.values()) {
                collect(value, into);
            }
        }
    }
}
