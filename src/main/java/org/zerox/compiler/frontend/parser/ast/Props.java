package org.zerox.compiler.frontend.parser.ast;

import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for property maps, which keep their insertion order.
 */
public final class Props {

    private Props() {
    }

    /**
     * @param props The properties as parsed.
     * @return An unmodifiable, insertion-ordered copy.
     */
    public static Map<String, Expression> copyOf(Map<String, Expression> props) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(props));
    }

    /**
     * @return A new mutable, insertion-ordered map for a parser to fill.
     */
    public static Map<String, Expression> builder() {
        return new LinkedHashMap<>();
    }
}
