package org.zerox.compiler.frontend.parser.features.interop;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A JavaScript import, {@code js import { a, b } from "pkg"} or {@code js import X from "pkg"}.
 *
 * @param location        The position of <code>js</code>.
 * @param specifiers      The imported names.
 * @param source          The module specifier.
 * @param defaultImport   Whether this is a default import of a single name.
 */
public record JsImportNode(SourceLocation location, List<String> specifiers, String source, boolean defaultImport)
        implements AstNode {

    public JsImportNode {
        specifiers = List.copyOf(specifiers);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.JS_IMPORT;
    }
}
