package org.zerox.compiler.api;

import org.zerox.compiler.diagnostics.Diagnostic;
import org.zerox.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * The outcome of a successful compilation: the validated AST and the non-blocking warnings.
 *
 * @param ast      The top-level AST nodes in source order.
 * @param warnings The warnings reported by validation.
 */
public record CompilationResult(List<AstNode> ast, List<Diagnostic> warnings) {

    public CompilationResult {
        ast = List.copyOf(ast);
        warnings = List.copyOf(warnings);
    }

    /**
     * @return {@code true} if validation reported at least one warning.
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
