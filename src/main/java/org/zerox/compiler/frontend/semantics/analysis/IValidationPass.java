package org.zerox.compiler.frontend.semantics.analysis;

import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.parser.features.container.ContainerNode;

/**
 * Interface for the independent static-analysis passes of the validator.
 * Each pass inspects one container at a time and reports its findings.
 */
@FunctionalInterface
public interface IValidationPass {
    /**
     * Analyzes a single container.
     * @param container   The page, component or app to analyze.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    void validate(ContainerNode container, DiagnosticsEngine diagnostics);
}
