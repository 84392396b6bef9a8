package org.zerox.compiler.frontend.semantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.features.container.ContainerNode;
import org.zerox.compiler.frontend.semantics.analysis.CircularDerivedPass;
import org.zerox.compiler.frontend.semantics.analysis.DuplicateDeclarationPass;
import org.zerox.compiler.frontend.semantics.analysis.IValidationPass;
import org.zerox.compiler.frontend.semantics.analysis.UnusedStatePass;

import java.util.List;

/**
 * Performs static analysis on a parsed AST before code generation.
 * Every top-level container ({@code page}, {@code component}, {@code app}) is handed to each
 * registered pass in turn; other top-level nodes are not analyzed.
 * <p>
 * Validation never throws for source problems and never modifies the AST. All findings are
 * collected and returned together.
 */
public class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final List<IValidationPass> passes;

    /**
     * Constructs a validator with the built-in passes: duplicate declarations, circular derived
     * values and unused state.
     */
    public Validator() {
        this(List.of(new DuplicateDeclarationPass(), new CircularDerivedPass(), new UnusedStatePass()));
    }

    /**
     * Constructs a validator with custom passes.
     * @param passes The passes, run in list order for each container.
     */
    public Validator(List<IValidationPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * Validates the given AST.
     * @param ast        The top-level nodes returned by the parser.
     * @param sourceName The source name used in the findings.
     * @return The errors and warnings found.
     */
    public ValidationResult validate(List<AstNode> ast, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sourceName);
        int containers = 0;
        for (AstNode node : ast) {
            if (node instanceof ContainerNode container) {
                containers++;
                for (IValidationPass pass : passes) {
                    pass.validate(container, diagnostics);
                }
            }
        }
        ValidationResult result = new ValidationResult(diagnostics.getErrors(), diagnostics.getWarnings());
        LOG.debug("Validated {} containers: {} errors, {} warnings",
                containers, result.errors().size(), result.warnings().size());
        return result;
    }

    /**
     * Validates the given AST for an unnamed source.
     * @param ast The top-level nodes returned by the parser.
     * @return The errors and warnings found.
     */
    public ValidationResult validate(List<AstNode> ast) {
        return validate(ast, DiagnosticsEngine.ANONYMOUS_SOURCE);
    }
}
