package org.zerox.compiler.frontend.semantics;

import org.zerox.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The findings of one {@link Validator#validate(List)} call.
 *
 * @param errors   Findings that block code generation, in report order.
 * @param warnings Findings that do not block code generation, in report order.
 */
public record ValidationResult(List<Diagnostic> errors, List<Diagnostic> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /**
     * @return {@code true} if at least one error was found.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return {@code true} if neither errors nor warnings were found.
     */
    public boolean isClean() {
        return errors.isEmpty() && warnings.isEmpty();
    }
}
