package org.zerox.compiler.frontend.semantics.analysis;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.features.container.ContainerNode;
import org.zerox.compiler.frontend.parser.features.declaration.StateDeclNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Warns about state that nothing in its container reads.
 * <p>
 * A state counts as used when its name is referenced anywhere in the container body outside the
 * state declarations themselves; see {@link References#used(List)} for what counts as a reference.
 */
public class UnusedStatePass implements IValidationPass {

    @Override
    public void validate(ContainerNode container, DiagnosticsEngine diagnostics) {
        List<StateDeclNode> states = new ArrayList<>();
        List<AstNode> rest = new ArrayList<>();
        for (AstNode node : container.body()) {
            if (node instanceof StateDeclNode state) {
                states.add(state);
            } else {
                rest.add(node);
            }
        }
        if (states.isEmpty()) {
            return;
        }

        Set<String> used = References.used(rest);
        for (StateDeclNode state : states) {
            if (!used.contains(state.name())) {
                diagnostics.reportWarning(CompilerErrorCode.UNUSED_STATE,
                        "State '" + state.name() + "' is declared but never used (unused)", state.location());
            }
        }
    }
}
