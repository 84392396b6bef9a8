package org.zerox.compiler.frontend.semantics.analysis;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.features.container.ContainerNode;
import org.zerox.compiler.frontend.parser.features.declaration.DerivedDeclNode;
import org.zerox.compiler.frontend.parser.features.declaration.PropDeclNode;
import org.zerox.compiler.frontend.parser.features.declaration.StateDeclNode;
import org.zerox.compiler.frontend.parser.features.function.FunctionNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports names declared more than once in the immediate body of a container.
 * <p>
 * States, derived values, props and functions share one namespace. The first declaration of a
 * name in source order wins and every later one is an error.
 */
public class DuplicateDeclarationPass implements IValidationPass {

    private record Declaration(String name, String kind, SourceLocation location) {
    }

    @Override
    public void validate(ContainerNode container, DiagnosticsEngine diagnostics) {
        Map<String, Declaration> seen = new HashMap<>();
        for (Declaration declaration : collect(container.body())) {
            Declaration first = seen.putIfAbsent(declaration.name(), declaration);
            if (first != null) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_DECLARATION,
                        "Duplicate declaration '" + declaration.name() + "' (" + declaration.kind()
                                + "), previously declared as " + first.kind() + " at line " + first.location().line(),
                        declaration.location());
            }
        }
    }

    private static List<Declaration> collect(List<AstNode> body) {
        List<Declaration> declarations = new ArrayList<>();
        for (AstNode node : body) {
            if (node instanceof StateDeclNode state) {
                declarations.add(new Declaration(state.name(), "state", state.location()));
            } else if (node instanceof DerivedDeclNode derived) {
                declarations.add(new Declaration(derived.name(), "derived", derived.location()));
            } else if (node instanceof PropDeclNode prop) {
                declarations.add(new Declaration(prop.name(), "prop", prop.location()));
            } else if (node instanceof FunctionNode function) {
                declarations.add(new Declaration(function.name(), "fn", function.location()));
            }
        }
        return declarations;
    }
}
