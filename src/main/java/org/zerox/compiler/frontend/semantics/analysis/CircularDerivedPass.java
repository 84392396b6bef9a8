package org.zerox.compiler.frontend.semantics.analysis;

import org.zerox.compiler.api.CompilerErrorCode;
import org.zerox.compiler.diagnostics.DiagnosticsEngine;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.features.container.ContainerNode;
import org.zerox.compiler.frontend.parser.features.declaration.DerivedDeclNode;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reports cycles among the derived values of a container.
 * <p>
 * The dependency graph has one vertex per derived value and an edge to every other derived value
 * (or itself) its expression references. A depth-first search from each unvisited vertex, in
 * declaration order, stops at the first back edge and reports the derived value that edge points to.
 */
public class CircularDerivedPass implements IValidationPass {

    @Override
    public void validate(ContainerNode container, DiagnosticsEngine diagnostics) {
        Map<String, DerivedDeclNode> declarations = new LinkedHashMap<>();
        for (AstNode node : container.body()) {
            if (node instanceof DerivedDeclNode derived) {
                declarations.putIfAbsent(derived.name(), derived);
            }
        }

        Map<String, Set<String>> graph = new LinkedHashMap<>();
        declarations.forEach((name, derived) -> {
            Set<String> dependencies = new LinkedHashSet<>(References.identifiers(derived.expression()));
            dependencies.retainAll(declarations.keySet());
            graph.put(name, dependencies);
        });

        Set<String> visited = new HashSet<>();
        for (String name : graph.keySet()) {
            if (visited.contains(name)) {
                continue;
            }
            findBackEdgeTarget(name, graph, visited, new HashSet<>()).ifPresent(target ->
                    diagnostics.reportError(CompilerErrorCode.CIRCULAR_DERIVED,
                            "Circular dependency detected in derived '" + target + "'",
                            declarations.get(target).location()));
        }
    }

    private static Optional<String> findBackEdgeTarget(String vertex, Map<String, Set<String>> graph,
                                                       Set<String> visited, Set<String> onStack) {
        visited.add(vertex);
        onStack.add(vertex);
        for (String dependency : graph.get(vertex)) {
            if (onStack.contains(dependency)) {
                return Optional.of(dependency);
            }
            if (!visited.contains(dependency)) {
                Optional<String> target = findBackEdgeTarget(dependency, graph, visited, onStack);
                if (target.isPresent()) {
                    return target;
                }
            }
        }
        onStack.remove(vertex);
        return Optional.empty();
    }
}
