package org.zerox.compiler.frontend.parser.features.app;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * Role definitions: {@code roles:} followed by {@code name:} blocks with a {@code can:} list.
 */
public record RoleDeclNode(
        SourceLocation location,
        List<Role> roles
) implements AstNode {

    public RoleDeclNode {
        roles = List.copyOf(roles);
    }

    /**
     * One role.
     *
     * @param inherits The inherited roles; the current grammar has no syntax for them, so it is always empty.
     * @param can      The granted permissions.
     */
    public record Role(String name, List<String> inherits, List<String> can) {

        public Role {
            inherits = List.copyOf(inherits);
            can = List.copyOf(can);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ROLE_DECL;
    }
}
