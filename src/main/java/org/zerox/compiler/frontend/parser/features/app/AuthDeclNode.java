package org.zerox.compiler.frontend.parser.features.app;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * Authentication setup: {@code auth provider="supabase":} with {@code login:}, {@code signup:},
 * {@code logout} and {@code guard:} lines.
 *
 * @param location     The position of <code>auth</code>.
 * @param provider     The provider, {@code custom} by default.
 * @param loginFields  The fields of the login form.
 * @param signupFields The fields of the signup form.
 * @param logout       Whether a logout action was declared.
 * @param guards       The role guards in source order.
 */
public record AuthDeclNode(
        SourceLocation location,
        String provider,
        List<String> loginFields,
        List<String> signupFields,
        boolean logout,
        List<Guard> guards
) implements AstNode {

    public AuthDeclNode {
        loginFields = List.copyOf(loginFields);
        signupFields = List.copyOf(signupFields);
        guards = List.copyOf(guards);
    }

    /**
     * {@code guard: role [-> redirect("/path")]}.
     *
     * @param redirect The redirect target, or {@code null}.
     */
    public record Guard(String role, String redirect) {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AUTH_DECL;
    }
}
