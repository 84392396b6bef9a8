package org.zerox.compiler.frontend.parser.features.pattern;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

/**
 * A confirmation dialog: {@code confirm "Delete?" danger confirm="Yes" cancel="No" description="..."}.
 *
 * @param description  The secondary text, or {@code null}.
 * @param confirmLabel The confirm button label, {@code Confirm} by default.
 * @param cancelLabel  The cancel button label, {@code Cancel} by default.
 * @param danger       Whether the action is destructive.
 */
public record ConfirmNode(
        SourceLocation location,
        String message,
        String description,
        String confirmLabel,
        String cancelLabel,
        boolean danger
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CONFIRM;
    }
}
