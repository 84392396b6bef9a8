package org.zerox.compiler.frontend.parser.features.display;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;

import java.util.List;

/**
 * A dialog: {@code modal confirmDelete title="Delete?" trigger="Delete":} with a UI body.
 *
 * @param title   The dialog title, the name by default.
 * @param trigger The label of the opening button, or {@code null}.
 */
public record ModalNode(
        SourceLocation location,
        String name,
        String title,
        String trigger,
        List<AstNode> body
) implements AstNode {

    public ModalNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODAL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body);
    }
}
