package org.zerox.compiler.frontend.parser.features.display;

import org.zerox.compiler.api.SourceLocation;
import org.zerox.compiler.frontend.parser.ast.AstNode;
import org.zerox.compiler.frontend.parser.ast.Children;
import org.zerox.compiler.frontend.parser.ast.NodeKind;
import org.zerox.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A file upload field with optional {@code accept}, {@code maxSize}, {@code preview} and
 * {@code action} settings.
 *
 * @param accept  The accepted MIME pattern, or {@code null}.
 * @param maxSize The size limit, or {@code null}.
 * @param preview Whether a preview is shown.
 * @param action  The upload action, or {@code null}.
 */
public record UploadNode(
        SourceLocation location,
        String name,
        String accept,
        Double maxSize,
        boolean preview,
        Expression action
) implements AstNode {

    @Override
    public NodeKind kind() {
        return NodeKind.UPLOAD;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(action);
    }
}
