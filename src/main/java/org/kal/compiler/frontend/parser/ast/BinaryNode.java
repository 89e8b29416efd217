package org.kal.compiler.frontend.parser.ast;

import org.kal.compiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * An AST node for a binary operation such as {@code a + b}.
 *
 * @param operator The operator character.
 * @param left The left operand.
 * @param right The right operand.
 * @param source The position of the operator.
 */
public record BinaryNode(
        char operator,
        ExprNode left,
        ExprNode right,
        SourceInfo source
) implements ExprNode {

    public BinaryNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
