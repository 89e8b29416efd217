package org.kal.compiler.frontend.parser.ast;

import org.kal.compiler.api.SourceInfo;

/**
 * An AST node that represents a numeric literal such as {@code 1.0}.
 *
 * @param value The value of the literal.
 * @param source The position of the literal.
 */
public record NumberLiteralNode(
        double value,
        SourceInfo source
) implements ExprNode {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
