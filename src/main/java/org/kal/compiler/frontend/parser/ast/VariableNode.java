package org.kal.compiler.frontend.parser.ast;

import org.kal.compiler.api.SourceInfo;

/**
 * An AST node that references a variable by name.
 *
 * @param name The name of the variable.
 * @param source The position of the reference.
 */
public record VariableNode(
        String name,
        SourceInfo source
) implements ExprNode {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
