package org.kal.compiler.frontend.parser.ast;

import org.kal.compiler.api.SourceInfo;

import java.util.List;

/**
 * An AST node for a function call. The argument order is the evaluation order
 * and binds arguments to parameters by position.
 *
 * @param callee The name of the called function.
 * @param arguments The argument expressions.
 * @param source The position of the callee name.
 */
public record CallNode(
        String callee,
        List<ExprNode> arguments,
        SourceInfo source
) implements ExprNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
