package org.kal.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link ExprNode} kinds.
 *
 * @param <R> The return type of the visit methods.
 */
public interface ExprVisitor<R> {
    R visitNumber(NumberLiteralNode node);
    R visitVariable(VariableNode node);
    R visitBinary(BinaryNode node);
    R visitCall(CallNode node);
}
