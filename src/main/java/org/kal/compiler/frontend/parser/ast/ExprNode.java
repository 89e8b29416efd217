package org.kal.compiler.frontend.parser.ast;

/**
 * An expression. The set of expression kinds is closed: every consumer handles all of them
 * through {@link ExprVisitor}, so adding a kind is a compile error until each consumer knows it.
 */
public sealed interface ExprNode extends AstNode
        permits NumberLiteralNode, VariableNode, BinaryNode, CallNode {

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(ExprVisitor<R> visitor);
}
