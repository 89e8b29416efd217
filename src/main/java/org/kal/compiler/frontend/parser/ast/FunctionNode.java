package org.kal.compiler.frontend.parser.ast;

import org.kal.compiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A function definition: a prototype together with the body expression.
 *
 * @param prototype The signature of the function.
 * @param body The expression the function returns.
 */
public record FunctionNode(
        PrototypeNode prototype,
        ExprNode body
) implements AstNode {

    public FunctionNode {
        Objects.requireNonNull(prototype, "prototype");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(prototype, body);
    }

    @Override
    public SourceInfo source() {
        return prototype.isAnonymous() ? body.source() : prototype.source();
    }
}
