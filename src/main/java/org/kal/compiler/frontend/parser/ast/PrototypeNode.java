package org.kal.compiler.frontend.parser.ast;

import org.kal.compiler.api.SourceInfo;

import java.util.List;

/**
 * The "prototype" of a function: its name and parameter names, and implicitly
 * the number of arguments it takes. Parameter names are not checked for uniqueness here.
 *
 * @param name The function name. Empty for the wrapper of an anonymous top-level expression.
 * @param parameterNames The parameter names in declaration order.
 * @param source The position of the function name.
 */
public record PrototypeNode(
        String name,
        List<String> parameterNames,
        SourceInfo source
) implements AstNode {

    public PrototypeNode {
        parameterNames = List.copyOf(parameterNames);
    }

    /**
     * @return The number of parameters.
     */
    public int arity() {
        return parameterNames.size();
    }

    /**
     * @return true if this prototype wraps an anonymous top-level expression.
     */
    public boolean isAnonymous() {
        return name.isEmpty();
    }
}
