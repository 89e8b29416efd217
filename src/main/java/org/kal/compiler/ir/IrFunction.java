package org.kal.compiler.ir;

import org.kal.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A function of the IR module. Every parameter and the return value are {@link IrType#DOUBLE}.
 * A function without instructions is a declaration only (an {@code extern}); a defined function
 * has a body ending in a single {@link IrOpcode#RET}.
 *
 * @param name The function name.
 * @param parameterNames The parameter names, for documentation of the printed IR.
 * @param body The instructions; empty for a declaration.
 * @param source The position of the prototype this function was lowered from.
 */
public record IrFunction(
        String name,
        List<String> parameterNames,
        List<IrInstruction> body,
        SourceInfo source
) {

    public IrFunction {
        parameterNames = List.copyOf(parameterNames);
        body = List.copyOf(body);
    }

    /**
     * Creates a declaration without a body.
     * @param name The function name.
     * @param parameterNames The parameter names.
     * @param source The source position.
     * @return The declaration.
     */
    public static IrFunction declaration(String name, List<String> parameterNames, SourceInfo source) {
        return new IrFunction(name, parameterNames, List.of(), source);
    }

    /**
     * @return true if this function has no body yet.
     */
    public boolean isDeclaration() {
        return body.isEmpty();
    }

    /**
     * @return The number of parameters.
     */
    public int arity() {
        return parameterNames.size();
    }

    /**
     * @return The formal parameters as operands, in order.
     */
    public List<IrParameter> parameters() {
        List<IrParameter> parameters = new ArrayList<>(parameterNames.size());
        for (int i = 0; i < parameterNames.size(); i++) {
            parameters.add(new IrParameter(i, parameterNames.get(i)));
        }
        return parameters;
    }
}
