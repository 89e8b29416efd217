package org.kal.runtime;

import org.kal.compiler.ir.IrConstant;
import org.kal.compiler.ir.IrFunction;
import org.kal.compiler.ir.IrInstruction;
import org.kal.compiler.ir.IrModule;
import org.kal.compiler.ir.IrOperand;
import org.kal.compiler.ir.IrParameter;
import org.kal.compiler.ir.IrRegister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes functions of an {@link IrModule} directly. Declaration-only functions are
 * resolved against a {@link NativeFunctions} table at call time.
 * <p>
 * Booleans produced by comparisons are carried as 0.0 and 1.0 internally. The interpreter
 * is not thread-safe.
 */
public final class IrInterpreter {

    /** Default limit for nested calls, guarding against unbounded recursion. */
    public static final int DEFAULT_MAX_CALL_DEPTH = 512;

    private static final Logger LOG = LoggerFactory.getLogger(IrInterpreter.class);

    private final IrModule module;
    private final NativeFunctions natives;
    private final int maxCallDepth;
    private int depth = 0;

    /**
     * @param module The module whose functions are executed.
     * @param natives The host functions externs bind to.
     */
    public IrInterpreter(IrModule module, NativeFunctions natives) {
        this(module, natives, DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * @param module The module whose functions are executed.
     * @param natives The host functions externs bind to.
     * @param maxCallDepth The maximum number of nested calls.
     */
    public IrInterpreter(IrModule module, NativeFunctions natives, int maxCallDepth) {
        this.module = module;
        this.natives = natives;
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * Calls a function of the module.
     * @param name The function name.
     * @param arguments The argument values.
     * @return The returned value.
     * @throws IrExecutionException if the function is unknown, called with the wrong number of
     *         arguments, unresolved, or the call depth limit is exceeded.
     */
    public double call(String name, double... arguments) {
        IrFunction function = module.getFunction(name)
                .orElseThrow(() -> new IrExecutionException("Unknown function '" + name + "'."));
        if (function.arity() != arguments.length) {
            throw new IrExecutionException("Function '" + name + "' takes " + function.arity()
                    + " argument(s) but was called with " + arguments.length + ".");
        }
        if (function.isDeclaration()) {
            return natives.lookup(name, function.arity())
                    .orElseThrow(() -> new IrExecutionException("Unresolved external function '" + name
                            + "' with " + function.arity() + " parameter(s)."))
                    .invoke(arguments);
        }
        if (depth >= maxCallDepth) {
            throw new IrExecutionException("Maximum call depth of " + maxCallDepth + " exceeded in '" + name + "'.");
        }
        depth++;
        try {
            return execute(function, arguments);
        } finally {
            depth--;
        }
    }

    private double execute(IrFunction function, double[] arguments) {
        Map<String, Double> registers = new HashMap<>();
        for (IrInstruction instruction : function.body()) {
            List<IrOperand> ops = instruction.operands();
            double value;
            switch (instruction.opcode()) {
                case FADD -> value = read(ops.get(0), registers, arguments) + read(ops.get(1), registers, arguments);
                case FSUB -> value = read(ops.get(0), registers, arguments) - read(ops.get(1), registers, arguments);
                case FMUL -> value = read(ops.get(0), registers, arguments) * read(ops.get(1), registers, arguments);
                case FCMP_ULT -> {
                    double a = read(ops.get(0), registers, arguments);
                    double b = read(ops.get(1), registers, arguments);
                    value = (Double.isNaN(a) || Double.isNaN(b) || a < b) ? 1.0 : 0.0;
                }
                case UITOFP -> value = read(ops.get(0), registers, arguments);
                case CALL -> {
                    double[] callArguments = new double[ops.size()];
                    for (int i = 0; i < ops.size(); i++) {
                        callArguments[i] = read(ops.get(i), registers, arguments);
                    }
                    value = call(instruction.callee(), callArguments);
                }
                case RET -> {
                    double result = read(ops.get(0), registers, arguments);
                    LOG.trace("'{}' returned {}", function.name(), result);
                    return result;
                }
                default -> throw new IllegalStateException("Unhandled opcode " + instruction.opcode());
            }
            registers.put(instruction.result().name(), value);
        }
        throw new IllegalStateException("Function '" + function.name() + "' has no ret instruction");
    }

    private double read(IrOperand operand, Map<String, Double> registers, double[] arguments) {
        if (operand instanceof IrConstant c) return c.value();
        if (operand instanceof IrParameter p) return arguments[p.index()];
        if (operand instanceof IrRegister r) {
            Double value = registers.get(r.name());
            if (value == null) throw new IllegalStateException("Register %" + r.name() + " read before assignment");
            return value;
        }
        throw new IllegalStateException("Unknown operand " + operand);
    }
}
