package org.kal.compiler.ir;

import org.kal.compiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * Represents an instruction in the intermediate representation.
 *
 * @param opcode The operation.
 * @param result The register receiving the result, or null for {@link IrOpcode#RET}.
 * @param callee The called function for {@link IrOpcode#CALL}, otherwise null.
 * @param operands The operands, in order.
 * @param source The source position the instruction was lowered from.
 */
public record IrInstruction(
        IrOpcode opcode,
        IrRegister result,
        String callee,
        List<IrOperand> operands,
        SourceInfo source
) {

    public IrInstruction {
        Objects.requireNonNull(opcode, "opcode");
        operands = List.copyOf(operands);
    }

    /**
     * Creates a two-operand instruction such as {@code fadd}.
     * @param opcode The arithmetic or comparison opcode.
     * @param result The result register.
     * @param lhs The left operand.
     * @param rhs The right operand.
     * @param source The source position.
     * @return The instruction.
     */
    public static IrInstruction binary(IrOpcode opcode, IrRegister result, IrOperand lhs, IrOperand rhs, SourceInfo source) {
        return new IrInstruction(opcode, result, null, List.of(lhs, rhs), source);
    }

    /**
     * Creates a widening conversion from {@link IrType#BOOL} to {@link IrType#DOUBLE}.
     * @param result The result register.
     * @param value The boolean operand.
     * @param source The source position.
     * @return The instruction.
     */
    public static IrInstruction widen(IrRegister result, IrOperand value, SourceInfo source) {
        return new IrInstruction(IrOpcode.UITOFP, result, null, List.of(value), source);
    }

    /**
     * Creates a call instruction.
     * @param result The result register.
     * @param callee The name of the called function.
     * @param arguments The argument operands, in parameter order.
     * @param source The source position.
     * @return The instruction.
     */
    public static IrInstruction call(IrRegister result, String callee, List<IrOperand> arguments, SourceInfo source) {
        return new IrInstruction(IrOpcode.CALL, result, callee, arguments, source);
    }

    /**
     * Creates a return instruction.
     * @param value The returned value.
     * @param source The source position.
     * @return The instruction.
     */
    public static IrInstruction ret(IrOperand value, SourceInfo source) {
        return new IrInstruction(IrOpcode.RET, null, null, List.of(value), source);
    }
}
