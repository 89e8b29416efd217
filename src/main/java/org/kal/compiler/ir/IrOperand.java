package org.kal.compiler.ir;

/**
 * Base type for instruction operands in the IR.
 */
public sealed interface IrOperand permits IrConstant, IrParameter, IrRegister {

    /**
     * @return The type of the value this operand denotes.
     */
    IrType type();
}
