package org.kal.compiler.ir;

/**
 * A floating-point constant operand.
 *
 * @param value The constant value.
 */
public record IrConstant(double value) implements IrOperand {

    @Override
    public IrType type() {
        return IrType.DOUBLE;
    }
}
