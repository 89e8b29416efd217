package org.kal.compiler.ir;

/**
 * A formal parameter of the enclosing function, identified by position.
 * The name is kept for readability of the printed IR only.
 *
 * @param index The zero-based parameter position.
 * @param name The parameter name.
 */
public record IrParameter(int index, String name) implements IrOperand {

    @Override
    public IrType type() {
        return IrType.DOUBLE;
    }
}
