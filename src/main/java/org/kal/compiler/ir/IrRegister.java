package org.kal.compiler.ir;

/**
 * A virtual register holding the result of an instruction. Each register is assigned
 * exactly once within its function.
 *
 * @param name The register name, unique within the function.
 * @param type The type of the value.
 */
public record IrRegister(String name, IrType type) implements IrOperand {
}
