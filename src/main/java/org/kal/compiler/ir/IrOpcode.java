package org.kal.compiler.ir;

/**
 * The operations of the IR.
 */
public enum IrOpcode {
    /** Floating-point addition. */
    FADD("fadd"),
    /** Floating-point subtraction. */
    FSUB("fsub"),
    /** Floating-point multiplication. */
    FMUL("fmul"),
    /** Unordered-or-less-than comparison, producing a {@link IrType#BOOL}. */
    FCMP_ULT("fcmp ult"),
    /** Widens a {@link IrType#BOOL} to 0.0 or 1.0. */
    UITOFP("uitofp"),
    /** Calls a function of the module. */
    CALL("call"),
    /** Returns from the function. Always the last instruction of a body. */
    RET("ret");

    private final String mnemonic;

    IrOpcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    /**
     * @return The spelling of this opcode in the textual IR.
     */
    public String mnemonic() {
        return mnemonic;
    }
}
