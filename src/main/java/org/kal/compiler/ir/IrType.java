package org.kal.compiler.ir;

/**
 * The value types of the IR. The language itself only has {@link #DOUBLE};
 * {@link #BOOL} exists for the result of comparisons before they are widened.
 */
public enum IrType {
    /** A 64-bit IEEE floating-point number. */
    DOUBLE("double"),
    /** A one-bit truth value. */
    BOOL("i1");

    private final String text;

    IrType(String text) {
        this.text = text;
    }

    /**
     * @return The spelling of this type in the textual IR.
     */
    public String text() {
        return text;
    }
}
