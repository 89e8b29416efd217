package org.kal.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** Represents the end of the input. Returned on every call once the input is exhausted. */
    END_OF_FILE,

    // Keywords.
    /** The keyword {@code def}, introducing a function definition. */
    DEF,
    /** The keyword {@code extern}, introducing a declaration without a body. */
    EXTERN,

    // Primaries.
    /** An identifier, such as a function or parameter name. */
    IDENTIFIER,
    /** A numeric literal. */
    NUMBER,

    /** Any other single character, returned verbatim (operators, parentheses, commas, ';'). */
    CHARACTER
}
