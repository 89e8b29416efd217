package org.kal.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error message texts.
 */
public enum CompilerErrorCode {
    // region Lexer
    /** A numeric literal such as {@code 1.2.3} was read leniently. Reported as a warning. */
    MALFORMED_NUMBER_LITERAL(Category.LEXICAL),
    // endregion

    // region Parser
    /** A primary expression was expected but another token was found. */
    EXPECTED_EXPRESSION(Category.SYNTAX),
    /** A parenthesized expression was not closed. */
    EXPECTED_CLOSING_PAREN(Category.SYNTAX),
    /** An argument list continued with something other than ',' or ')'. */
    EXPECTED_ARGUMENT_SEPARATOR(Category.SYNTAX),
    /** A prototype did not start with an identifier. */
    EXPECTED_FUNCTION_NAME(Category.SYNTAX),
    /** A prototype name was not followed by '('. */
    EXPECTED_PROTOTYPE_OPEN_PAREN(Category.SYNTAX),
    /** A prototype parameter list was not closed with ')'. */
    EXPECTED_PROTOTYPE_CLOSE_PAREN(Category.SYNTAX),
    // endregion

    // region Lowering
    /** A variable was referenced that is not a parameter of the enclosing function. */
    UNKNOWN_VARIABLE(Category.SEMANTIC),
    /** A call referenced a function that was never declared or defined. */
    UNKNOWN_FUNCTION(Category.SEMANTIC),
    /** A call passed a different number of arguments than the callee declares. */
    ARGUMENT_COUNT_MISMATCH(Category.SEMANTIC),
    /** A binary operator has a precedence but no lowering rule. */
    INVALID_BINARY_OPERATOR(Category.SEMANTIC),
    /** A function that already has a body was defined again. */
    FUNCTION_REDEFINITION(Category.SEMANTIC),
    /** A declaration or definition disagrees with the arity of an earlier declaration. */
    SIGNATURE_MISMATCH(Category.SEMANTIC),
    /** Two parameters of one prototype share a name. Reported as a warning. */
    DUPLICATE_PARAMETER(Category.SEMANTIC),
    // endregion

    // region General
    /** The character source failed while being read. */
    IO_ERROR_READING_INPUT(Category.IO);
    // endregion

    /**
     * The coarse error class a code belongs to.
     */
    public enum Category {
        /** Raised while turning characters into tokens. */
        LEXICAL,
        /** An unexpected or missing token. */
        SYNTAX,
        /** A well-formed construct that cannot be lowered. */
        SEMANTIC,
        /** The input itself could not be read. */
        IO
    }

    private final Category category;

    CompilerErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The category this code belongs to.
     */
    public Category category() {
        return category;
    }
}
