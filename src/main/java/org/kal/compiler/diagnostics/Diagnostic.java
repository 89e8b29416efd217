package org.kal.compiler.diagnostics;

import org.kal.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message (error, warning) that occurs
 * while tokenizing, parsing or lowering a construct.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code identifying the problem.
 * @param message The diagnostic message.
 * @param fileName The name of the input where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts the current top-level construct. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
