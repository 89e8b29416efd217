package org.kal.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical name of the input (a file path or {@code <stdin>}).
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Position used for synthesized nodes that have no place in the source. */
    public static final SourceInfo UNKNOWN = new SourceInfo("unknown", -1, -1);

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
