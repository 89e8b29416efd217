package org.kal.compiler.diagnostics;

import org.kal.compiler.api.CompilerErrorCode;
import org.kal.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during compilation.
 * <p>
 * This decouples error reporting from the actual compiler logic (lexer, parser, lowering)
 * and from any printing of the messages.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param source   The position of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, source.fileName(), source.lineNumber()));
    }

    /**
     * Reports a warning.
     *
     * @param code     The warning code.
     * @param message  The warning message.
     * @param source   The position of the warning.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, source.fileName(), source.lineNumber()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Checks whether an error with the given code has been reported.
     *
     * @param code The code to look for.
     * @return {@code true} if such an error exists.
     */
    public boolean hasError(CompilerErrorCode code) {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR && d.code() == code);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the diagnostics collected since the given mark and leaves the engine untouched.
     * Used by callers that handle one construct at a time.
     *
     * @param mark A value previously returned by {@link #mark()}.
     * @return The diagnostics reported after the mark.
     */
    public List<Diagnostic> since(int mark) {
        return List.copyOf(diagnostics.subList(Math.min(mark, diagnostics.size()), diagnostics.size()));
    }

    /**
     * @return A mark for {@link #since(int)}.
     */
    public int mark() {
        return diagnostics.size();
    }

    /**
     * Removes all collected diagnostics.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
