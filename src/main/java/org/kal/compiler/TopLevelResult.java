package org.kal.compiler;

import org.kal.compiler.diagnostics.Diagnostic;
import org.kal.compiler.ir.IrFunction;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * The outcome of handling one top-level construct.
 *
 * @param kind What kind of construct was handled.
 * @param function The lowered function, or null if parsing or lowering failed.
 * @param value The value of an evaluated top-level expression, or null.
 * @param executionError The message of a failed evaluation, or null.
 * @param diagnostics The diagnostics reported while handling this construct.
 */
public record TopLevelResult(
        Kind kind,
        IrFunction function,
        Double value,
        String executionError,
        List<Diagnostic> diagnostics
) {

    /**
     * The kinds of top-level constructs.
     */
    public enum Kind {
        /** {@code def name(params) body} */
        DEFINITION,
        /** {@code extern name(params)} */
        EXTERN,
        /** A bare expression, lowered into an anonymous function. */
        EXPRESSION,
        /** A top-level {@code ;}, ignored. */
        SEPARATOR,
        /** The input is exhausted. */
        END_OF_INPUT
    }

    public TopLevelResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The lowered function, if the construct got that far.
     */
    public Optional<IrFunction> loweredFunction() {
        return Optional.ofNullable(function);
    }

    /**
     * @return The evaluated value of a top-level expression.
     */
    public OptionalDouble evaluatedValue() {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * @return true if no error diagnostic was reported and evaluation, if any, succeeded.
     */
    public boolean isSuccess() {
        return executionError == null && diagnostics.stream().noneMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
