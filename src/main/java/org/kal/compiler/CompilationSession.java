package org.kal.compiler;

import org.kal.compiler.api.CompilationException;
import org.kal.compiler.diagnostics.DiagnosticsEngine;
import org.kal.compiler.frontend.irgen.IrGenerator;
import org.kal.compiler.frontend.lexer.Lexer;
import org.kal.compiler.frontend.lexer.Token;
import org.kal.compiler.frontend.parser.Parser;
import org.kal.compiler.frontend.parser.ast.FunctionNode;
import org.kal.compiler.frontend.parser.ast.PrototypeNode;
import org.kal.compiler.ir.IrFunction;
import org.kal.compiler.ir.IrModule;
import org.kal.runtime.IrExecutionException;
import org.kal.runtime.IrInterpreter;
import org.kal.runtime.NativeFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives the pipeline one top-level construct at a time: parse, lower, and for bare
 * expressions evaluate and discard the anonymous function again.
 * <p>
 * When a construct fails to parse, one token is skipped before the next attempt.
 * All state (token cursor, function table) belongs to this session; sessions are
 * independent of each other. It is not thread-safe.
 */
public class CompilationSession {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationSession.class);

    private final CompilerSettings settings;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final IrModule module;
    private final Parser parser;
    private final IrGenerator generator;
    private final IrInterpreter interpreter;

    /**
     * Creates a session over a character stream.
     *
     * @param input The source, read lazily.
     * @param inputName The logical name of the source, for diagnostics.
     * @param settings The settings.
     * @param natives The host functions that externs may bind to during evaluation.
     */
    public CompilationSession(Reader input, String inputName, CompilerSettings settings, NativeFunctions natives) {
        this.settings = settings;
        this.module = new IrModule(settings.moduleName());
        this.parser = new Parser(new Lexer(input, diagnostics, inputName), settings.operators(), diagnostics);
        this.generator = new IrGenerator(module, diagnostics, settings.anonymousFunctionName());
        this.interpreter = new IrInterpreter(module, natives, settings.maxCallDepth());
    }

    /**
     * Creates a session over an in-memory source with the default settings and no native functions.
     * @param source The source text.
     * @return The session.
     */
    public static CompilationSession forSource(String source) {
        return new CompilationSession(new StringReader(source), "<memory>", CompilerSettings.defaults(), new NativeFunctions());
    }

    /**
     * Handles the next top-level construct.
     * @return What was handled; {@link TopLevelResult.Kind#END_OF_INPUT} once the input is exhausted.
     */
    public TopLevelResult handleNext() {
        int mark = diagnostics.mark();
        Token token = parser.currentToken();
        switch (token.type()) {
            case END_OF_FILE:
                return new TopLevelResult(TopLevelResult.Kind.END_OF_INPUT, null, null, null, List.of());
            case DEF:
                return handleDefinition(mark);
            case EXTERN:
                return handleExtern(mark);
            default:
                if (token.isCharacter(';')) {
                    parser.advance();
                    return new TopLevelResult(TopLevelResult.Kind.SEPARATOR, null, null, null, List.of());
                }
                return handleTopLevelExpression(mark);
        }
    }

    /**
     * Handles constructs until the input is exhausted.
     * @return The results of all handled constructs, excluding separators and the end marker.
     */
    public List<TopLevelResult> run() {
        List<TopLevelResult> results = new ArrayList<>();
        while (true) {
            TopLevelResult result = handleNext();
            if (result.kind() == TopLevelResult.Kind.END_OF_INPUT) {
                return results;
            }
            if (result.kind() != TopLevelResult.Kind.SEPARATOR) {
                results.add(result);
            }
        }
    }

    /**
     * Compiles the whole input and fails if any construct reported an error.
     * @return The module with every declared and defined function.
     * @throws CompilationException if any error diagnostic was reported.
     */
    public IrModule compileAll() throws CompilationException {
        run();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }
        return module;
    }

    private TopLevelResult handleDefinition(int mark) {
        Optional<FunctionNode> parsed = parser.parseDefinition();
        if (parsed.isEmpty()) {
            skipTokenForRecovery();
            return failed(TopLevelResult.Kind.DEFINITION, mark);
        }
        IrFunction lowered = generator.lower(parsed.get()).orElse(null);
        if (lowered != null) {
            LOG.debug("Read function definition '{}'", lowered.name());
        }
        return new TopLevelResult(TopLevelResult.Kind.DEFINITION, lowered, null, null, diagnostics.since(mark));
    }

    private TopLevelResult handleExtern(int mark) {
        Optional<PrototypeNode> parsed = parser.parseExtern();
        if (parsed.isEmpty()) {
            skipTokenForRecovery();
            return failed(TopLevelResult.Kind.EXTERN, mark);
        }
        IrFunction lowered = generator.lower(parsed.get()).orElse(null);
        if (lowered != null) {
            LOG.debug("Read extern '{}'", lowered.name());
        }
        return new TopLevelResult(TopLevelResult.Kind.EXTERN, lowered, null, null, diagnostics.since(mark));
    }

    private TopLevelResult handleTopLevelExpression(int mark) {
        Optional<FunctionNode> parsed = parser.parseTopLevelExpression();
        if (parsed.isEmpty()) {
            skipTokenForRecovery();
            return failed(TopLevelResult.Kind.EXPRESSION, mark);
        }

        Optional<IrFunction> lowered = generator.lower(parsed.get());
        if (lowered.isEmpty()) {
            return failed(TopLevelResult.Kind.EXPRESSION, mark);
        }

        IrFunction function = lowered.get();
        Double value = null;
        String executionError = null;
        try {
            if (settings.evaluate()) {
                value = interpreter.call(function.name());
                LOG.debug("Evaluated top-level expression to {}", value);
            }
        } catch (IrExecutionException e) {
            LOG.warn("Evaluation failed: {}", e.getMessage());
            executionError = e.getMessage();
        } finally {
            module.remove(function.name());
        }
        return new TopLevelResult(TopLevelResult.Kind.EXPRESSION, function, value, executionError, diagnostics.since(mark));
    }

    private TopLevelResult failed(TopLevelResult.Kind kind, int mark) {
        return new TopLevelResult(kind, null, null, null, diagnostics.since(mark));
    }

    private void skipTokenForRecovery() {
        Token skipped = parser.currentToken();
        LOG.debug("Skipping {} for error recovery", skipped.describe());
        parser.advance();
    }

    /**
     * @return The function table of this session.
     */
    public IrModule module() {
        return module;
    }

    /**
     * @return All diagnostics reported so far.
     */
    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * @return The settings this session was created with.
     */
    public CompilerSettings settings() {
        return settings;
    }
}
