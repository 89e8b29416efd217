package org.kal.compiler.frontend.irgen;

import org.kal.compiler.api.CompilerErrorCode;
import org.kal.compiler.diagnostics.DiagnosticsEngine;
import org.kal.compiler.frontend.parser.ast.AstNode;
import org.kal.compiler.frontend.parser.ast.FunctionNode;
import org.kal.compiler.frontend.parser.ast.PrototypeNode;
import org.kal.compiler.ir.IrFunction;
import org.kal.compiler.ir.IrInstruction;
import org.kal.compiler.ir.IrModule;
import org.kal.compiler.ir.IrOperand;
import org.kal.compiler.ir.IrParameter;
import org.kal.compiler.ir.IrVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Phase: lowers prototypes and function definitions into IR functions of an {@link IrModule}.
 * <p>
 * The module is the function table shared by every construct of a session. Each function body
 * is lowered against its own {@link IrGenContext}. A definition that fails leaves the table
 * exactly as it was before the attempt.
 */
public final class IrGenerator {

	/** Name under which anonymous top-level expressions are lowered, unless configured otherwise. */
	public static final String DEFAULT_ANONYMOUS_FUNCTION_NAME = "__anon_expr";

	private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

	private final IrModule module;
	private final DiagnosticsEngine diagnostics;
	private final String anonymousFunctionName;

	/**
	 * Creates a new IR generator using {@link #DEFAULT_ANONYMOUS_FUNCTION_NAME}.
	 *
	 * @param module      The function table.
	 * @param diagnostics The diagnostics engine for reporting issues.
	 */
	public IrGenerator(IrModule module, DiagnosticsEngine diagnostics) {
		this(module, diagnostics, DEFAULT_ANONYMOUS_FUNCTION_NAME);
	}

	/**
	 * Creates a new IR generator.
	 *
	 * @param module                The function table.
	 * @param diagnostics           The diagnostics engine for reporting issues.
	 * @param anonymousFunctionName The internal name for anonymous top-level expressions.
	 */
	public IrGenerator(IrModule module, DiagnosticsEngine diagnostics, String anonymousFunctionName) {
		this.module = module;
		this.diagnostics = diagnostics;
		this.anonymousFunctionName = anonymousFunctionName;
	}

	/**
	 * Lowers a top-level construct.
	 *
	 * @param node A {@link FunctionNode} or {@link PrototypeNode}.
	 * @return The lowered function, or empty if an error was reported.
	 * @throws IllegalArgumentException for any other node.
	 */
	public Optional<IrFunction> lower(AstNode node) {
		if (node instanceof FunctionNode function) return lower(function);
		if (node instanceof PrototypeNode prototype) return lower(prototype);
		throw new IllegalArgumentException("Not a top-level construct: " + node.getClass().getSimpleName());
	}

	/**
	 * Declares a function signature. Re-declaring a known function with the same arity returns
	 * the known function unchanged.
	 *
	 * @param prototype The prototype.
	 * @return The declaration, or empty if an error was reported.
	 */
	public Optional<IrFunction> lower(PrototypeNode prototype) {
		String name = functionName(prototype);
		Optional<IrFunction> existing = module.getFunction(name);
		if (existing.isPresent()) {
			if (existing.get().arity() != prototype.arity()) {
				reportSignatureMismatch(existing.get(), prototype);
				return Optional.empty();
			}
			LOG.debug("Function '{}' is already known, keeping the existing entry", name);
			return existing;
		}

		warnOnDuplicateParameters(prototype);
		IrFunction declaration = IrFunction.declaration(name, prototype.parameterNames(), prototype.source());
		module.put(declaration);
		LOG.debug("Declared '{}' with {} parameter(s)", name, declaration.arity());
		return Optional.of(declaration);
	}

	/**
	 * Lowers a function definition. An existing declaration of the same name is completed;
	 * an existing definition is an error.
	 *
	 * @param function The function definition.
	 * @return The defined function, or empty if an error was reported.
	 */
	public Optional<IrFunction> lower(FunctionNode function) {
		PrototypeNode prototype = function.prototype();
		String name = functionName(prototype);
		Optional<IrFunction> previous = module.getFunction(name);

		if (previous.isPresent()) {
			if (!previous.get().isDeclaration()) {
				diagnostics.reportError(CompilerErrorCode.FUNCTION_REDEFINITION,
						"Function '" + name + "' cannot be redefined.", prototype.source());
				return Optional.empty();
			}
			if (previous.get().arity() != prototype.arity()) {
				reportSignatureMismatch(previous.get(), prototype);
				return Optional.empty();
			}
		} else {
			warnOnDuplicateParameters(prototype);
			// Visible while the body is lowered so the function can call itself.
			module.put(IrFunction.declaration(name, prototype.parameterNames(), prototype.source()));
		}

		boolean defined = false;
		try {
			IrGenContext ctx = new IrGenContext(module);
			List<String> parameterNames = prototype.parameterNames();
			for (int i = 0; i < parameterNames.size(); i++) {
				ctx.bindParameter(new IrParameter(i, parameterNames.get(i)));
			}

			IrOperand result = new ExpressionLowering(ctx).lower(function.body());
			ctx.emit(IrInstruction.ret(result, function.body().source()));

			IrFunction lowered = new IrFunction(name, parameterNames, ctx.instructions(), prototype.source());
			IrVerifier.verify(lowered);
			module.put(lowered);
			defined = true;
			LOG.debug("Defined '{}' with {} instruction(s)", name, lowered.body().size());
			return Optional.of(lowered);
		} catch (LoweringException e) {
			diagnostics.reportError(e.code(), e.getMessage(), e.source());
			return Optional.empty();
		} finally {
			if (!defined) {
				restore(name, previous);
			}
		}
	}

	private void restore(String name, Optional<IrFunction> previous) {
		if (previous.isPresent()) {
			module.put(previous.get());
		} else {
			module.remove(name);
		}
		LOG.debug("Discarded failed definition of '{}'", name);
	}

	private String functionName(PrototypeNode prototype) {
		return prototype.isAnonymous() ? anonymousFunctionName : prototype.name();
	}

	private void reportSignatureMismatch(IrFunction existing, PrototypeNode prototype) {
		diagnostics.reportError(CompilerErrorCode.SIGNATURE_MISMATCH,
				"Function '" + existing.name() + "' was declared with " + existing.arity()
						+ " parameter(s) but is now given " + prototype.arity() + ".", prototype.source());
	}

	private void warnOnDuplicateParameters(PrototypeNode prototype) {
		Set<String> seen = new HashSet<>();
		for (String parameter : prototype.parameterNames()) {
			if (!seen.add(parameter)) {
				diagnostics.reportWarning(CompilerErrorCode.DUPLICATE_PARAMETER,
						"Parameter '" + parameter + "' of '" + prototype.name()
								+ "' appears more than once; the first one is used.", prototype.source());
			}
		}
	}
}
