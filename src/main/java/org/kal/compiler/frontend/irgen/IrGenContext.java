package org.kal.compiler.frontend.irgen;

import org.kal.compiler.ir.IrFunction;
import org.kal.compiler.ir.IrInstruction;
import org.kal.compiler.ir.IrModule;
import org.kal.compiler.ir.IrParameter;
import org.kal.compiler.ir.IrRegister;
import org.kal.compiler.ir.IrType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable context for lowering one function body.
 * Holds the local-variable table, the emitted instructions and the register names in use.
 * A fresh context is created for every function and dropped when it is done.
 */
public final class IrGenContext {

	private final IrModule module;
	private final Map<String, IrParameter> locals = new HashMap<>();
	private final List<IrInstruction> out = new ArrayList<>();
	private final Set<String> usedNames = new HashSet<>();
	private final Map<String, Integer> nextSuffix = new HashMap<>();

	/**
	 * Constructs a new context.
	 * @param module The function table used to resolve calls.
	 */
	public IrGenContext(IrModule module) {
		this.module = module;
	}

	/**
	 * Binds a parameter name in the local-variable table. If the name is already bound
	 * the first binding is kept.
	 * @param parameter The formal parameter.
	 * @return true if the name was newly bound.
	 */
	public boolean bindParameter(IrParameter parameter) {
		usedNames.add(parameter.name());
		return locals.putIfAbsent(parameter.name(), parameter) == null;
	}

	/**
	 * Resolves a variable in the local-variable table.
	 * @param name The variable name.
	 * @return The parameter it refers to, if any.
	 */
	public Optional<IrParameter> resolveLocal(String name) {
		return Optional.ofNullable(locals.get(name));
	}

	/**
	 * Resolves a function in the module's function table.
	 * @param name The function name.
	 * @return The function, if declared or defined.
	 */
	public Optional<IrFunction> resolveFunction(String name) {
		return module.getFunction(name);
	}

	/**
	 * Allocates a register with a name derived from the hint, unique within this function:
	 * {@code addtmp}, {@code addtmp1}, {@code addtmp2}, ...
	 * @param hint The base name.
	 * @param type The type of the value.
	 * @return The register.
	 */
	public IrRegister newRegister(String hint, IrType type) {
		int suffix = nextSuffix.getOrDefault(hint, 0);
		String name;
		do {
			name = suffix == 0 ? hint : hint + suffix;
			suffix++;
		} while (!usedNames.add(name));
		nextSuffix.put(hint, suffix);
		return new IrRegister(name, type);
	}

	/**
	 * Emits a new instruction.
	 * @param instruction The instruction to append to the body.
	 */
	public void emit(IrInstruction instruction) {
		out.add(instruction);
	}

	/**
	 * @return The instructions emitted so far.
	 */
	public List<IrInstruction> instructions() {
		return List.copyOf(out);
	}
}
