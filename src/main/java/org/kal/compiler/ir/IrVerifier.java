package org.kal.compiler.ir;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural invariants of a lowered function. A violation means the lowering
 * itself is broken, so it is reported as an {@link IllegalStateException} and never as a
 * user diagnostic.
 */
public final class IrVerifier {

	private IrVerifier() {}

	/**
	 * Verifies a function.
	 * <ul>
	 *     <li>a defined body ends in exactly one {@code ret}, as its last instruction;</li>
	 *     <li>every register is assigned once and before it is used;</li>
	 *     <li>parameters are referenced within the function's arity;</li>
	 *     <li>operand types match what each opcode expects.</li>
	 * </ul>
	 *
	 * @param function The function to check.
	 * @throws IllegalStateException if an invariant is violated.
	 */
	public static void verify(IrFunction function) {
		List<IrInstruction> body = function.body();
		if (body.isEmpty()) return;

		Set<String> defined = new HashSet<>();
		for (int i = 0; i < body.size(); i++) {
			IrInstruction instruction = body.get(i);
			boolean last = i == body.size() - 1;
			if ((instruction.opcode() == IrOpcode.RET) != last) {
				fail(function, "ret must be the single last instruction, found " + instruction.opcode() + " at " + i);
			}
			for (IrOperand operand : instruction.operands()) {
				if (operand instanceof IrRegister r && !defined.contains(r.name())) {
					fail(function, "register %" + r.name() + " used before definition");
				}
				if (operand instanceof IrParameter p && (p.index() < 0 || p.index() >= function.arity())) {
					fail(function, "parameter index " + p.index() + " out of range");
				}
			}
			checkTypes(function, instruction);
			if (instruction.result() != null && !defined.add(instruction.result().name())) {
				fail(function, "register %" + instruction.result().name() + " assigned twice");
			}
		}
	}

	private static void checkTypes(IrFunction function, IrInstruction instruction) {
		IrType expectedOperand = instruction.opcode() == IrOpcode.UITOFP ? IrType.BOOL : IrType.DOUBLE;
		for (IrOperand operand : instruction.operands()) {
			if (operand.type() != expectedOperand) {
				fail(function, instruction.opcode() + " expects " + expectedOperand + " operands, got " + operand.type());
			}
		}
		if (instruction.result() != null) {
			IrType expectedResult = instruction.opcode() == IrOpcode.FCMP_ULT ? IrType.BOOL : IrType.DOUBLE;
			if (instruction.result().type() != expectedResult) {
				fail(function, instruction.opcode() + " must produce " + expectedResult);
			}
		}
	}

	private static void fail(IrFunction function, String message) {
		throw new IllegalStateException("Invalid IR in function '" + function.name() + "': " + message);
	}
}
