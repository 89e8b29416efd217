package org.kal.compiler.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders IR in an LLVM-flavoured text form, for logs and the interactive loop.
 */
public final class IrPrinter {

	private IrPrinter() {}

	/**
	 * Prints a whole module: a header line followed by every function, separated by blank lines.
	 * @param module The module.
	 * @return The text.
	 */
	public static String print(IrModule module) {
		StringBuilder sb = new StringBuilder();
		sb.append("; ModuleID = '").append(module.name()).append("'\n");
		for (IrFunction function : module.functions()) {
			sb.append('\n').append(print(function));
		}
		return sb.toString();
	}

	/**
	 * Prints a single function, as a {@code declare} line or a {@code define} block.
	 * @param function The function.
	 * @return The text, ending in a newline.
	 */
	public static String print(IrFunction function) {
		String signature = IrType.DOUBLE.text() + " @" + function.name() + "("
				+ function.parameters().stream()
						.map(p -> IrType.DOUBLE.text() + " %" + p.name())
						.collect(Collectors.joining(", "))
				+ ")";
		if (function.isDeclaration()) {
			return "declare " + signature + "\n";
		}
		StringBuilder sb = new StringBuilder();
		sb.append("define ").append(signature).append(" {\n");
		sb.append("entry:\n");
		for (IrInstruction instruction : function.body()) {
			sb.append("  ").append(print(instruction)).append('\n');
		}
		sb.append("}\n");
		return sb.toString();
	}

	/**
	 * Prints one instruction without indentation.
	 * @param instruction The instruction.
	 * @return The text.
	 */
	public static String print(IrInstruction instruction) {
		List<IrOperand> ops = instruction.operands();
		return switch (instruction.opcode()) {
			case FADD, FSUB, FMUL, FCMP_ULT -> assign(instruction) + instruction.opcode().mnemonic() + " "
					+ ops.get(0).type().text() + " " + operand(ops.get(0)) + ", " + operand(ops.get(1));
			case UITOFP -> assign(instruction) + "uitofp " + typed(ops.get(0)) + " to " + instruction.result().type().text();
			case CALL -> assign(instruction) + "call " + IrType.DOUBLE.text() + " @" + instruction.callee() + "("
					+ ops.stream().map(IrPrinter::typed).collect(Collectors.joining(", ")) + ")";
			case RET -> "ret " + typed(ops.get(0));
		};
	}

	private static String assign(IrInstruction instruction) {
		return "%" + instruction.result().name() + " = ";
	}

	private static String typed(IrOperand operand) {
		return operand.type().text() + " " + operand(operand);
	}

	/**
	 * Prints an operand reference.
	 * @param operand The operand.
	 * @return {@code %name} for registers and parameters, the literal for constants.
	 */
	public static String operand(IrOperand operand) {
		if (operand instanceof IrConstant c) return Double.toString(c.value());
		if (operand instanceof IrParameter p) return "%" + p.name();
		if (operand instanceof IrRegister r) return "%" + r.name();
		throw new IllegalStateException("Unknown operand: " + operand);
	}
}
