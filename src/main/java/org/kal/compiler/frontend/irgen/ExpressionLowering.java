package org.kal.compiler.frontend.irgen;

import org.kal.compiler.api.CompilerErrorCode;
import org.kal.compiler.frontend.parser.ast.BinaryNode;
import org.kal.compiler.frontend.parser.ast.CallNode;
import org.kal.compiler.frontend.parser.ast.ExprNode;
import org.kal.compiler.frontend.parser.ast.ExprVisitor;
import org.kal.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kal.compiler.frontend.parser.ast.VariableNode;
import org.kal.compiler.ir.IrConstant;
import org.kal.compiler.ir.IrFunction;
import org.kal.compiler.ir.IrInstruction;
import org.kal.compiler.ir.IrOpcode;
import org.kal.compiler.ir.IrOperand;
import org.kal.compiler.ir.IrParameter;
import org.kal.compiler.ir.IrRegister;
import org.kal.compiler.ir.IrType;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers one expression tree into instructions of the current function and returns
 * the operand holding its value. Operands are lowered left to right; the first
 * error aborts the whole expression.
 */
final class ExpressionLowering implements ExprVisitor<IrOperand> {

	private final IrGenContext ctx;

	ExpressionLowering(IrGenContext ctx) {
		this.ctx = ctx;
	}

	IrOperand lower(ExprNode node) {
		return node.accept(this);
	}

	@Override
	public IrOperand visitNumber(NumberLiteralNode node) {
		return new IrConstant(node.value());
	}

	@Override
	public IrOperand visitVariable(VariableNode node) {
		IrParameter parameter = ctx.resolveLocal(node.name())
				.orElseThrow(() -> new LoweringException(CompilerErrorCode.UNKNOWN_VARIABLE,
						"Unknown variable name '" + node.name() + "'.", node.source()));
		return parameter;
	}

	@Override
	public IrOperand visitBinary(BinaryNode node) {
		IrOperand lhs = lower(node.left());
		IrOperand rhs = lower(node.right());

		switch (node.operator()) {
			case '+':
				return arithmetic(IrOpcode.FADD, "addtmp", lhs, rhs, node);
			case '-':
				return arithmetic(IrOpcode.FSUB, "subtmp", lhs, rhs, node);
			case '*':
				return arithmetic(IrOpcode.FMUL, "multmp", lhs, rhs, node);
			case '<': {
				IrRegister cmp = ctx.newRegister("cmptmp", IrType.BOOL);
				ctx.emit(IrInstruction.binary(IrOpcode.FCMP_ULT, cmp, lhs, rhs, node.source()));
				// Widen the i1 to 0.0 or 1.0 so the comparison is usable as a number.
				IrRegister widened = ctx.newRegister("booltmp", IrType.DOUBLE);
				ctx.emit(IrInstruction.widen(widened, cmp, node.source()));
				return widened;
			}
			default:
				throw new LoweringException(CompilerErrorCode.INVALID_BINARY_OPERATOR,
						"Invalid binary operator '" + node.operator() + "'.", node.source());
		}
	}

	@Override
	public IrOperand visitCall(CallNode node) {
		IrFunction callee = ctx.resolveFunction(node.callee())
				.orElseThrow(() -> new LoweringException(CompilerErrorCode.UNKNOWN_FUNCTION,
						"Unknown function referenced: '" + node.callee() + "'.", node.source()));

		if (callee.arity() != node.arguments().size()) {
			throw new LoweringException(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
					"Incorrect number of arguments passed to '" + node.callee() + "': expected "
							+ callee.arity() + ", got " + node.arguments().size() + ".", node.source());
		}

		List<IrOperand> arguments = new ArrayList<>(node.arguments().size());
		for (ExprNode argument : node.arguments()) {
			arguments.add(lower(argument));
		}

		IrRegister result = ctx.newRegister("calltmp", IrType.DOUBLE);
		ctx.emit(IrInstruction.call(result, callee.name(), arguments, node.source()));
		return result;
	}

	private IrOperand arithmetic(IrOpcode opcode, String hint, IrOperand lhs, IrOperand rhs, BinaryNode node) {
		IrRegister result = ctx.newRegister(hint, IrType.DOUBLE);
		ctx.emit(IrInstruction.binary(opcode, result, lhs, rhs, node.source()));
		return result;
	}
}
