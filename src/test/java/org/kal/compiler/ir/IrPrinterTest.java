package org.kal.compiler.ir;

import org.kal.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the textual form produced by {@link IrPrinter}.
 */
@Tag("unit")
class IrPrinterTest {

    private static final SourceInfo SRC = new SourceInfo("test.kal", 1, 1);

    @Test
    void printsDeclarationAsSingleLine() {
        IrFunction sin = IrFunction.declaration("sin", List.of("x"), SRC);

        assertThat(IrPrinter.print(sin)).isEqualTo("declare double @sin(double %x)\n");
    }

    @Test
    void printsDefinitionWithEntryBlock() {
        IrRegister sum = new IrRegister("addtmp", IrType.DOUBLE);
        IrFunction foo = new IrFunction("foo", List.of("a", "b"), List.of(
                IrInstruction.binary(IrOpcode.FADD, sum, new IrParameter(0, "a"), new IrParameter(1, "b"), SRC),
                IrInstruction.ret(sum, SRC)), SRC);

        assertThat(IrPrinter.print(foo)).isEqualTo(
                "define double @foo(double %a, double %b) {\n"
                        + "entry:\n"
                        + "  %addtmp = fadd double %a, %b\n"
                        + "  ret double %addtmp\n"
                        + "}\n");
    }

    @Test
    void printsComparisonWideningAndCall() {
        IrRegister cmp = new IrRegister("cmptmp", IrType.BOOL);
        IrRegister widened = new IrRegister("booltmp", IrType.DOUBLE);
        IrRegister called = new IrRegister("calltmp", IrType.DOUBLE);

        assertThat(IrPrinter.print(IrInstruction.binary(IrOpcode.FCMP_ULT, cmp, new IrConstant(1.0), new IrConstant(2.5), SRC)))
                .isEqualTo("%cmptmp = fcmp ult double 1.0, 2.5");
        assertThat(IrPrinter.print(IrInstruction.widen(widened, cmp, SRC)))
                .isEqualTo("%booltmp = uitofp i1 %cmptmp to double");
        assertThat(IrPrinter.print(IrInstruction.call(called, "f", List.of(widened, new IrConstant(-3.0)), SRC)))
                .isEqualTo("%calltmp = call double @f(double %booltmp, double -3.0)");
        assertThat(IrPrinter.print(IrInstruction.call(called, "rand", List.of(), SRC)))
                .isEqualTo("%calltmp = call double @rand()");
    }

    @Test
    void printsModuleHeaderAndFunctionsInInsertionOrder() {
        IrModule module = new IrModule("my cool jit");
        module.put(IrFunction.declaration("cos", List.of("x"), SRC));
        module.put(new IrFunction("one", List.of(), List.of(IrInstruction.ret(new IrConstant(1.0), SRC)), SRC));

        assertThat(IrPrinter.print(module)).isEqualTo(
                "; ModuleID = 'my cool jit'\n"
                        + "\n"
                        + "declare double @cos(double %x)\n"
                        + "\n"
                        + "define double @one() {\n"
                        + "entry:\n"
                        + "  ret double 1.0\n"
                        + "}\n");
    }
}
