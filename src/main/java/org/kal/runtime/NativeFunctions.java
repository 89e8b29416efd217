package org.kal.runtime;

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Host implementations that {@code extern} declarations can bind to by name and arity.
 */
public final class NativeFunctions {

    /**
     * A host function taking and returning doubles.
     */
    @FunctionalInterface
    public interface NativeFunction {
        double invoke(double[] arguments);
    }

    private record Entry(int arity, NativeFunction function) {}

    private final Map<String, Entry> functions = new LinkedHashMap<>();

    /**
     * Creates an empty table.
     */
    public NativeFunctions() {
    }

    /**
     * Creates the standard table: the usual one- and two-argument math functions plus
     * {@code putchard(c)}, which writes the character with code {@code c}, and {@code printd(x)},
     * which writes {@code x} on its own line. Both return 0.
     *
     * @param out The stream the printing functions write to.
     * @return The table.
     */
    public static NativeFunctions standard(PrintStream out) {
        NativeFunctions natives = new NativeFunctions();
        natives.unary("sin", Math::sin);
        natives.unary("cos", Math::cos);
        natives.unary("tan", Math::tan);
        natives.unary("atan", Math::atan);
        natives.unary("exp", Math::exp);
        natives.unary("log", Math::log);
        natives.unary("sqrt", Math::sqrt);
        natives.unary("fabs", Math::abs);
        natives.unary("floor", Math::floor);
        natives.binary("pow", Math::pow);
        natives.binary("atan2", Math::atan2);
        natives.binary("fmod", (a, b) -> a % b);
        natives.unary("putchard", c -> {
            out.print((char) (int) c);
            out.flush();
            return 0;
        });
        natives.unary("printd", x -> {
            out.println(x);
            return 0;
        });
        return natives;
    }

    /**
     * Registers a function of any arity, replacing an existing one of the same name.
     * @param name The name an extern must use.
     * @param arity The number of arguments.
     * @param function The implementation.
     */
    public void register(String name, int arity, NativeFunction function) {
        functions.put(name, new Entry(arity, function));
    }

    /**
     * Registers a one-argument function.
     * @param name The name.
     * @param function The implementation.
     */
    public void unary(String name, DoubleUnaryOperator function) {
        register(name, 1, args -> function.applyAsDouble(args[0]));
    }

    /**
     * Registers a two-argument function.
     * @param name The name.
     * @param function The implementation.
     */
    public void binary(String name, DoubleBinaryOperator function) {
        register(name, 2, args -> function.applyAsDouble(args[0], args[1]));
    }

    /**
     * Looks up a function by name and arity.
     * @param name The name.
     * @param arity The arity the caller was declared with.
     * @return The implementation, if one with that exact arity exists.
     */
    public Optional<NativeFunction> lookup(String name, int arity) {
        Entry entry = functions.get(name);
        if (entry == null || entry.arity() != arity) return Optional.empty();
        return Optional.of(entry.function());
    }

    /**
     * @return Name to arity of every registered function.
     */
    public Map<String, Integer> signatures() {
        Map<String, Integer> result = new LinkedHashMap<>();
        functions.forEach((name, entry) -> result.put(name, entry.arity()));
        return Collections.unmodifiableMap(result);
    }
}
