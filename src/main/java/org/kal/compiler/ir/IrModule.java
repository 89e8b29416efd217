package org.kal.compiler.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The function table of a compilation session: every declared or defined function by name,
 * in the order they were first added.
 */
public final class IrModule {

    private final String name;
    private final Map<String, IrFunction> functions = new LinkedHashMap<>();

    /**
     * @param name The module name, shown in the printed IR.
     */
    public IrModule(String name) {
        this.name = name;
    }

    /**
     * @return The module name.
     */
    public String name() {
        return name;
    }

    /**
     * Looks up a function.
     * @param functionName The function name.
     * @return The function, if declared or defined.
     */
    public Optional<IrFunction> getFunction(String functionName) {
        return Optional.ofNullable(functions.get(functionName));
    }

    /**
     * Adds a function or replaces the entry of the same name, keeping its position.
     * @param function The function.
     */
    public void put(IrFunction function) {
        functions.put(function.name(), function);
    }

    /**
     * Removes a function from the table.
     * @param functionName The function name.
     * @return The removed function, if there was one.
     */
    public Optional<IrFunction> remove(String functionName) {
        return Optional.ofNullable(functions.remove(functionName));
    }

    /**
     * @return A snapshot of all functions, in insertion order.
     */
    public List<IrFunction> functions() {
        return new ArrayList<>(functions.values());
    }

    /**
     * @return The number of functions.
     */
    public int size() {
        return functions.size();
    }
}
