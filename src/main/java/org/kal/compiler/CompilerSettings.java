package org.kal.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.kal.compiler.frontend.irgen.IrGenerator;
import org.kal.compiler.frontend.parser.OperatorPrecedence;
import org.kal.runtime.IrInterpreter;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of the {@code kal} section of the configuration.
 *
 * @param moduleName The name of the IR module, shown in the module dump.
 * @param anonymousFunctionName The internal name of anonymous top-level expressions.
 * @param operators The binary operator table.
 * @param prompt The prompt printed before each construct in interactive mode.
 * @param evaluate Whether top-level expressions are executed after lowering.
 * @param dumpModuleOnExit Whether the whole module is printed at end of input.
 * @param maxCallDepth The call depth limit of the interpreter.
 */
public record CompilerSettings(
        String moduleName,
        String anonymousFunctionName,
        OperatorPrecedence operators,
        String prompt,
        boolean evaluate,
        boolean dumpModuleOnExit,
        int maxCallDepth
) {

    private static final String ROOT = "kal";

    /**
     * @return The built-in settings, equal to what {@code reference.conf} ships.
     */
    public static CompilerSettings defaults() {
        return new CompilerSettings("my cool jit", IrGenerator.DEFAULT_ANONYMOUS_FUNCTION_NAME,
                OperatorPrecedence.defaults(), "ready> ", true, true, IrInterpreter.DEFAULT_MAX_CALL_DEPTH);
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The configuration containing a {@code kal} section.
     * @return The settings.
     * @throws ConfigException if a value is missing or malformed.
     */
    public static CompilerSettings fromConfig(Config config) {
        Config kal = config.getConfig(ROOT);
        return new CompilerSettings(
                kal.getString("module-name"),
                kal.getString("anonymous-function-name"),
                readOperators(kal),
                kal.getString("repl.prompt"),
                kal.getBoolean("repl.evaluate"),
                kal.getBoolean("repl.dump-module-on-exit"),
                kal.getInt("runtime.max-call-depth"));
    }

    /**
     * @param value Whether to evaluate top-level expressions.
     * @return A copy with the flag replaced.
     */
    public CompilerSettings withEvaluate(boolean value) {
        return new CompilerSettings(moduleName, anonymousFunctionName, operators, prompt, value, dumpModuleOnExit, maxCallDepth);
    }

    /**
     * @param value Whether to dump the module at end of input.
     * @return A copy with the flag replaced.
     */
    public CompilerSettings withDumpModuleOnExit(boolean value) {
        return new CompilerSettings(moduleName, anonymousFunctionName, operators, prompt, evaluate, value, maxCallDepth);
    }

    private static OperatorPrecedence readOperators(Config kal) {
        Map<Character, Integer> table = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : kal.getConfig("operators").root().entrySet()) {
            String key = entry.getKey();
            if (key.length() != 1) {
                throw new ConfigException.BadValue(entry.getValue().origin(), "kal.operators." + key,
                        "operator keys must be a single character");
            }
            Object value = entry.getValue().unwrapped();
            if (!(value instanceof Number number)) {
                throw new ConfigException.WrongType(entry.getValue().origin(), "kal.operators." + key, "NUMBER",
                        entry.getValue().valueType().name());
            }
            table.put(key.charAt(0), number.intValue());
        }

        Set<Character> rightAssociative = new HashSet<>();
        for (String operator : kal.getStringList("right-associative")) {
            if (operator.length() != 1) {
                throw new ConfigException.BadValue(kal.origin(), "kal.right-associative",
                        "'" + operator + "' is not a single character");
            }
            rightAssociative.add(operator.charAt(0));
        }
        return OperatorPrecedence.of(table, rightAssociative);
    }
}
