package com.sheetengine.app.engine.functions;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed table of built-in functions. Names are case-insensitive.
 */
public class FunctionRegistry {

    private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();

    /**
     * Registry pre-loaded with every standard function.
     */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        StandardFunctions.registerAll(registry);
        return registry;
    }

    public void register(String name, int minArgs, int maxArgs, FormulaFunction handler) {
        String key = name.toUpperCase(Locale.ROOT);
        functions.put(key, new FunctionDefinition(key, minArgs, maxArgs, handler));
    }

    /**
     * Registers an alternative spelling for an already registered function.
     */
    public void alias(String alias, String target) {
        FunctionDefinition definition = lookup(target);
        if (definition == null) {
            throw new IllegalArgumentException("Cannot alias unknown function " + target);
        }
        register(alias, definition.getMinArgs(), definition.getMaxArgs(), definition.getHandler());
    }

    /**
     * Returns null for unknown names; the evaluator turns that into #ERROR!.
     */
    public FunctionDefinition lookup(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }
}
