package com.sheetengine.app.engine.functions;

/**
 * Registers every built-in function family.
 */
public final class StandardFunctions {

    private StandardFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        AggregateFunctions.registerAll(registry);
        LogicalFunctions.registerAll(registry);
        TextFunctions.registerAll(registry);
        DateFunctions.registerAll(registry);
        LookupFunctions.registerAll(registry);
    }
}
