package com.sheetengine.app.engine.functions;

/**
 * A registered function: its name, accepted argument counts and handler.
 */
public final class FunctionDefinition {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final FormulaFunction handler;

    public FunctionDefinition(String name, int minArgs, int maxArgs, FormulaFunction handler) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.handler = handler;
    }

    public String getName() {
        return name;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public FormulaFunction getHandler() {
        return handler;
    }

    public boolean acceptsArity(int count) {
        return count >= minArgs && count <= maxArgs;
    }
}
