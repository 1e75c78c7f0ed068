package com.sheetengine.app.engine.formula;

import java.util.Collections;
import java.util.List;

public final class FunctionCallNode implements FormulaNode {
    private final String name;
    private final List<FormulaNode> arguments;

    public FunctionCallNode(String name, List<FormulaNode> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return FormulaWriter.write(this);
    }
}
