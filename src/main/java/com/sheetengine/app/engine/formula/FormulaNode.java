package com.sheetengine.app.engine.formula;

/**
 * Node of a parsed formula. Trees are immutable: rebasing a formula after a
 * structural edit produces a new tree rather than mutating the old one.
 */
public interface FormulaNode {

    <R> R accept(FormulaVisitor<R> visitor);
}
