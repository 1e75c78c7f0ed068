package com.sheetengine.app.models;

import com.sheetengine.app.engine.formula.FormulaNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address inside the sheet
 * - either a literal value or a formula (text plus parsed AST), never both
 * - value (the cached computed result)
 * - format, an opaque style blob
 */
public class Cell {
    private final CellAddress address;
    private CellValue literal;
    // Formula text always carries the leading '='
    private String formulaText;
    private FormulaNode formula;
    private CellValue value = CellValue.BLANK;
    private Map<String, Object> format;

    public Cell(CellAddress address) {
        this.address = address;
    }

    /**
     * Copy constructor used by structural shifts; the copy lives at a new address.
     */
    public Cell(Cell source, CellAddress newAddress) {
        this.address = newAddress;
        this.literal = source.literal;
        this.formulaText = source.formulaText;
        this.formula = source.formula;
        this.value = source.value;
        this.format = source.format == null ? null : new LinkedHashMap<>(source.format);
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isFormula() {
        return formulaText != null;
    }

    public CellValue getLiteral() {
        return literal;
    }

    /**
     * Stores a literal; clears any formula so the two never coexist.
     */
    public void setLiteral(CellValue literal) {
        this.literal = literal;
        this.formulaText = null;
        this.formula = null;
        this.value = literal == null ? CellValue.BLANK : literal;
    }

    public String getFormulaText() {
        return formulaText;
    }

    /**
     * May be null when the formula text failed to parse.
     */
    public FormulaNode getFormula() {
        return formula;
    }

    /**
     * Stores a formula; clears any literal so the two never coexist.
     */
    public void setFormula(String formulaText, FormulaNode formula) {
        this.formulaText = formulaText;
        this.formula = formula;
        this.literal = null;
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value == null ? CellValue.BLANK : value;
    }

    public Map<String, Object> getFormat() {
        return format;
    }

    public void setFormat(Map<String, Object> format) {
        this.format = format;
    }

    /**
     * A cell with no input and no format can be dropped from the sparse grid.
     */
    public boolean isEmpty() {
        return !isFormula() && (literal == null || literal.isBlank()) && (format == null || format.isEmpty());
    }
}
