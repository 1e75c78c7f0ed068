package com.sheetengine.app.models;

import java.util.Map;

/**
 * Request body for a single cell write: a literal value or a formula
 * (never both), with an optional format blob.
 */
public class CellInput {
    private Object value;
    private String formula;
    private Map<String, Object> format;

    // Default constructor needed for JSON (de)serialization
    public CellInput() {
    }

    public CellInput(Object value, String formula, Map<String, Object> format) {
        this.value = value;
        this.formula = formula;
        this.format = format;
    }

    public static CellInput value(Object value) {
        return new CellInput(value, null, null);
    }

    public static CellInput formula(String formula) {
        return new CellInput(null, formula, null);
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public Map<String, Object> getFormat() {
        return format;
    }

    public void setFormat(Map<String, Object> format) {
        this.format = format;
    }
}
