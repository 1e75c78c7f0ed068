package com.sheetengine.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Read model of one cell as returned to clients: the computed value,
 * the formula text if any, and the format.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {
    private final String address;
    private final Object value;
    private final String formula;
    private final Map<String, Object> format;

    public CellView(String address, Object value, String formula, Map<String, Object> format) {
        this.address = address;
        this.value = value;
        this.formula = formula;
        this.format = format;
    }

    public static CellView of(Cell cell) {
        return new CellView(cell.getAddress().toString(), cell.getValue().toJavaObject(),
                cell.getFormulaText(), cell.getFormat());
    }

    public static CellView blank(CellAddress address) {
        return new CellView(address.toString(), null, null, null);
    }

    public String getAddress() {
        return address;
    }

    public Object getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public Map<String, Object> getFormat() {
        return format;
    }
}
