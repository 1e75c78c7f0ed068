package com.sheetengine.app.models;

import java.util.List;
import java.util.Map;

/**
 * Request body for a rectangular write. Each grid is row-major and
 * anchored at the top-left of the target range; null entries are skipped.
 */
public class RangeInput {
    private List<List<Object>> values;
    private List<List<String>> formulas;
    private List<List<Map<String, Object>>> formats;

    public RangeInput() {
    }

    public RangeInput(List<List<Object>> values, List<List<String>> formulas,
                      List<List<Map<String, Object>>> formats) {
        this.values = values;
        this.formulas = formulas;
        this.formats = formats;
    }

    public List<List<Object>> getValues() {
        return values;
    }

    public void setValues(List<List<Object>> values) {
        this.values = values;
    }

    public List<List<String>> getFormulas() {
        return formulas;
    }

    public void setFormulas(List<List<String>> formulas) {
        this.formulas = formulas;
    }

    public List<List<Map<String, Object>>> getFormats() {
        return formats;
    }

    public void setFormats(List<List<Map<String, Object>>> formats) {
        this.formats = formats;
    }
}
