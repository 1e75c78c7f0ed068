package com.sheetengine.app.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A stored filter. Predicates are opaque to the engine; hiding rows is
 * left to the client.
 */
public class FilterSpec {
    private List<Map<String, Object>> predicates = new ArrayList<>();
    private String appliedAt;

    public FilterSpec() {
    }

    public FilterSpec(List<Map<String, Object>> predicates, String appliedAt) {
        this.predicates = predicates;
        this.appliedAt = appliedAt;
    }

    public List<Map<String, Object>> getPredicates() {
        return predicates;
    }

    public void setPredicates(List<Map<String, Object>> predicates) {
        this.predicates = predicates;
    }

    public String getAppliedAt() {
        return appliedAt;
    }

    public void setAppliedAt(String appliedAt) {
        this.appliedAt = appliedAt;
    }
}
