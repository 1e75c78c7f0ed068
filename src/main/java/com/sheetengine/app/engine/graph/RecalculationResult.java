package com.sheetengine.app.engine.graph;

import com.sheetengine.app.models.CellValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one recalculation pass.
 */
public class RecalculationResult {

    private final List<CellKey> evaluated = new ArrayList<>();
    private final Map<CellKey, CellValue> changed = new LinkedHashMap<>();
    private final Set<CellKey> circular = new LinkedHashSet<>();

    void recordEvaluation(CellKey key, CellValue oldValue, CellValue newValue) {
        evaluated.add(key);
        if (!newValue.equals(oldValue)) {
            changed.put(key, newValue);
        }
    }

    void recordCircular(CellKey key) {
        circular.add(key);
    }

    /**
     * Formula cells in the order they were evaluated.
     */
    public List<CellKey> getEvaluated() {
        return Collections.unmodifiableList(evaluated);
    }

    public int evaluationCount(CellKey key) {
        return Collections.frequency(evaluated, key);
    }

    /**
     * Cells whose cached value differs from before the pass, with the new value.
     */
    public Map<CellKey, CellValue> getChanged() {
        return Collections.unmodifiableMap(changed);
    }

    public Set<CellKey> getCircular() {
        return Collections.unmodifiableSet(circular);
    }
}
