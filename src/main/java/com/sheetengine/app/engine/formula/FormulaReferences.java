package com.sheetengine.app.engine.formula;

import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Everything a formula reads: single cells, ranges and names.
 */
public final class FormulaReferences {

    public static final FormulaReferences NONE = new FormulaReferences(
            Collections.emptySet(), Collections.emptySet(), Collections.emptySet());

    private final Set<CellAddress> cells;
    private final Set<CellRange> ranges;
    private final Set<String> names;

    public FormulaReferences(Set<CellAddress> cells, Set<CellRange> ranges, Set<String> names) {
        this.cells = Collections.unmodifiableSet(new LinkedHashSet<>(cells));
        this.ranges = Collections.unmodifiableSet(new LinkedHashSet<>(ranges));
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public Set<CellAddress> getCells() {
        return cells;
    }

    public Set<CellRange> getRanges() {
        return ranges;
    }

    public Set<String> getNames() {
        return names;
    }

    public boolean isEmpty() {
        return cells.isEmpty() && ranges.isEmpty() && names.isEmpty();
    }
}
