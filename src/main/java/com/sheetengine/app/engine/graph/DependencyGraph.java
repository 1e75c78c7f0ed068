package com.sheetengine.app.engine.graph;

import com.sheetengine.app.engine.formula.FormulaReferences;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.NamedRange;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workbook-wide precedent/dependent edges between formula cells and what
 * they read.
 * <p>
 * Single-cell references are kept as explicit reverse edges. Range and name
 * references are kept per formula and matched by containment when asking for
 * dependents, so a formula over A1:A100000 costs one entry rather than one
 * edge per cell.
 */
public class DependencyGraph {

    // Forward adjacency: formula cell -> everything it reads
    private final Map<CellKey, FormulaReferences> forward = new ConcurrentHashMap<>();
    // Reverse adjacency: referenced cell -> formulas that name it directly
    private final Map<CellKey, Set<CellKey>> reverse = new ConcurrentHashMap<>();
    // sheet id -> formulas on that sheet reading at least one range
    private final Map<String, Set<CellKey>> rangeUsers = new ConcurrentHashMap<>();
    // upper-case name -> formulas reading it
    private final Map<String, Set<CellKey>> nameUsers = new ConcurrentHashMap<>();

    /**
     * Replaces the precedents of {@code formula}, diffing away its old edges.
     */
    public void setPrecedents(CellKey formula, FormulaReferences references) {
        clearDependencies(formula);
        if (references == null || references.isEmpty()) {
            return;
        }
        forward.put(formula, references);
        for (CellAddress address : references.getCells()) {
            reverse.computeIfAbsent(CellKey.of(formula.getSheetId(), address), k -> new HashSet<>())
                    .add(formula);
        }
        if (!references.getRanges().isEmpty()) {
            rangeUsers.computeIfAbsent(formula.getSheetId(), k -> new HashSet<>()).add(formula);
        }
        for (String name : references.getNames()) {
            nameUsers.computeIfAbsent(name, k -> new HashSet<>()).add(formula);
        }
    }

    /**
     * Removes every outgoing edge of {@code formula}.
     */
    public void clearDependencies(CellKey formula) {
        FormulaReferences old = forward.remove(formula);
        if (old == null) {
            return;
        }
        for (CellAddress address : old.getCells()) {
            CellKey target = CellKey.of(formula.getSheetId(), address);
            Set<CellKey> dependents = reverse.get(target);
            if (dependents != null) {
                dependents.remove(formula);
                if (dependents.isEmpty()) {
                    reverse.remove(target);
                }
            }
        }
        Set<CellKey> users = rangeUsers.get(formula.getSheetId());
        if (users != null) {
            users.remove(formula);
        }
        for (String name : old.getNames()) {
            Set<CellKey> readers = nameUsers.get(name);
            if (readers != null) {
                readers.remove(formula);
            }
        }
    }

    public FormulaReferences precedentsOf(CellKey formula) {
        return forward.getOrDefault(formula, FormulaReferences.NONE);
    }

    /**
     * Formulas that read {@code cell}: direct references, ranges containing
     * it, and names whose range contains it.
     */
    public Set<CellKey> dependentsOf(CellKey cell, Map<String, NamedRange> names) {
        Set<CellKey> result = new LinkedHashSet<>(reverse.getOrDefault(cell, Collections.emptySet()));
        for (CellKey user : rangeUsers.getOrDefault(cell.getSheetId(), Collections.emptySet())) {
            for (CellRange range : forward.get(user).getRanges()) {
                if (range.contains(cell.getAddress())) {
                    result.add(user);
                    break;
                }
            }
        }
        for (Map.Entry<String, Set<CellKey>> entry : nameUsers.entrySet()) {
            NamedRange named = names.get(entry.getKey());
            if (named != null && !named.isBroken()
                    && named.getSheetId().equals(cell.getSheetId())
                    && named.getRange().contains(cell.getAddress())) {
                result.addAll(entry.getValue());
            }
        }
        return result;
    }

    /**
     * Formulas reading the given name, whether or not it currently resolves.
     */
    public Set<CellKey> usersOfName(String name) {
        return new LinkedHashSet<>(nameUsers.getOrDefault(name, Collections.emptySet()));
    }

    public void removeSheet(String sheetId) {
        for (CellKey formula : new HashSet<>(forward.keySet())) {
            if (formula.getSheetId().equals(sheetId)) {
                clearDependencies(formula);
            }
        }
        rangeUsers.remove(sheetId);
        reverse.keySet().removeIf(key -> key.getSheetId().equals(sheetId));
    }

    public void clear() {
        forward.clear();
        reverse.clear();
        rangeUsers.clear();
        nameUsers.clear();
    }

    public int size() {
        return forward.size();
    }

    // ------------------------
    // Views for clients
    // ------------------------

    /**
     * For each formula on the sheet, the cells, ranges and names it reads.
     */
    public Map<String, Set<String>> forwardView(String sheetId) {
        Map<String, Set<String>> view = new TreeMap<>();
        for (Map.Entry<CellKey, FormulaReferences> entry : forward.entrySet()) {
            if (!entry.getKey().getSheetId().equals(sheetId)) {
                continue;
            }
            Set<String> targets = new TreeSet<>();
            FormulaReferences refs = entry.getValue();
            refs.getCells().forEach(a -> targets.add(a.toString()));
            refs.getRanges().forEach(r -> targets.add(r.toString()));
            targets.addAll(refs.getNames());
            view.put(entry.getKey().getAddress().toString(), targets);
        }
        return view;
    }

    /**
     * For each directly referenced cell or range on the sheet, the formulas reading it.
     */
    public Map<String, Set<String>> reverseView(String sheetId) {
        Map<String, Set<String>> view = new TreeMap<>();
        for (Map.Entry<CellKey, Set<CellKey>> entry : reverse.entrySet()) {
            if (!entry.getKey().getSheetId().equals(sheetId)) {
                continue;
            }
            Set<String> readers = new TreeSet<>();
            entry.getValue().forEach(k -> readers.add(k.getAddress().toString()));
            view.put(entry.getKey().getAddress().toString(), readers);
        }
        for (CellKey user : rangeUsers.getOrDefault(sheetId, Collections.emptySet())) {
            for (CellRange range : forward.get(user).getRanges()) {
                view.computeIfAbsent(range.toString(), k -> new TreeSet<>())
                        .add(user.getAddress().toString());
            }
        }
        return view;
    }
}
