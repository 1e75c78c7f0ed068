package com.sheetengine.app.engine.graph;

import com.sheetengine.app.engine.address.RangeResolver;
import com.sheetengine.app.engine.formula.Evaluator;
import com.sheetengine.app.engine.formula.FormulaReferences;
import com.sheetengine.app.engine.formula.ReferenceCollector;
import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.models.Cell;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.ErrorCode;
import com.sheetengine.app.models.NamedRange;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Propagates edits through the dependency graph.
 * <p>
 * A pass first collects the transitive dependents of its roots, then splits
 * them into strongly connected components and evaluates the components in
 * dependency order, so every formula is evaluated once per pass. Members of a
 * component with more than one cell, or with a self-reference, cache #CIRC!.
 * So does every formula downstream of them in the same pass.
 */
public class RecalculationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RecalculationScheduler.class);

    private final FunctionRegistry functions;
    private final Clock clock;

    public RecalculationScheduler(FunctionRegistry functions, Clock clock) {
        this.functions = functions;
        this.clock = clock;
    }

    /**
     * Recalculates the formulas among {@code roots} and everything that
     * depends on them, transitively.
     */
    public RecalculationResult recalculate(Workbook workbook, Collection<CellKey> roots) {
        Set<CellKey> affected = collectAffected(workbook, roots);
        return run(workbook, affected);
    }

    /**
     * Evaluates just the given formula cells, without touching their dependents.
     * Used in MANUAL mode so an edited formula still shows a value.
     */
    public RecalculationResult evaluateOnly(Workbook workbook, Collection<CellKey> keys) {
        Set<CellKey> formulas = new LinkedHashSet<>();
        for (CellKey key : keys) {
            Cell cell = cellAt(workbook, key);
            if (cell != null && cell.isFormula()) {
                formulas.add(key);
            }
        }
        return run(workbook, formulas);
    }

    /**
     * Recalculates every formula in the workbook.
     */
    public RecalculationResult recalculateAll(Workbook workbook) {
        Set<CellKey> all = new LinkedHashSet<>();
        for (Sheet sheet : workbook.getSheets()) {
            for (Cell cell : sheet.getGrid().formulaCells()) {
                all.add(CellKey.of(sheet.getId(), cell.getAddress()));
            }
        }
        return run(workbook, all);
    }

    /**
     * Rebuilds every edge from the ASTs currently stored in the grids.
     */
    public void rebuildGraph(Workbook workbook) {
        DependencyGraph graph = workbook.getGraph();
        graph.clear();
        for (Sheet sheet : workbook.getSheets()) {
            for (Cell cell : sheet.getGrid().formulaCells()) {
                graph.setPrecedents(CellKey.of(sheet.getId(), cell.getAddress()),
                        ReferenceCollector.collect(cell.getFormula()));
            }
        }
    }

    private Set<CellKey> collectAffected(Workbook workbook, Collection<CellKey> roots) {
        DependencyGraph graph = workbook.getGraph();
        Map<String, NamedRange> names = workbook.getNamedRanges();
        Set<CellKey> affected = new LinkedHashSet<>();
        Set<CellKey> visited = new HashSet<>(roots);
        Deque<CellKey> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            CellKey current = queue.poll();
            Cell cell = cellAt(workbook, current);
            if (cell != null && cell.isFormula()) {
                affected.add(current);
            }
            for (CellKey dependent : graph.dependentsOf(current, names)) {
                if (visited.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return affected;
    }

    private RecalculationResult run(Workbook workbook, Set<CellKey> affected) {
        RecalculationResult result = new RecalculationResult();
        Map<String, Evaluator> evaluators = new HashMap<>();
        int precision = workbook.getSettings().getPrecision();

        Map<CellKey, List<CellKey>> precedents = new HashMap<>();
        for (CellKey key : affected) {
            precedents.put(key, inPassPrecedents(workbook, key, affected));
        }
        // Cycle members and everything reading them, directly or not
        Set<CellKey> tainted = new HashSet<>();

        for (List<CellKey> component : components(affected, precedents)) {
            CellKey first = component.get(0);
            boolean circular = component.size() > 1 || precedents.get(first).contains(first);
            for (CellKey key : component) {
                Cell cell = cellAt(workbook, key);
                CellValue oldValue = cell.getValue();
                CellValue newValue;
                if (circular) {
                    newValue = CellValue.error(ErrorCode.CIRC);
                    result.recordCircular(key);
                    tainted.add(key);
                } else if (!Collections.disjoint(precedents.get(key), tainted)) {
                    newValue = CellValue.error(ErrorCode.CIRC);
                    tainted.add(key);
                } else {
                    newValue = round(evaluate(workbook, evaluators, key, cell), precision);
                }
                cell.setValue(newValue);
                result.recordEvaluation(key, oldValue, newValue);
            }
        }

        if (!result.getCircular().isEmpty()) {
            logger.warn("Circular reference in workbook {} through {}", workbook.getId(), result.getCircular());
        }
        logger.debug("Recalculated {} formulas in workbook {} ({} changed)",
                result.getEvaluated().size(), workbook.getId(), result.getChanged().size());
        return result;
    }

    /**
     * Strongly connected components of the pass, following edges from a
     * formula to its precedents (Tarjan, with an explicit stack). A component
     * is emitted only after every component it reads from, so the list is
     * also the evaluation order.
     */
    static List<List<CellKey>> components(Set<CellKey> nodes, Map<CellKey, List<CellKey>> precedents) {
        List<List<CellKey>> components = new ArrayList<>();
        Map<CellKey, Integer> index = new HashMap<>();
        Map<CellKey, Integer> lowLink = new HashMap<>();
        Deque<CellKey> open = new ArrayDeque<>();
        Set<CellKey> onStack = new HashSet<>();
        Deque<Frame> path = new ArrayDeque<>();

        for (CellKey start : nodes) {
            if (index.containsKey(start)) {
                continue;
            }
            enter(start, precedents, index, lowLink, open, onStack, path);
            while (!path.isEmpty()) {
                Frame top = path.peek();
                if (top.precedents.hasNext()) {
                    CellKey next = top.precedents.next();
                    if (!index.containsKey(next)) {
                        enter(next, precedents, index, lowLink, open, onStack, path);
                    } else if (onStack.contains(next)) {
                        lowLink.put(top.key, Math.min(lowLink.get(top.key), index.get(next)));
                    }
                    continue;
                }
                path.pop();
                if (!path.isEmpty()) {
                    CellKey parent = path.peek().key;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(top.key)));
                }
                if (lowLink.get(top.key).equals(index.get(top.key))) {
                    List<CellKey> component = new ArrayList<>();
                    CellKey member;
                    do {
                        member = open.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(top.key));
                    components.add(component);
                }
            }
        }
        return components;
    }

    private static void enter(CellKey key, Map<CellKey, List<CellKey>> precedents, Map<CellKey, Integer> index,
                              Map<CellKey, Integer> lowLink, Deque<CellKey> open, Set<CellKey> onStack,
                              Deque<Frame> path) {
        int order = index.size();
        index.put(key, order);
        lowLink.put(key, order);
        open.push(key);
        onStack.add(key);
        List<CellKey> edges = precedents.get(key);
        path.push(new Frame(key, edges == null ? Collections.<CellKey>emptyIterator() : edges.iterator()));
    }

    /**
     * Precedents of {@code formula} that are themselves part of this pass.
     * Precedents outside the pass already hold current values.
     */
    private List<CellKey> inPassPrecedents(Workbook workbook, CellKey formula, Set<CellKey> affected) {
        FormulaReferences refs = workbook.getGraph().precedentsOf(formula);
        if (refs.isEmpty()) {
            return Collections.emptyList();
        }
        Set<CellKey> result = new LinkedHashSet<>();
        String sheetId = formula.getSheetId();
        for (CellAddress address : refs.getCells()) {
            CellKey key = CellKey.of(sheetId, address);
            if (affected.contains(key)) {
                result.add(key);
            }
        }
        for (CellRange range : refs.getRanges()) {
            addInRange(result, sheetId, range, affected);
        }
        for (String name : refs.getNames()) {
            NamedRange named = workbook.findNamedRange(name);
            if (named != null && !named.isBroken()) {
                addInRange(result, named.getSheetId(), named.getRange(), affected);
            }
        }
        return new ArrayList<>(result);
    }

    private static void addInRange(Set<CellKey> result, String sheetId, CellRange range, Set<CellKey> affected) {
        if (range.area() < affected.size()) {
            for (CellAddress address : RangeResolver.expand(range)) {
                CellKey key = CellKey.of(sheetId, address);
                if (affected.contains(key)) {
                    result.add(key);
                }
            }
            return;
        }
        for (CellKey key : affected) {
            if (key.getSheetId().equals(sheetId) && range.contains(key.getAddress())) {
                result.add(key);
            }
        }
    }

    private CellValue evaluate(Workbook workbook, Map<String, Evaluator> evaluators, CellKey key, Cell cell) {
        if (cell.getFormula() == null) {
            // Stored text that never parsed
            return CellValue.error(ErrorCode.ERROR);
        }
        Evaluator evaluator = evaluators.computeIfAbsent(key.getSheetId(), sheetId ->
                new Evaluator(new WorkbookEvaluationContext(workbook, workbook.getSheet(sheetId), functions, clock)));
        try {
            return evaluator.evaluate(cell.getFormula());
        } catch (RuntimeException e) {
            logger.warn("Evaluation of {} failed: {}", key, e.getMessage());
            return CellValue.error(ErrorCode.ERROR);
        }
    }

    /**
     * Rounds numbers to {@code precision} significant digits.
     */
    static CellValue round(CellValue value, int precision) {
        if (!value.isNumber() || precision <= 0 || value.getNumber() == 0d) {
            return value;
        }
        double rounded = BigDecimal.valueOf(value.getNumber())
                .round(new MathContext(precision))
                .doubleValue();
        return CellValue.number(rounded);
    }

    private static Cell cellAt(Workbook workbook, CellKey key) {
        Sheet sheet = workbook.findSheet(key.getSheetId());
        return sheet == null ? null : sheet.getGrid().get(key.getAddress());
    }

    private static final class Frame {
        private final CellKey key;
        private final Iterator<CellKey> precedents;

        private Frame(CellKey key, Iterator<CellKey> precedents) {
            this.key = key;
            this.precedents = precedents;
        }
    }
}
