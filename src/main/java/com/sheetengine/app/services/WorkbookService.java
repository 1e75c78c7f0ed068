package com.sheetengine.app.services;

import com.sheetengine.app.config.EngineProperties;
import com.sheetengine.app.engine.address.AddressCodec;
import com.sheetengine.app.engine.address.RangeResolver;
import com.sheetengine.app.engine.formula.Coercions;
import com.sheetengine.app.engine.formula.FormulaNode;
import com.sheetengine.app.engine.formula.FormulaParser;
import com.sheetengine.app.engine.formula.ReferenceCollector;
import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.engine.graph.CellKey;
import com.sheetengine.app.engine.graph.RecalculationResult;
import com.sheetengine.app.engine.graph.RecalculationScheduler;
import com.sheetengine.app.engine.structure.StructuralMutationEngine;
import com.sheetengine.app.events.EventBus;
import com.sheetengine.app.exceptions.ChartNotFoundException;
import com.sheetengine.app.exceptions.DocumentNotFoundException;
import com.sheetengine.app.exceptions.DocumentPersistenceException;
import com.sheetengine.app.exceptions.FormulaSyntaxException;
import com.sheetengine.app.exceptions.InvalidOperationException;
import com.sheetengine.app.exceptions.MutationTimeoutException;
import com.sheetengine.app.exceptions.NotFoundException;
import com.sheetengine.app.exceptions.ValidationException;
import com.sheetengine.app.models.CalculationMode;
import com.sheetengine.app.models.Cell;
import com.sheetengine.app.models.CellAddress;
import com.sheetengine.app.models.CellInput;
import com.sheetengine.app.models.CellRange;
import com.sheetengine.app.models.CellValue;
import com.sheetengine.app.models.CellView;
import com.sheetengine.app.models.ChartSpec;
import com.sheetengine.app.models.DateSystem;
import com.sheetengine.app.models.FilterSpec;
import com.sheetengine.app.models.NamedRange;
import com.sheetengine.app.models.RangeInput;
import com.sheetengine.app.models.Sheet;
import com.sheetengine.app.models.SortOptions;
import com.sheetengine.app.models.Workbook;
import com.sheetengine.app.models.WorkbookSettings;
import com.sheetengine.app.persistence.DocumentCache;
import com.sheetengine.app.persistence.DocumentStore;
import com.sheetengine.app.persistence.DocumentStoreException;
import com.sheetengine.app.persistence.WorkbookSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Main business logic for spreadsheet documents: lifecycle, cell and range
 * edits, structural edits, charts, filters, sorting, names and settings.
 * <p>
 * Every mutation runs under the document's write lock, acquired with a
 * timeout. Inside the lock the engine updates the grid, the dependency graph
 * and cached values, then serializes the workbook in memory. Saving to the
 * store, refreshing the cache and publishing change events happen after the
 * lock is released. A failed save leaves the in-memory workbook authoritative
 * and marked unsaved; {@link #flush(String)} retries it.
 */
@Service
public class WorkbookService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookService.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    // All open documents live here; the store holds their serialized form
    private final Map<String, Workbook> documents = new ConcurrentHashMap<>();

    private final DocumentStore documentStore;
    private final DocumentCache documentCache;
    private final EventBus eventBus;
    private final WorkbookSerializer serializer;
    private final EngineProperties properties;
    private final FunctionRegistry functions;
    private final Clock clock;
    private final RecalculationScheduler scheduler;
    private final StructuralMutationEngine structuralEngine;

    public WorkbookService(DocumentStore documentStore, DocumentCache documentCache, EventBus eventBus,
                           WorkbookSerializer serializer, EngineProperties properties,
                           FunctionRegistry functionRegistry, Clock clock) {
        this.documentStore = documentStore;
        this.documentCache = documentCache;
        this.eventBus = eventBus;
        this.serializer = serializer;
        this.properties = properties;
        this.functions = functionRegistry;
        this.clock = clock;
        this.scheduler = new RecalculationScheduler(functionRegistry, clock);
        this.structuralEngine = new StructuralMutationEngine(scheduler);
    }

    // ----------------------------------------------------------------
    // Documents
    // ----------------------------------------------------------------

    /**
     * Creates a workbook with one empty sheet, persists it and returns its id.
     */
    public String createDocument(String title) {
        String id = UUID.randomUUID().toString();
        Workbook workbook = new Workbook(id, title == null || title.isBlank() ? "Untitled" : title);
        workbook.setSettings(new WorkbookSettings(CalculationMode.AUTO, properties.getDefaultPrecision(),
                DateSystem.fromValue(properties.getDefaultDateSystem())));
        workbook.addSheet(new Sheet(workbook.nextSheetId(), "Sheet1",
                properties.getDefaultRows(), properties.getDefaultCols()));
        documents.put(id, workbook);
        logger.debug("Created document {}", id);

        long version = workbook.nextVersion();
        persist(workbook, version, serializer.serialize(workbook));
        return id;
    }

    /**
     * Loads a document (cache first, then the store), recalculates it and
     * returns its summary. Already open documents are returned as they are.
     */
    public Map<String, Object> openDocument(String documentId) {
        return read(documentId, this::describe);
    }

    public Map<String, Object> getDocument(String documentId) {
        return read(documentId, this::describe);
    }

    /**
     * The serialized workbook, as it would be stored.
     */
    public String exportContent(String documentId) {
        return read(documentId, serializer::serialize);
    }

    /**
     * Retries persistence of unsaved changes. Returns the persisted version.
     */
    public long flush(String documentId) {
        Workbook workbook = resolve(documentId);
        long version;
        String content;
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            if (!workbook.isDirty()) {
                return workbook.getPersistedVersion();
            }
            version = workbook.getVersion();
            content = serializer.serialize(workbook);
        } finally {
            lock.unlock();
        }
        persist(workbook, version, content);
        return workbook.getPersistedVersion();
    }

    // ----------------------------------------------------------------
    // Sheets
    // ----------------------------------------------------------------

    public String createSheet(String documentId, String name) {
        return write(documentId, (workbook, events) -> {
            String sheetId = workbook.nextSheetId();
            String sheetName = name == null || name.isBlank() ? "Sheet" + (workbook.getSheets().size() + 1) : name;
            for (Sheet existing : workbook.getSheets()) {
                if (existing.getName().equalsIgnoreCase(sheetName)) {
                    throw new InvalidOperationException("A sheet named " + sheetName + " already exists");
                }
            }
            workbook.addSheet(new Sheet(sheetId, sheetName, properties.getDefaultRows(), properties.getDefaultCols()));
            events.add(new PendingEvent(sheetId, "sheet", "created"));
            logger.debug("Created sheet {} in {}", sheetId, documentId);
            return sheetId;
        });
    }

    /**
     * Removes a sheet. The last sheet of a workbook cannot be deleted.
     * Formulas reading it through a name turn into #REF!.
     */
    public void deleteSheet(String documentId, String sheetId) {
        write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            if (workbook.getSheets().size() <= 1) {
                throw new InvalidOperationException("Cannot delete the last sheet");
            }
            Set<CellKey> readers = new LinkedHashSet<>();
            for (NamedRange named : workbook.getNamedRanges().values()) {
                if (named.getSheetId().equals(sheetId)) {
                    readers.addAll(workbook.getGraph().usersOfName(named.getName().toUpperCase(Locale.ROOT)));
                }
            }
            workbook.removeSheet(sheet);
            readers.removeIf(key -> key.getSheetId().equals(sheetId));
            propagate(workbook, readers, events);
            events.add(new PendingEvent(sheetId, "sheet", "deleted"));
            return null;
        });
    }

    public void setActiveSheet(String documentId, String sheetId) {
        write(documentId, (workbook, events) -> {
            workbook.getSheet(sheetId);
            workbook.setActiveSheetId(sheetId);
            return null;
        });
    }

    // ----------------------------------------------------------------
    // Cells and ranges
    // ----------------------------------------------------------------

    /**
     * Writes one cell: a literal value or a formula, never both. A format,
     * if given, is merged into the existing one. An input carrying only a
     * format leaves the value alone.
     */
    public CellView setCell(String documentId, String sheetId, String addressText, CellInput input) {
        CellAddress address = CellAddress.parse(addressText);
        validate(input);
        return write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            CellKey key = applyInput(workbook, sheet, address, input);
            propagate(workbook, Collections.singletonList(key), events);
            Cell cell = sheet.getGrid().get(address);
            CellView view = cell == null ? CellView.blank(address) : CellView.of(cell);
            events.add(0, new PendingEvent(sheetId, address.toString(), view.getValue()));
            return view;
        });
    }

    /**
     * Writes {@code =NAME(p1,p2,...)} into a cell. Parameters are formula
     * fragments ("A1:A3", "2", "\"text\"") and are joined as given.
     */
    public CellView insertFunction(String documentId, String sheetId, String addressText,
                                   String functionName, List<String> parameters) {
        if (functionName == null || !NAME_PATTERN.matcher(functionName).matches()
                || functions.lookup(functionName) == null) {
            throw new ValidationException("Unknown function: " + functionName);
        }
        List<String> args = parameters == null ? Collections.emptyList() : parameters;
        for (String arg : args) {
            if (arg == null || arg.isBlank()) {
                throw new ValidationException("Empty parameter for function " + functionName);
            }
        }
        String formula = "=" + functionName.toUpperCase(Locale.ROOT) + "(" + String.join(",", args) + ")";
        logger.debug("Inserting {} into {}!{} of document {}", formula, sheetId, addressText, documentId);
        return setCell(documentId, sheetId, addressText, CellInput.formula(formula));
    }

    /**
     * Writes a rectangle. Grids are anchored at the range's top-left and may
     * not be larger than the range; null entries leave a cell untouched.
     */
    public List<CellView> setRange(String documentId, String sheetId, String rangeText, RangeInput input) {
        CellRange range = RangeResolver.parseRange(rangeText);
        Map<CellAddress, CellInput> inputs = flatten(range, input);
        return write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            List<CellKey> keys = new ArrayList<>();
            for (Map.Entry<CellAddress, CellInput> entry : inputs.entrySet()) {
                keys.add(applyInput(workbook, sheet, entry.getKey(), entry.getValue()));
            }
            propagate(workbook, keys, events);
            events.add(0, new PendingEvent(sheetId, range.toString(), null));
            List<CellView> views = new ArrayList<>();
            for (CellAddress address : inputs.keySet()) {
                Cell cell = sheet.getGrid().get(address);
                views.add(cell == null ? CellView.blank(address) : CellView.of(cell));
            }
            return views;
        });
    }

    /**
     * Removes every cell in the range, inputs and formats alike.
     */
    public void clearRange(String documentId, String sheetId, String rangeText) {
        CellRange range = RangeResolver.parseRange(rangeText);
        write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            List<CellKey> keys = new ArrayList<>();
            for (Cell removed : sheet.getGrid().clear(range)) {
                CellKey key = CellKey.of(sheetId, removed.getAddress());
                workbook.getGraph().clearDependencies(key);
                keys.add(key);
            }
            propagate(workbook, keys, events);
            events.add(0, new PendingEvent(sheetId, range.toString(), null));
            return null;
        });
    }

    public CellView getCell(String documentId, String sheetId, String addressText) {
        CellAddress address = CellAddress.parse(addressText);
        return read(documentId, workbook -> {
            Cell cell = workbook.getSheet(sheetId).getGrid().get(address);
            return cell == null ? CellView.blank(address) : CellView.of(cell);
        });
    }

    /**
     * Computed values of every populated cell, in row-major order.
     */
    public Map<String, Object> getSheetValues(String documentId, String sheetId) {
        return read(documentId, workbook -> {
            Map<String, Object> data = new LinkedHashMap<>();
            for (Cell cell : sortedCells(workbook.getSheet(sheetId))) {
                data.put(cell.getAddress().toString(), cell.getValue().toJavaObject());
            }
            return data;
        });
    }

    /**
     * Formula text of every formula cell, in row-major order.
     */
    public Map<String, String> getFormulas(String documentId, String sheetId) {
        return read(documentId, workbook -> {
            Map<String, String> formulas = new LinkedHashMap<>();
            for (Cell cell : sortedCells(workbook.getSheet(sheetId))) {
                if (cell.isFormula()) {
                    formulas.put(cell.getAddress().toString(), cell.getFormulaText());
                }
            }
            return formulas;
        });
    }

    public Map<String, Set<String>> getForwardDependencies(String documentId, String sheetId) {
        return read(documentId, workbook -> {
            workbook.getSheet(sheetId);
            return workbook.getGraph().forwardView(sheetId);
        });
    }

    public Map<String, Set<String>> getReverseDependencies(String documentId, String sheetId) {
        return read(documentId, workbook -> {
            workbook.getSheet(sheetId);
            return workbook.getGraph().reverseView(sheetId);
        });
    }

    // ----------------------------------------------------------------
    // Structural edits
    // ----------------------------------------------------------------

    public void insertRows(String documentId, String sheetId, int at, int count) {
        structural(documentId, sheetId, true, at, count, true);
    }

    public void insertColumns(String documentId, String sheetId, int at, int count) {
        structural(documentId, sheetId, false, at, count, true);
    }

    public void deleteRows(String documentId, String sheetId, int at, int count) {
        structural(documentId, sheetId, true, at, count, false);
    }

    public void deleteColumns(String documentId, String sheetId, int at, int count) {
        structural(documentId, sheetId, false, at, count, false);
    }

    private void structural(String documentId, String sheetId, boolean rows, int at, int count, boolean insert) {
        write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            String band = rows
                    ? AddressCodec.encode(Math.max(at, 1), 1) + ":" + AddressCodec.encode(Math.max(at + count - 1, 1), sheet.getCols())
                    : AddressCodec.encode(1, Math.max(at, 1)) + ":" + AddressCodec.encode(sheet.getRows(), Math.max(at + count - 1, 1));
            RecalculationResult result;
            if (rows) {
                result = insert ? structuralEngine.insertRows(workbook, sheet, at, count)
                        : structuralEngine.deleteRows(workbook, sheet, at, count);
            } else {
                result = insert ? structuralEngine.insertColumns(workbook, sheet, at, count)
                        : structuralEngine.deleteColumns(workbook, sheet, at, count);
            }
            workbook.setRecalculationPending(false);
            events.add(new PendingEvent(sheetId, band, null));
            addChanged(workbook, result, events);
            return null;
        });
    }

    // ----------------------------------------------------------------
    // Charts, filters, sorting
    // ----------------------------------------------------------------

    public ChartSpec createChart(String documentId, String sheetId, ChartSpec chart) {
        if (chart.getDataRange() != null) {
            RangeResolver.parseRange(chart.getDataRange());
        }
        return write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            chart.setId(workbook.nextChartId());
            if (chart.getTitle() == null) {
                chart.setTitle("Chart");
            }
            if (chart.getPosition() == null || chart.getPosition().isEmpty()) {
                chart.setPosition(sizeMap("x", 100, "y", 100));
            }
            if (chart.getSize() == null || chart.getSize().isEmpty()) {
                chart.setSize(sizeMap("width", 400, "height", 300));
            }
            chart.setCreatedAt(Instant.now(clock).toString());
            sheet.getCharts().add(chart);
            events.add(new PendingEvent(sheetId, "chart:" + chart.getId(), "created"));
            return chart;
        });
    }

    /**
     * Merges the non-null fields of {@code patch} into an existing chart.
     */
    public ChartSpec updateChart(String documentId, String sheetId, String chartId, ChartSpec patch) {
        if (patch.getDataRange() != null) {
            RangeResolver.parseRange(patch.getDataRange());
        }
        return write(documentId, (workbook, events) -> {
            ChartSpec chart = findChart(workbook.getSheet(sheetId), chartId);
            chart.merge(patch);
            chart.setUpdatedAt(Instant.now(clock).toString());
            events.add(new PendingEvent(sheetId, "chart:" + chartId, "updated"));
            return chart;
        });
    }

    public void deleteChart(String documentId, String sheetId, String chartId) {
        write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            sheet.getCharts().remove(findChart(sheet, chartId));
            events.add(new PendingEvent(sheetId, "chart:" + chartId, "deleted"));
            return null;
        });
    }

    /**
     * Stores the filter for a range, replacing any earlier one on the same range.
     */
    public void applyFilter(String documentId, String sheetId, String rangeText, List<Map<String, Object>> predicates) {
        CellRange range = RangeResolver.parseRange(rangeText);
        write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            List<Map<String, Object>> stored = predicates == null ? new ArrayList<>() : new ArrayList<>(predicates);
            sheet.getFilters().put(range.toString(), new FilterSpec(stored, Instant.now(clock).toString()));
            events.add(new PendingEvent(sheetId, range.toString(), null));
            return null;
        });
    }

    /**
     * Sorts the rows of a range by one column of computed values and writes
     * the result back as literals. Formulas inside the range are flattened.
     * The sort is stable; blank keys go last in either direction.
     */
    public void sortRange(String documentId, String sheetId, String rangeText, SortOptions options) {
        CellRange range = RangeResolver.parseRange(rangeText);
        if (options.getColumn() < 0 || options.getColumn() >= range.width()) {
            throw new ValidationException("Sort column " + options.getColumn()
                    + " is outside the range " + range + " (0.." + (range.width() - 1) + ")");
        }
        write(documentId, (workbook, events) -> {
            Sheet sheet = workbook.getSheet(sheetId);
            int firstRow = range.getStartRow() + (options.isHasHeaders() ? 1 : 0);
            List<SortRow> rows = new ArrayList<>();
            for (int r = firstRow; r <= range.getEndRow(); r++) {
                rows.add(SortRow.read(sheet, r, range.getStartCol(), range.getEndCol()));
            }
            rows.sort(sortOrder(options));

            List<CellKey> keys = new ArrayList<>();
            for (int i = 0; i < rows.size(); i++) {
                int targetRow = firstRow + i;
                SortRow row = rows.get(i);
                for (int c = 0; c < range.width(); c++) {
                    CellAddress address = CellAddress.of(targetRow, range.getStartCol() + c);
                    CellKey key = CellKey.of(sheetId, address);
                    workbook.getGraph().clearDependencies(key);
                    CellValue value = row.values.get(c);
                    Map<String, Object> format = row.formats.get(c);
                    if (value.isBlank() && (format == null || format.isEmpty())) {
                        sheet.getGrid().remove(address);
                    } else {
                        Cell cell = sheet.getGrid().getOrCreate(address);
                        cell.setLiteral(value);
                        cell.setFormat(format);
                    }
                    keys.add(key);
                }
            }
            sheet.setSort(range.toString(), options);
            if (workbook.getSettings().getCalculationMode() == CalculationMode.AUTO) {
                addChanged(workbook, scheduler.recalculateAll(workbook), events);
            } else {
                workbook.setRecalculationPending(true);
            }
            events.add(0, new PendingEvent(sheetId, range.toString(), null));
            logger.debug("Sorted {}!{} by column {} in {}", sheetId, range, options.getColumn(), documentId);
            return null;
        });
    }

    // ----------------------------------------------------------------
    // Names and settings
    // ----------------------------------------------------------------

    /**
     * Binds a workbook-level name to a range. Formulas refer to it by name,
     * case-insensitively.
     */
    public void defineName(String documentId, String name, String sheetId, String rangeText) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()
                || AddressCodec.isCellReference(name.toUpperCase(Locale.ROOT))
                || "TRUE".equalsIgnoreCase(name) || "FALSE".equalsIgnoreCase(name)) {
            throw new ValidationException("Invalid name: " + name);
        }
        CellRange range = RangeResolver.parseRange(rangeText);
        write(documentId, (workbook, events) -> {
            workbook.getSheet(sheetId);
            workbook.putNamedRange(new NamedRange(name, sheetId, range));
            propagate(workbook, workbook.getGraph().usersOfName(name.toUpperCase(Locale.ROOT)), events);
            return null;
        });
    }

    public void removeName(String documentId, String name) {
        write(documentId, (workbook, events) -> {
            String key = name.toUpperCase(Locale.ROOT);
            if (workbook.getNamedRanges().remove(key) == null) {
                throw new NotFoundException("Named range not found: " + name);
            }
            propagate(workbook, workbook.getGraph().usersOfName(key), events);
            return null;
        });
    }

    public Map<String, String> getNames(String documentId) {
        return read(documentId, workbook -> {
            Map<String, String> names = new LinkedHashMap<>();
            for (NamedRange named : workbook.getNamedRanges().values()) {
                names.put(named.getName(), named.toString());
            }
            return names;
        });
    }

    /**
     * Applies the non-null settings. Switching to AUTO, or changing precision
     * or date system while in AUTO, recalculates everything.
     */
    public WorkbookSettings updateSettings(String documentId, CalculationMode mode, Integer precision,
                                           DateSystem dateSystem) {
        if (precision != null && (precision < 1 || precision > 17)) {
            throw new ValidationException("Precision must be between 1 and 17, got " + precision);
        }
        return write(documentId, (workbook, events) -> {
            WorkbookSettings settings = workbook.getSettings();
            boolean valuesAffected = (precision != null && precision != settings.getPrecision())
                    || (dateSystem != null && dateSystem != settings.getDateSystem());
            boolean resumed = mode == CalculationMode.AUTO && settings.getCalculationMode() == CalculationMode.MANUAL;
            if (mode != null) {
                settings.setCalculationMode(mode);
            }
            if (precision != null) {
                settings.setPrecision(precision);
            }
            if (dateSystem != null) {
                settings.setDateSystem(dateSystem);
            }
            if (settings.getCalculationMode() == CalculationMode.AUTO && (resumed || valuesAffected)) {
                addChanged(workbook, scheduler.recalculateAll(workbook), events);
                workbook.setRecalculationPending(false);
            } else if (valuesAffected) {
                workbook.setRecalculationPending(true);
            }
            return settings;
        });
    }

    /**
     * Full recalculation of every formula; clears a pending MANUAL backlog.
     */
    public RecalculationResult recalculate(String documentId) {
        return write(documentId, (workbook, events) -> {
            RecalculationResult result = scheduler.recalculateAll(workbook);
            workbook.setRecalculationPending(false);
            addChanged(workbook, result, events);
            return result;
        });
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    @FunctionalInterface
    private interface Mutation<T> {
        T apply(Workbook workbook, List<PendingEvent> events);
    }

    private static final class PendingEvent {
        private final String sheetId;
        private final String addressOrRange;
        private final Object newValue;

        private PendingEvent(String sheetId, String addressOrRange, Object newValue) {
            this.sheetId = sheetId;
            this.addressOrRange = addressOrRange;
            this.newValue = newValue;
        }
    }

    /**
     * Runs a mutation under the write lock, then persists and publishes
     * outside it.
     */
    private <T> T write(String documentId, Mutation<T> mutation) {
        Workbook workbook = resolve(documentId);
        Lock lock = workbook.getLock().writeLock();
        acquire(lock, documentId);
        T result;
        long version;
        String content;
        List<PendingEvent> events = new ArrayList<>();
        try {
            result = mutation.apply(workbook, events);
            version = workbook.nextVersion();
            content = serializer.serialize(workbook);
        } finally {
            lock.unlock();
        }
        publish(documentId, events);
        persist(workbook, version, content);
        return result;
    }

    private <T> T read(String documentId, Function<Workbook, T> reader) {
        Workbook workbook = resolve(documentId);
        Lock lock = workbook.getLock().readLock();
        lock.lock();
        try {
            return reader.apply(workbook);
        } finally {
            lock.unlock();
        }
    }

    private void acquire(Lock lock, String documentId) {
        try {
            if (!lock.tryLock(properties.getLockTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new MutationTimeoutException("Timed out waiting for document " + documentId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MutationTimeoutException("Interrupted while waiting for document " + documentId);
        }
    }

    /**
     * Returns the open workbook, loading it on first access.
     */
    private Workbook resolve(String documentId) {
        Workbook open = documents.get(documentId);
        if (open != null) {
            return open;
        }
        String content = cachedContent(documentId)
                .orElseGet(() -> loadContent(documentId)
                        .orElseThrow(() -> new DocumentNotFoundException("Document not found: " + documentId)));
        Workbook loaded = serializer.deserialize(documentId, content,
                properties.getDefaultRows(), properties.getDefaultCols());
        scheduler.rebuildGraph(loaded);
        scheduler.recalculateAll(loaded);
        long version = loaded.nextVersion();
        loaded.markPersisted(version);
        Workbook existing = documents.putIfAbsent(documentId, loaded);
        if (existing != null) {
            return existing;
        }
        logger.debug("Opened document {}", documentId);
        return loaded;
    }

    private Optional<String> cachedContent(String documentId) {
        try {
            return documentCache.get(cacheKey(documentId));
        } catch (RuntimeException e) {
            logger.warn("Cache read failed for {}: {}", documentId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> loadContent(String documentId) {
        try {
            return documentStore.load(documentId);
        } catch (DocumentStoreException e) {
            throw new DocumentPersistenceException("Could not load document " + documentId, e);
        }
    }

    /**
     * Saves {@code content} unless a newer version already reached the store,
     * then refreshes the cache. Saves of one document are serialized.
     */
    private void persist(Workbook workbook, long version, String content) {
        synchronized (workbook) {
            if (version <= workbook.getPersistedVersion()) {
                return;
            }
            try {
                documentStore.save(workbook.getId(), content);
            } catch (DocumentStoreException e) {
                logger.warn("Saving document {} at version {} failed: {}", workbook.getId(), version, e.getMessage());
                throw new DocumentPersistenceException("Could not save document " + workbook.getId(), e);
            }
            workbook.markPersisted(version);
        }
        try {
            documentCache.setWithTtl(cacheKey(workbook.getId()), content, properties.getCacheTtl());
        } catch (RuntimeException e) {
            logger.warn("Cache write failed for {}: {}", workbook.getId(), e.getMessage());
        }
    }

    private void publish(String documentId, List<PendingEvent> events) {
        for (PendingEvent event : events) {
            try {
                eventBus.publish(documentId, event.sheetId, event.addressOrRange, event.newValue);
            } catch (RuntimeException e) {
                logger.warn("Publishing change of {}/{} failed: {}", documentId, event.addressOrRange, e.getMessage());
            }
        }
    }

    private static String cacheKey(String documentId) {
        return "spreadsheet:" + documentId + ":content";
    }

    private static void validate(CellInput input) {
        if (input == null) {
            throw new ValidationException("Cell input is required");
        }
        if (input.getValue() != null && input.getFormula() != null) {
            throw new ValidationException("A cell takes either a value or a formula, not both");
        }
    }

    /**
     * Stores one input and updates the cell's edges. Returns its key.
     */
    private CellKey applyInput(Workbook workbook, Sheet sheet, CellAddress address, CellInput input) {
        CellKey key = CellKey.of(sheet.getId(), address);
        sheet.ensureCapacity(address);
        Cell cell = sheet.getGrid().getOrCreate(address);
        if (input.getFormula() != null) {
            String text = input.getFormula().trim();
            if (!text.startsWith("=")) {
                text = "=" + text;
            }
            FormulaNode formula = parseFormula(text, address);
            cell.setFormula(text, formula);
            workbook.getGraph().setPrecedents(key, ReferenceCollector.collect(formula));
        } else if (input.getValue() != null || input.getFormat() == null) {
            cell.setLiteral(CellValue.fromObject(input.getValue()));
            workbook.getGraph().clearDependencies(key);
        }
        if (input.getFormat() != null) {
            Map<String, Object> merged = cell.getFormat() == null
                    ? new LinkedHashMap<>() : new LinkedHashMap<>(cell.getFormat());
            merged.putAll(input.getFormat());
            cell.setFormat(merged);
        }
        if (cell.isEmpty()) {
            sheet.getGrid().remove(address);
        }
        return key;
    }

    /**
     * A formula that fails to parse is still stored; it evaluates to #ERROR!.
     */
    private static FormulaNode parseFormula(String text, CellAddress address) {
        try {
            return FormulaParser.parse(text);
        } catch (FormulaSyntaxException e) {
            logger.debug("Formula {} at {} does not parse: {}", text, address, e.getMessage());
            return null;
        }
    }

    /**
     * Recalculates after an edit according to the calculation mode.
     * Returns the pass result, or an empty one in MANUAL mode.
     */
    private RecalculationResult propagate(Workbook workbook, Collection<CellKey> roots, List<PendingEvent> events) {
        RecalculationResult result;
        if (workbook.getSettings().getCalculationMode() == CalculationMode.AUTO) {
            result = scheduler.recalculate(workbook, roots);
        } else {
            result = scheduler.evaluateOnly(workbook, roots);
            workbook.setRecalculationPending(true);
        }
        Set<CellKey> rootSet = new LinkedHashSet<>(roots);
        for (Map.Entry<CellKey, CellValue> changed : result.getChanged().entrySet()) {
            if (!rootSet.contains(changed.getKey())) {
                events.add(new PendingEvent(changed.getKey().getSheetId(),
                        changed.getKey().getAddress().toString(), changed.getValue().toJavaObject()));
            }
        }
        return result;
    }

    private static void addChanged(Workbook workbook, RecalculationResult result, List<PendingEvent> events) {
        for (Map.Entry<CellKey, CellValue> changed : result.getChanged().entrySet()) {
            events.add(new PendingEvent(changed.getKey().getSheetId(),
                    changed.getKey().getAddress().toString(), changed.getValue().toJavaObject()));
        }
    }

    /**
     * Validates a range input up front so a bad entry rejects the whole write.
     */
    private static Map<CellAddress, CellInput> flatten(CellRange range, RangeInput input) {
        if (input == null) {
            throw new ValidationException("Range input is required");
        }
        checkShape(range, input.getValues(), "values");
        checkShape(range, input.getFormulas(), "formulas");
        checkShape(range, input.getFormats(), "formats");
        Map<CellAddress, CellInput> inputs = new LinkedHashMap<>();
        for (int r = 0; r < range.height(); r++) {
            for (int c = 0; c < range.width(); c++) {
                Object value = entry(input.getValues(), r, c);
                String formula = entry(input.getFormulas(), r, c);
                Map<String, Object> format = entry(input.getFormats(), r, c);
                if (value == null && formula == null && format == null) {
                    continue;
                }
                CellAddress address = range.offset(r + 1, c + 1);
                if (value != null && formula != null) {
                    throw new ValidationException("Both a value and a formula given for " + address);
                }
                inputs.put(address, new CellInput(value, formula, format));
            }
        }
        return inputs;
    }

    private static void checkShape(CellRange range, List<? extends List<?>> grid, String what) {
        if (grid == null) {
            return;
        }
        if (grid.size() > range.height()) {
            throw new ValidationException(what + " has " + grid.size() + " rows but " + range + " has " + range.height());
        }
        for (List<?> row : grid) {
            if (row != null && row.size() > range.width()) {
                throw new ValidationException(what + " has a row of " + row.size()
                        + " entries but " + range + " is " + range.width() + " wide");
            }
        }
    }

    private static <T> T entry(List<? extends List<T>> grid, int row, int col) {
        if (grid == null || row >= grid.size() || grid.get(row) == null || col >= grid.get(row).size()) {
            return null;
        }
        return grid.get(row).get(col);
    }

    private static ChartSpec findChart(Sheet sheet, String chartId) {
        ChartSpec chart = sheet.findChart(chartId);
        if (chart == null) {
            throw new ChartNotFoundException("Chart not found: " + chartId);
        }
        return chart;
    }

    private static Map<String, Object> sizeMap(String k1, int v1, String k2, int v2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }

    private static List<Cell> sortedCells(Sheet sheet) {
        List<Cell> cells = new ArrayList<>(sheet.getGrid().cells());
        cells.sort(Comparator.comparing(Cell::getAddress));
        return cells;
    }

    private Map<String, Object> describe(Workbook workbook) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", workbook.getId());
        summary.put("title", workbook.getTitle());
        summary.put("activeSheet", workbook.getActiveSheetId());
        List<Map<String, Object>> sheets = new ArrayList<>();
        for (Sheet sheet : workbook.getSheets()) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("id", sheet.getId());
            s.put("name", sheet.getName());
            s.put("rows", sheet.getRows());
            s.put("cols", sheet.getCols());
            sheets.add(s);
        }
        summary.put("sheets", sheets);
        summary.put("settings", workbook.getSettings());
        summary.put("version", workbook.getVersion());
        summary.put("persistedVersion", workbook.getPersistedVersion());
        summary.put("recalculationPending", workbook.isRecalculationPending());
        return summary;
    }

    /**
     * One row of a range being sorted: its computed values and formats.
     */
    private static final class SortRow {
        private final List<CellValue> values;
        private final List<Map<String, Object>> formats;

        private SortRow(List<CellValue> values, List<Map<String, Object>> formats) {
            this.values = values;
            this.formats = formats;
        }

        static SortRow read(Sheet sheet, int row, int startCol, int endCol) {
            List<CellValue> values = new ArrayList<>();
            List<Map<String, Object>> formats = new ArrayList<>();
            for (int c = startCol; c <= endCol; c++) {
                Cell cell = sheet.getGrid().get(CellAddress.of(row, c));
                values.add(cell == null ? CellValue.BLANK : cell.getValue());
                formats.add(cell == null ? null : cell.getFormat());
            }
            return new SortRow(values, formats);
        }
    }

    private static Comparator<SortRow> sortOrder(SortOptions options) {
        int column = options.getColumn();
        // Total order: numbers (and numeric text) before other text
        Comparator<CellValue> byValue = Coercions::lookupCompare;
        Comparator<CellValue> directed = options.isAscending() ? byValue : byValue.reversed();
        return (a, b) -> {
            CellValue x = a.values.get(column);
            CellValue y = b.values.get(column);
            if (x.isBlank() || y.isBlank()) {
                return Boolean.compare(x.isBlank(), y.isBlank());
            }
            return directed.compare(x, y);
        };
    }
}
