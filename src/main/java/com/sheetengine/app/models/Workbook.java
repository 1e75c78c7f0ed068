package com.sheetengine.app.models;

import com.sheetengine.app.engine.graph.DependencyGraph;
import com.sheetengine.app.exceptions.SheetNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one spreadsheet document:
 * - ordered sheets and the active sheet id
 * - named ranges, keyed by upper-case name
 * - calculation settings
 * - the workbook-wide dependency graph
 * - version counters for persistence
 * - a read/write lock serializing mutations of this document
 */
public class Workbook {

    private final String id;
    private String title;
    private final List<Sheet> sheets = new ArrayList<>();
    private String activeSheetId;
    private Map<String, NamedRange> namedRanges = new LinkedHashMap<>();
    private WorkbookSettings settings = new WorkbookSettings();
    private final DependencyGraph graph = new DependencyGraph();

    private int nextSheetNumber = 1;
    private long nextChartNumber = 1;
    // Bumped on every mutation; persistedVersion trails it until a save succeeds
    private volatile long version;
    private volatile long persistedVersion;
    private boolean recalculationPending;

    // Lock to prevent race conditions when multiple threads update the same document
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Workbook(String id, String title) {
        this.id = id;
        this.title = title;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    /**
     * Retrieves a sheet by id. Throws if not found.
     */
    public Sheet getSheet(String sheetId) {
        Sheet sheet = findSheet(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    public Sheet findSheet(String sheetId) {
        for (Sheet sheet : sheets) {
            if (sheet.getId().equals(sheetId)) {
                return sheet;
            }
        }
        return null;
    }

    public void addSheet(Sheet sheet) {
        sheets.add(sheet);
        if (activeSheetId == null) {
            activeSheetId = sheet.getId();
        }
    }

    public void removeSheet(Sheet sheet) {
        sheets.remove(sheet);
        graph.removeSheet(sheet.getId());
        if (sheet.getId().equals(activeSheetId)) {
            activeSheetId = sheets.isEmpty() ? null : sheets.get(0).getId();
        }
    }

    /**
     * Next free id of the form "sheetN".
     */
    public String nextSheetId() {
        String candidate;
        do {
            candidate = "sheet" + nextSheetNumber++;
        } while (findSheet(candidate) != null);
        return candidate;
    }

    public String nextChartId() {
        return "chart_" + nextChartNumber++;
    }

    public String getActiveSheetId() {
        return activeSheetId;
    }

    public void setActiveSheetId(String activeSheetId) {
        this.activeSheetId = activeSheetId;
    }

    public Map<String, NamedRange> getNamedRanges() {
        return namedRanges;
    }

    public void setNamedRanges(Map<String, NamedRange> namedRanges) {
        this.namedRanges = namedRanges;
    }

    public NamedRange findNamedRange(String name) {
        return namedRanges.get(name.toUpperCase(Locale.ROOT));
    }

    public void putNamedRange(NamedRange namedRange) {
        namedRanges.put(namedRange.getName().toUpperCase(Locale.ROOT), namedRange);
    }

    public WorkbookSettings getSettings() {
        return settings;
    }

    public void setSettings(WorkbookSettings settings) {
        this.settings = settings;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public long getVersion() {
        return version;
    }

    public long nextVersion() {
        return ++version;
    }

    public long getPersistedVersion() {
        return persistedVersion;
    }

    public void markPersisted(long persisted) {
        this.persistedVersion = Math.max(this.persistedVersion, persisted);
    }

    public boolean isDirty() {
        return persistedVersion < version;
    }

    public boolean isRecalculationPending() {
        return recalculationPending;
    }

    public void setRecalculationPending(boolean recalculationPending) {
        this.recalculationPending = recalculationPending;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
