package com.sheetengine.app.events;

/**
 * Outbound change notifications for live collaboration.
 */
public interface EventBus {

    /**
     * @param addressOrRange "B3" for a cell, "A1:C10" for a range, or
     *                       a descriptive key such as "rows:2+1" for structural edits
     * @param newValue       plain Java value of the cell, or null for ranges and structure
     */
    void publish(String documentId, String sheetId, String addressOrRange, Object newValue);
}
