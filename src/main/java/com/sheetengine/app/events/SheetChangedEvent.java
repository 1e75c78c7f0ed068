package com.sheetengine.app.events;

import org.springframework.context.ApplicationEvent;

/**
 * Published through Spring's event infrastructure after a mutation commits.
 */
public class SheetChangedEvent extends ApplicationEvent {

    private final String documentId;
    private final String sheetId;
    private final String addressOrRange;
    private final Object newValue;

    public SheetChangedEvent(Object source, String documentId, String sheetId, String addressOrRange, Object newValue) {
        super(source);
        this.documentId = documentId;
        this.sheetId = sheetId;
        this.addressOrRange = addressOrRange;
        this.newValue = newValue;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getSheetId() {
        return sheetId;
    }

    public String getAddressOrRange() {
        return addressOrRange;
    }

    public Object getNewValue() {
        return newValue;
    }

    @Override
    public String toString() {
        return "SheetChangedEvent{" + documentId + "/" + sheetId + "!" + addressOrRange + "=" + newValue + "}";
    }
}
