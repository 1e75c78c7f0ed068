package com.sheetengine.app.persistence;

import java.util.Optional;

/**
 * Durable storage of serialized workbooks.
 */
public interface DocumentStore {

    Optional<String> load(String documentId);

    /**
     * @throws DocumentStoreException when the content could not be stored
     */
    void save(String documentId, String content);
}
