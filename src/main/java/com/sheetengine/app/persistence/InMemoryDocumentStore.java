package com.sheetengine.app.persistence;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default store; documents live as long as the process.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<String> load(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public void save(String documentId, String content) {
        documents.put(documentId, content);
    }
}
