package com.di.docsync.index;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local index for dry environments and tests.
 */
@Slf4j
public class InMemorySearchIndexClient implements SearchIndexClient {

    public static final String SOURCE_TABLE_FIELD = "source_table";

    private final Map<String, Map<String, Object>> documents = new ConcurrentHashMap<>();

    @Override
    public void upsert(String documentId, Map<String, Object> fields) {
        documents.put(documentId, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        log.trace("[INDEX] upsert {}", documentId);
    }

    @Override
    public void delete(String documentId) {
        documents.remove(documentId);
        log.trace("[INDEX] delete {}", documentId);
    }

    public Optional<Map<String, Object>> get(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public int size() {
        return documents.size();
    }

    public List<String> documentIdsForTable(String table) {
        return documents.entrySet().stream()
                .filter(e -> table.equals(e.getValue().get(SOURCE_TABLE_FIELD)))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    /** Copy of the whole index, for comparing states between runs. */
    public Map<String, Map<String, Object>> snapshot() {
        return Map.copyOf(documents);
    }

    public void clear() {
        documents.clear();
    }
}
