package com.di.docsync.files;

import com.di.docsync.schema.FileReferenceColumn;
import com.di.docsync.schema.FileReferenceType;
import com.di.docsync.schema.Table;
import com.di.docsync.source.SourceRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds file references in a row, dispatching on each file-reference column's type.
 * <p>When a table has exactly one key column and one URL column, the two are treated as the same
 * asset: the key identifies it and the URL is the pre-authorized way to fetch it.
 * A malformed reference is logged and dropped; it never fails the row.
 */
@Slf4j
public class FileReferenceDetector {

    static final String FILE_SIZE_COLUMN = "file_size";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<DetectedFile> detect(Table table, SourceRow row) {
        List<FileReferenceColumn> columns = table.fileReferenceColumns();
        if (columns.isEmpty()) {
            return List.of();
        }
        String rowId = row.idAsString();
        Long declaredSize = declaredSize(row);

        List<DetectedFile> keyed = new ArrayList<>();
        List<DetectedFile> urls = new ArrayList<>();
        for (FileReferenceColumn fc : columns) {
            Object value = row.get(fc.columnName());
            if (value == null) {
                continue;
            }
            switch (fc.referenceType()) {
                case DIRECT_KEY -> {
                    DetectedFile f = parseKey(table.name(), rowId, fc.columnName(), value, declaredSize);
                    if (f != null) keyed.add(f);
                }
                case KEY_VALUE_MAP -> keyed.addAll(parseKeyMap(table.name(), rowId, fc.columnName(), value));
                case SIGNED_URL -> {
                    DetectedFile f = parseUrl(table.name(), rowId, fc.columnName(), value, declaredSize);
                    if (f != null) urls.add(f);
                }
            }
        }

        if (pairsKeyWithUrl(table) && keyed.size() == 1 && urls.size() == 1) {
            return List.of(keyed.get(0).withUrl(urls.get(0).url()));
        }
        List<DetectedFile> all = new ArrayList<>(keyed);
        all.addAll(urls);
        return distinct(table.name(), rowId, all);
    }

    /**
     * One entry per reference; the first column that names it wins.
     */
    private static List<DetectedFile> distinct(String table, String rowId, List<DetectedFile> files) {
        Map<String, DetectedFile> byReference = new LinkedHashMap<>();
        for (DetectedFile f : files) {
            DetectedFile existing = byReference.putIfAbsent(f.reference(), f);
            if (existing != null) {
                log.debug("[FILES] {} row {}: {} also referenced by {}, ignored", table, rowId, f.reference(),
                        existing.sourceColumn());
            }
        }
        return byReference.size() == files.size() ? files : new ArrayList<>(byReference.values());
    }

    private static boolean pairsKeyWithUrl(Table table) {
        long keys = table.fileReferenceColumns().stream().filter(c -> c.referenceType() == FileReferenceType.DIRECT_KEY).count();
        long urls = table.fileReferenceColumns().stream().filter(c -> c.referenceType() == FileReferenceType.SIGNED_URL).count();
        return keys == 1 && urls == 1;
    }

    DetectedFile parseKey(String table, String rowId, String column, Object value, Long declaredSize) {
        String key = value.toString().trim();
        if (key.isEmpty()) {
            return null;
        }
        if (!FileReferenceType.isPathLike(key)) {
            log.debug("[FILES] {}.{} row {}: key does not look like a path: {}", table, column, rowId, key);
        }
        return new DetectedFile(key, null, table, rowId, column, null, filenameOf(key), declaredSize);
    }

    List<DetectedFile> parseKeyMap(String table, String rowId, String column, Object value) {
        List<DetectedFile> files = new ArrayList<>();
        JsonNode node;
        try {
            node = value instanceof Map<?, ?> map ? objectMapper.valueToTree(map) : objectMapper.readTree(value.toString());
        } catch (JsonProcessingException e) {
            log.warn("[FILES] {}.{} row {}: attachment map is not valid JSON, ignored: {}", table, column, rowId,
                    e.getOriginalMessage());
            return files;
        }
        if (node == null || !node.isObject()) {
            log.warn("[FILES] {}.{} row {}: attachment map is not a JSON object, ignored", table, column, rowId);
            return files;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode v = entry.getValue();
            if (v == null || v.isNull()) {
                continue;
            }
            String key = v.asText().trim();
            if (key.isEmpty()) {
                continue;
            }
            files.add(new DetectedFile(key, null, table, rowId, column, entry.getKey(), filenameOf(key), null));
        }
        return files;
    }

    DetectedFile parseUrl(String table, String rowId, String column, Object value, Long declaredSize) {
        String url = value.toString().trim();
        if (url.isEmpty()) {
            return null;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                log.debug("[FILES] {}.{} row {}: not an http(s) URL, ignored", table, column, rowId);
                return null;
            }
            String path = uri.getPath();
            String filename = path == null || path.isEmpty() || path.endsWith("/") ? null : filenameOf(path);
            return new DetectedFile(null, url, table, rowId, column, null, filename, declaredSize);
        } catch (URISyntaxException e) {
            log.debug("[FILES] {}.{} row {}: malformed URL ignored: {}", table, column, rowId, e.getMessage());
            return null;
        }
    }

    /** Trailing path segment. */
    static String filenameOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static Long declaredSize(SourceRow row) {
        Object size = row.get(FILE_SIZE_COLUMN);
        if (size instanceof Number n) {
            return n.longValue();
        }
        if (size != null) {
            try {
                return Long.parseLong(size.toString().trim());
            } catch (NumberFormatException e) {
                log.debug("[FILES] Ignoring non-numeric {}: {}", FILE_SIZE_COLUMN, size);
            }
        }
        return null;
    }
}
