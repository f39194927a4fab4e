package org.openfda.maude.join;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.openfda.maude.ir.Category;

/**
 * Multi-valued in-memory index of one dependent category's rows for a single shard. Rows for a key keep
 * the order in which they were read.
 */
public class KeyedRowIndex {
    private final Category category;
    private final Map<String, List<Map<String, String>>> rowsByKey = new HashMap<>();
    private long rowCount;

    public KeyedRowIndex(Category category) {
        this.category = category;
    }

    public void add(String key, Map<String, String> row) {
        rowsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        rowCount++;
    }

    /** Rows for the key, or an empty list when the key has none. */
    public List<Map<String, String>> get(String key) {
        return Collections.unmodifiableList(rowsByKey.getOrDefault(key, List.of()));
    }

    /** Number of rows whose key is not in {@code matchedKeys}. */
    public long countUnmatched(Set<String> matchedKeys) {
        return rowsByKey.entrySet().stream()
            .filter(e -> !matchedKeys.contains(e.getKey()))
            .mapToLong(e -> e.getValue().size())
            .sum();
    }

    public Category getCategory() {
        return category;
    }

    public int keyCount() {
        return rowsByKey.size();
    }

    public long rowCount() {
        return rowCount;
    }
}
