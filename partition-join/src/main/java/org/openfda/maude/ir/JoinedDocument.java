package org.openfda.maude.ir;

import java.util.List;
import java.util.Map;

/**
 * One master record with its dependent records attached. Field maps keep schema order so that
 * serialization is deterministic.
 */
public record JoinedDocument(
    JoinKey key,
    Map<String, String> fields,
    Map<Category, List<Map<String, String>>> dependents
) {
    /** Dependent rows for the category; empty when the key had none. */
    public List<Map<String, String>> dependents(Category category) {
        return dependents.getOrDefault(category, List.of());
    }
}
