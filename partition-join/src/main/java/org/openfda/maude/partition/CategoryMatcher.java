package org.openfda.maude.partition;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.openfda.maude.ir.Category;

/**
 * Declarative table that attributes an extracted file to a category by a substring of its file name,
 * and excludes known auxiliary files. Matching is case-insensitive and only looks at the file name,
 * never the parent directories.
 */
public final class CategoryMatcher {

    /** Auxiliary MAUDE extracts that do not follow the category layouts. */
    public static final List<String> DEFAULT_IGNORED = List.of("problem", "add", "change");

    private final Map<Category, String> rules;
    private final List<String> ignored;

    private CategoryMatcher(Map<Category, String> rules, List<String> ignored) {
        if (!rules.keySet().containsAll(List.of(Category.values()))) {
            throw new IllegalArgumentException("Every category needs a filename rule, got " + rules.keySet());
        }
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
        this.ignored = ignored.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableList());
    }

    /** Each category matches its own file token; the MAUDE auxiliary files are ignored. */
    public static CategoryMatcher defaults() {
        return withIgnored(DEFAULT_IGNORED);
    }

    public static CategoryMatcher withIgnored(List<String> ignored) {
        var rules = new EnumMap<Category, String>(Category.class);
        for (Category category : Category.values()) {
            rules.put(category, category.fileToken());
        }
        return new CategoryMatcher(rules, ignored);
    }

    /** A copy of this matcher with one category's rule replaced. */
    public CategoryMatcher withRule(Category category, String substring) {
        if (substring == null || substring.isBlank()) {
            throw new IllegalArgumentException("Empty filename rule for " + category);
        }
        var updated = new EnumMap<>(rules);
        updated.put(category, substring.toLowerCase(Locale.ROOT));
        return new CategoryMatcher(updated, ignored);
    }

    public boolean isIgnored(Path file) {
        String name = fileName(file);
        return ignored.stream().anyMatch(name::contains);
    }

    /**
     * @return the single category whose rule matches, or empty when none or several match
     */
    public Optional<Category> categorize(Path file) {
        String name = fileName(file);
        List<Category> matches = rules.entrySet().stream()
            .filter(e -> name.contains(e.getValue().toLowerCase(Locale.ROOT)))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    public List<String> getIgnored() {
        return ignored;
    }

    private static String fileName(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT);
    }
}
