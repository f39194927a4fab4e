package org.openfda.maude.join;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.openfda.maude.common.SchemaIntegrityException;
import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.JoinKey;
import org.openfda.maude.ir.JoinedDocument;
import org.openfda.maude.ir.Row;
import org.openfda.maude.ir.SkippedRow;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;

/**
 * Joins one shard: the three dependent files are loaded into memory keyed by {@code mdr_report_key},
 * then the master file is streamed and every master row becomes one document carrying its dependents.
 *
 * The join is driven by the master file. A dependent row whose key has no master row in the shard
 * appears in no document; it is only counted in {@link JoinStats#getOrphanedRows()}.
 */
@Slf4j
public class ShardJoiner {
    private final char delimiter;

    public ShardJoiner(char delimiter) {
        this.delimiter = delimiter;
    }

    public char getDelimiter() {
        return delimiter;
    }

    /**
     * Cold Flux of the shard's documents in master file order. Subscription triggers the read.
     */
    public Flux<JoinedDocument> join(ShardInput input, JoinStats stats) {
        return Flux.defer(() -> {
            Map<Category, KeyedRowIndex> indices;
            try {
                indices = loadDependents(input, stats);
            } catch (IOException e) {
                return Flux.error(new UncheckedIOException("Failed to load dependents of shard "
                    + input.shardId().number(), e));
            }
            Set<String> matchedKeys = new HashSet<>();
            Path masterFile = input.file(Category.MASTER);
            return Flux.using(
                    () -> openWithHeader(masterFile, Category.MASTER),
                    reader -> Flux.generate(
                        () -> new long[] {1},
                        (long[] lineNumber, SynchronousSink<JoinedDocument> sink) -> {
                            nextDocument(reader, masterFile, lineNumber, indices, matchedKeys, stats, sink);
                            return lineNumber;
                        }),
                    this::closeReader)
                .doOnComplete(() -> recordOrphans(input, indices, matchedKeys, stats));
        });
    }

    private void nextDocument(BufferedReader reader, Path masterFile, long[] lineNumber,
                              Map<Category, KeyedRowIndex> indices, Set<String> matchedKeys,
                              JoinStats stats, SynchronousSink<JoinedDocument> sink) {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber[0]++;
                var fields = toFields(Row.parse(line, delimiter), Category.MASTER, masterFile, lineNumber[0], stats);
                if (fields == null) {
                    continue;
                }
                String key = fields.get(Category.MASTER.fields().get(0));
                matchedKeys.add(key);
                var dependents = new EnumMap<Category, List<Map<String, String>>>(Category.class);
                for (Category category : Category.DEPENDENTS) {
                    dependents.put(category, indices.get(category).get(key));
                }
                stats.documentEmitted();
                sink.next(new JoinedDocument(new JoinKey(key), fields, Collections.unmodifiableMap(dependents)));
                return;
            }
            sink.complete();
        } catch (IOException e) {
            sink.error(new UncheckedIOException("Failed reading " + masterFile, e));
        }
    }

    Map<Category, KeyedRowIndex> loadDependents(ShardInput input, JoinStats stats) throws IOException {
        var indices = new EnumMap<Category, KeyedRowIndex>(Category.class);
        for (Category category : Category.DEPENDENTS) {
            Path file = input.file(category);
            var index = new KeyedRowIndex(category);
            try (BufferedReader reader = openWithHeader(file, category)) {
                String line;
                long lineNumber = 1;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    var fields = toFields(Row.parse(line, delimiter), category, file, lineNumber, stats);
                    if (fields != null) {
                        index.add(fields.get(category.fields().get(0)), fields);
                        stats.dependentLoaded();
                    }
                }
            }
            log.debug("Loaded {} {} rows for {} keys from {}", index.rowCount(), category, index.keyCount(), file);
            indices.put(category, index);
        }
        return indices;
    }

    /**
     * Open a shard file and consume its header line, which must be the category's fixed header.
     */
    BufferedReader openWithHeader(Path file, Category category) throws IOException {
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SchemaIntegrityException(file, "Missing shard file for " + category, e);
        }
        String header = reader.readLine();
        String expected = category.header(delimiter);
        if (!expected.equals(header)) {
            reader.close();
            throw new SchemaIntegrityException(file, "Expected " + category + " header, found "
                + (header == null ? "an empty file" : "'" + abbreviate(header) + "'"));
        }
        return reader;
    }

    /**
     * Name the row's fields after the category schema. Short rows or rows without a valid key are
     * dropped (null). Surplus fields come from the delimiter appearing inside a value, so they are
     * rejoined into the last column.
     */
    Map<String, String> toFields(Row row, Category category, Path file, long lineNumber, JoinStats stats) {
        List<String> names = category.fields();
        if (row.size() < names.size()) {
            skip(stats, new SkippedRow(file, lineNumber, SkippedRow.Reason.SHORT_ROW,
                row.size() + " of " + names.size() + " fields"));
            return null;
        }
        if (!JoinKey.isValid(row.field(0))) {
            skip(stats, new SkippedRow(file, lineNumber, SkippedRow.Reason.MALFORMED_KEY, row.field(0)));
            return null;
        }
        var fields = new LinkedHashMap<String, String>();
        int last = names.size() - 1;
        for (int i = 0; i < last; i++) {
            fields.put(names.get(i), row.field(i));
        }
        if (row.size() > names.size()) {
            stats.overlongRow();
            log.debug("Folding {} surplus fields into {} at {}:{}", row.size() - names.size(), names.get(last),
                file, lineNumber);
            fields.put(names.get(last),
                String.join(String.valueOf(delimiter), row.fields().subList(last, row.size())));
        } else {
            fields.put(names.get(last), row.field(last));
        }
        return fields;
    }

    private void skip(JoinStats stats, SkippedRow skippedRow) {
        stats.rowSkipped();
        log.atWarn().setMessage("Skipping row: {}").addArgument(skippedRow).log();
    }

    private void recordOrphans(ShardInput input, Map<Category, KeyedRowIndex> indices, Set<String> matchedKeys,
                               JoinStats stats) {
        for (KeyedRowIndex index : indices.values()) {
            long orphaned = index.countUnmatched(matchedKeys);
            if (orphaned > 0) {
                stats.orphaned(orphaned);
                log.info("Shard {}: {} {} rows have no master record and were dropped",
                    input.shardId().number(), orphaned, index.getCategory());
            }
        }
    }

    private void closeReader(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close shard reader: {}", e.getMessage());
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
