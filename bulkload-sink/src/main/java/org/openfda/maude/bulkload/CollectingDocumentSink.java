package org.openfda.maude.bulkload;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import reactor.core.publisher.Mono;

/**
 * In-memory DocumentSink for exercising the load stages without a cluster.
 * Documents are keyed by id per index, so reloading a file replaces rather than duplicates.
 */
public class CollectingDocumentSink implements DocumentSink {

    private final String idField;
    private final Map<String, Map<String, String>> indices = new ConcurrentHashMap<>();
    private final Map<String, String> mappings = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final List<LoadProgress> loads = new CopyOnWriteArrayList<>();

    public CollectingDocumentSink() {
        this(OpenSearchDocumentSink.DEFAULT_ID_FIELD);
    }

    public CollectingDocumentSink(String idField) {
        this.idField = idField;
    }

    @Override
    public Mono<Void> createIndex(String indexName, String mappingJson) {
        return Mono.fromRunnable(() -> {
            indices.put(indexName, Collections.synchronizedMap(new LinkedHashMap<>()));
            mappings.put(indexName, mappingJson == null ? "{}" : mappingJson);
        });
    }

    @Override
    public Mono<LoadProgress> reloadFile(Path jsonLines, String indexName) {
        return Mono.fromCallable(() -> {
            Map<String, String> docs = indices.get(indexName);
            if (docs == null) {
                throw new SinkException("no such index [" + indexName + "]", 404);
            }
            LoadProgress progress = LoadProgress.empty(jsonLines, indexName);
            long count = 0;
            long bytes = 0;
            for (String line : readAll(jsonLines)) {
                if (line.isBlank()) {
                    continue;
                }
                BulkDocSection section = BulkDocSection.fromJsonLine(line, idField);
                docs.put(section.getDocId(), line);
                count++;
                bytes += section.getSerializedLength();
            }
            progress = progress.plusBatch(count, bytes);
            loads.add(progress);
            return progress;
        });
    }

    @Override
    public Mono<Void> swapAlias(String alias, String indexName) {
        return Mono.fromRunnable(() -> aliases.put(alias, indexName));
    }

    private static List<String> readAll(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    /** Documents of an index keyed by id, in first-write order. */
    public Map<String, String> getDocuments(String indexName) {
        Map<String, String> docs = indices.get(indexName);
        return docs == null ? Map.of() : Collections.unmodifiableMap(docs);
    }

    public String getMapping(String indexName) {
        return mappings.get(indexName);
    }

    public String getAliasTarget(String alias) {
        return aliases.get(alias);
    }

    public List<LoadProgress> getLoads() {
        return Collections.unmodifiableList(loads);
    }
}
