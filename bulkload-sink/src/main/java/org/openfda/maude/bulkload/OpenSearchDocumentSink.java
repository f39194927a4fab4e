package org.openfda.maude.bulkload;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

import org.openfda.maude.bulkload.http.HttpResponse;
import org.openfda.maude.bulkload.http.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * DocumentSink writing to an OpenSearch (or Elasticsearch) cluster over its REST API.
 * Batches are sent sequentially; any failed batch fails the whole reload.
 */
@Slf4j
public class OpenSearchDocumentSink implements DocumentSink {
    public static final String DEFAULT_ID_FIELD = "mdr_report_key";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final RestClient client;
    private final int maxDocsPerBatch;
    private final long maxBytesPerBatch;
    private final String idField;

    public OpenSearchDocumentSink(RestClient client, int maxDocsPerBatch, long maxBytesPerBatch) {
        this(client, maxDocsPerBatch, maxBytesPerBatch, DEFAULT_ID_FIELD);
    }

    public OpenSearchDocumentSink(RestClient client, int maxDocsPerBatch, long maxBytesPerBatch, String idField) {
        if (maxDocsPerBatch <= 0 || maxBytesPerBatch <= 0) {
            throw new IllegalArgumentException("Batch limits must be positive");
        }
        this.client = client;
        this.maxDocsPerBatch = maxDocsPerBatch;
        this.maxBytesPerBatch = maxBytesPerBatch;
        this.idField = idField;
    }

    @Override
    public Mono<Void> createIndex(String indexName, String mappingJson) {
        return client.deleteAsync(indexName)
            .flatMap(response -> {
                if (response.isSuccess() || response.statusCode() == 404) {
                    return Mono.<Void>empty();
                }
                return Mono.<Void>error(failure("Delete of index " + indexName, response));
            })
            .then(client.putAsync(indexName, mappingJson == null ? "{}" : mappingJson))
            .flatMap(response -> response.isSuccess()
                ? Mono.<Void>empty()
                : Mono.error(failure("Creation of index " + indexName, response)))
            .doOnSuccess(v -> log.atInfo().setMessage("Created index {}").addArgument(indexName).log());
    }

    @Override
    public Mono<LoadProgress> reloadFile(Path jsonLines, String indexName) {
        return readLines(jsonLines)
            .filter(line -> !line.isBlank())
            .map(line -> BulkDocSection.fromJsonLine(line, idField))
            .bufferUntil(new BatchPredicate(maxDocsPerBatch, maxBytesPerBatch), true)
            .concatMap(batch -> sendBatch(indexName, batch))
            .reduce(LoadProgress.empty(jsonLines, indexName),
                (progress, batch) -> progress.plusBatch(batch.docs(), batch.bytes()))
            .doOnSuccess(progress -> log.atInfo()
                .setMessage("Loaded {} docs in {} batches from {} into {}")
                .addArgument(progress::docs)
                .addArgument(progress::batches)
                .addArgument(jsonLines)
                .addArgument(indexName)
                .log());
    }

    @Override
    public Mono<Void> swapAlias(String alias, String indexName) {
        return client.getAsync("_alias/" + alias)
            .flatMap(response -> {
                if (response.statusCode() == 404) {
                    return Mono.<JsonNode>just(OBJECT_MAPPER.createObjectNode());
                }
                if (!response.isSuccess()) {
                    return Mono.<JsonNode>error(failure("Lookup of alias " + alias, response));
                }
                return Mono.<JsonNode>fromCallable(() -> OBJECT_MAPPER.readTree(response.body()));
            })
            .map(current -> buildAliasActions(alias, indexName, current))
            .flatMap(body -> client.postAsync("_aliases", body))
            .flatMap(response -> response.isSuccess()
                ? Mono.<Void>empty()
                : Mono.error(failure("Swap of alias " + alias, response)))
            .doOnSuccess(v -> log.atInfo().setMessage("Alias {} now points at {}")
                .addArgument(alias).addArgument(indexName).log());
    }

    static String buildAliasActions(String alias, String indexName, JsonNode currentAliases) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        ArrayNode actions = root.putArray("actions");
        Iterator<String> holders = currentAliases == null ? List.<String>of().iterator() : currentAliases.fieldNames();
        while (holders.hasNext()) {
            String holder = holders.next();
            if (!holder.equals(indexName)) {
                ObjectNode remove = actions.addObject().putObject("remove");
                remove.put("index", holder);
                remove.put("alias", alias);
            }
        }
        ObjectNode add = actions.addObject().putObject("add");
        add.put("index", indexName);
        add.put("alias", alias);
        return root.toString();
    }

    private Mono<BatchResult> sendBatch(String indexName, List<BulkDocSection> batch) {
        String body = BulkDocSection.convertToBulkRequestBody(batch);
        long bytes = body.getBytes(StandardCharsets.UTF_8).length;
        return client.postNdjsonAsync(indexName + "/_bulk", body)
            .doFirst(() -> log.atDebug().setMessage("{} documents in current bulk request.")
                .addArgument(batch::size).log())
            .flatMap(response -> {
                if (!response.isSuccess()) {
                    return Mono.<BatchResult>error(failure("Bulk request to " + indexName, response));
                }
                if (hasItemErrors(response.body())) {
                    return Mono.<BatchResult>error(new SinkException(
                        "Bulk request to " + indexName + " reported item errors: " + abbreviate(response.body()),
                        response.statusCode()));
                }
                return Mono.just(new BatchResult(batch.size(), bytes));
            });
    }

    private static boolean hasItemErrors(String body) {
        if (body == null || body.isEmpty()) {
            return false;
        }
        try {
            return OBJECT_MAPPER.readTree(body).path("errors").asBoolean(false);
        } catch (IOException e) {
            throw new SinkException("Unparseable bulk response", e);
        }
    }

    private static Flux<String> readLines(Path file) {
        return Flux.using(
            () -> Files.newBufferedReader(file, StandardCharsets.UTF_8),
            reader -> Flux.fromStream(reader.lines()),
            OpenSearchDocumentSink::closeReader
        );
    }

    /** Runs after the lines were read, so a failed close does not fail the load. */
    static void closeReader(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.atWarn().setMessage("Failed to close reader").setCause(e).log();
        }
    }

    private static SinkException failure(String operation, HttpResponse response) {
        return new SinkException(operation + " failed with " + response.statusCode() + " "
            + response.statusText() + ": " + abbreviate(response.body()), response.statusCode());
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 512 ? body.substring(0, 512) + "..." : body;
    }

    private record BatchResult(long docs, long bytes) {}

    /**
     * Groups bulk sections by count and byte size. With {@code cutBefore} the item that overflows
     * starts the next batch.
     */
    static class BatchPredicate implements Predicate<BulkDocSection> {
        private final int maxDocs;
        private final long maxBytes;
        private int currentCount;
        private long currentBytes;

        BatchPredicate(int maxDocs, long maxBytes) {
            this.maxDocs = maxDocs;
            this.maxBytes = maxBytes;
        }

        @Override
        public boolean test(BulkDocSection next) {
            long nextSize = next.getSerializedLength();
            currentCount++;
            currentBytes += nextSize;
            if (currentCount > maxDocs || (currentBytes > maxBytes && currentCount > 1)) {
                currentCount = 1;
                currentBytes = nextSize;
                return true;
            }
            return false;
        }
    }
}
