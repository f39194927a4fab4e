package org.openfda.maude.bulkload;

import java.nio.file.Path;

import reactor.core.publisher.Mono;

/**
 * Port for loading joined documents into a search target (OpenSearch cluster, test collector).
 *
 * Reloads are idempotent: every document is written under its join key, so applying the same file
 * twice overwrites instead of duplicating.
 */
public interface DocumentSink extends AutoCloseable {

    /**
     * (Re)create the index, dropping any existing index of that name.
     * @param mappingJson index body (settings and mappings), or null for cluster defaults
     */
    Mono<Void> createIndex(String indexName, String mappingJson);

    /** Load every document of a JSON-lines file into the index. */
    Mono<LoadProgress> reloadFile(Path jsonLines, String indexName);

    /** Point {@code alias} at {@code indexName} only, detaching it from any other index. */
    Mono<Void> swapAlias(String alias, String indexName);

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
