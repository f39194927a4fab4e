package org.openfda.maude.bulkload;

import java.nio.file.Path;

/**
 * Progress of one JSON-lines file reload, accumulated across its bulk batches.
 */
public record LoadProgress(
    Path file,
    String indexName,
    long docs,
    long batches,
    long bytes
) {
    public static LoadProgress empty(Path file, String indexName) {
        return new LoadProgress(file, indexName, 0, 0, 0);
    }

    public LoadProgress plusBatch(long docsInBatch, long bytesInBatch) {
        return new LoadProgress(file, indexName, docs + docsInBatch, batches + 1, bytes + bytesInBatch);
    }
}
