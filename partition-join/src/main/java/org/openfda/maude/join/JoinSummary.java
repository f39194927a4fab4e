package org.openfda.maude.join;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a join run where every shard succeeded.
 */
public record JoinSummary(Path outputDirectory, List<JoinStats> shards) {

    public long totalDocuments() {
        return shards.stream().mapToLong(JoinStats::getDocuments).sum();
    }

    public long totalOrphanedRows() {
        return shards.stream().mapToLong(JoinStats::getOrphanedRows).sum();
    }

    public long totalSkippedRows() {
        return shards.stream().mapToLong(JoinStats::getSkippedRows).sum();
    }
}
