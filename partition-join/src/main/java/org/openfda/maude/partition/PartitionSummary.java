package org.openfda.maude.partition;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.openfda.maude.ir.Category;

/**
 * Outcome of a completed partition run.
 */
public record PartitionSummary(
    Path outputDirectory,
    int shardCount,
    Map<Category, RoutingStats> stats,
    List<Path> ignoredFiles,
    List<Path> unmatchedFiles
) {
    public long totalRouted() {
        return stats.values().stream().mapToLong(RoutingStats::getRouted).sum();
    }

    public long totalSkipped() {
        return stats.values().stream().mapToLong(RoutingStats::getSkipped).sum();
    }
}
