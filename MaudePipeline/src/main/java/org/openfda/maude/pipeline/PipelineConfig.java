package org.openfda.maude.pipeline;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import org.openfda.maude.partition.CategoryMatcher;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Settings for one pipeline invocation. Directory layout under {@link #getDataRoot()}:
 * {@code extracted/events}, {@code partitioned/events}, {@code json} and {@code meta}.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "password")
public class PipelineConfig {
    public static final String DEFAULT_INDEX_PREFIX = "deviceevent";
    public static final DateTimeFormatter INDEX_SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm");

    @Builder.Default
    private final Path dataRoot = Path.of("data", "maude");
    @Builder.Default
    private final int shardCount = 32;
    @Builder.Default
    private final char delimiter = '|';
    /** Size of the join worker pool. */
    @Builder.Default
    private final int workers = 6;
    /** Categories routed concurrently during partitioning. */
    @Builder.Default
    private final int partitionParallelism = 4;
    @Builder.Default
    private final CategoryMatcher categoryMatcher = CategoryMatcher.defaults();

    @Builder.Default
    private final String host = "localhost:9200";
    private final String username;
    private final String password;
    private final boolean insecure;

    @Builder.Default
    private final String indexPrefix = DEFAULT_INDEX_PREFIX;
    private final String indexName;
    private final Path mappingFile;
    @Builder.Default
    private final int maxDocsPerBatch = 1000;
    @Builder.Default
    private final long maxBytesPerBatch = 10L * 1024 * 1024;
    private final String swapIndexName;

    /** {@code <prefix>.yyyy-MM-dd-HH-mm} in UTC. */
    public static String timestampedIndexName(String prefix, Clock clock) {
        return prefix + "." + INDEX_SUFFIX_FORMAT.format(clock.instant().atZone(ZoneOffset.UTC));
    }

    public Path getExtractedDirectory() {
        return dataRoot.resolve("extracted").resolve("events");
    }

    public Path getPartitionDirectory() {
        return dataRoot.resolve("partitioned").resolve("events");
    }

    public Path getJoinDirectory() {
        return dataRoot.resolve("json");
    }

    public Path getMetaDirectory() {
        return dataRoot.resolve("meta");
    }
}
