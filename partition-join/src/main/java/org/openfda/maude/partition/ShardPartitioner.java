package org.openfda.maude.partition;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.openfda.maude.common.PathUtils;
import org.openfda.maude.io.InputFileSource;
import org.openfda.maude.ir.Category;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Redistributes every extracted category file into N co-located shards, so that all rows for a given
 * {@code mdr_report_key} end up in the same shard number across the four categories.
 *
 * For example, all of the data for shard 5 will be in four files:
 * {@code 5.mdrfoi.txt, 5.patient.txt, 5.foidev.txt, 5.foitext.txt}.
 *
 * Output is written to a sibling staging directory and renamed into place only after every category
 * has been routed, so a failed run never leaves a directory that looks complete.
 */
@Slf4j
public class ShardPartitioner {
    static final String STAGING_SUFFIX = ".inprogress";

    private final InputFileSource inputSource;
    private final CategoryMatcher matcher;
    private final int shardCount;
    private final char delimiter;
    private final int parallelism;

    public ShardPartitioner(InputFileSource inputSource, CategoryMatcher matcher, int shardCount, char delimiter,
                            int parallelism) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }
        this.inputSource = inputSource;
        this.matcher = matcher;
        this.shardCount = shardCount;
        this.delimiter = delimiter;
        this.parallelism = parallelism;
    }

    public PartitionSummary partition(Path outputDirectory) throws IOException {
        var filesByCategory = new EnumMap<Category, List<Path>>(Category.class);
        for (Category category : Category.values()) {
            filesByCategory.put(category, new ArrayList<>());
        }
        var ignoredFiles = new ArrayList<Path>();
        var unmatchedFiles = new ArrayList<Path>();
        attribute(inputSource.listInputFiles(), filesByCategory, ignoredFiles, unmatchedFiles);

        Path staging = outputDirectory.resolveSibling(outputDirectory.getFileName() + STAGING_SUFFIX);
        PathUtils.deleteRecursively(staging);
        Files.createDirectories(staging);

        var stats = new EnumMap<Category, RoutingStats>(Category.class);
        try {
            try (ShardWriterTable table = ShardWriterTable.create(staging, shardCount, delimiter)) {
                routeAll(filesByCategory, table, stats);
            }
            new PartitionManifest(shardCount, delimiter).write(staging);
            PathUtils.deleteRecursively(outputDirectory);
            Files.move(staging, outputDirectory, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            log.error("Partitioning failed, discarding {}", staging, e);
            try {
                PathUtils.deleteRecursively(staging);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw e;
        }

        stats.values().forEach(s -> log.info("{}", s));
        log.info("Partitioned into {} shards at {}", shardCount, outputDirectory);
        return new PartitionSummary(outputDirectory, shardCount, Collections.unmodifiableMap(stats),
            List.copyOf(ignoredFiles), List.copyOf(unmatchedFiles));
    }

    private void attribute(List<Path> inputs, Map<Category, List<Path>> filesByCategory,
                           List<Path> ignoredFiles, List<Path> unmatchedFiles) {
        for (Path file : inputs) {
            if (matcher.isIgnored(file)) {
                log.info("Skipping: {}", file);
                ignoredFiles.add(file);
                continue;
            }
            var category = matcher.categorize(file);
            if (category.isEmpty()) {
                log.warn("No single category matches {}, skipping it", file);
                unmatchedFiles.add(file);
                continue;
            }
            log.debug("Attributed {} to {}", file, category.get());
            filesByCategory.get(category.get()).add(file);
        }
    }

    /**
     * Categories run concurrently; files within a category run in order on the same worker, since
     * they share that category's writers. All categories finish before any failure is reported.
     */
    private void routeAll(Map<Category, List<Path>> filesByCategory, ShardWriterTable table,
                          Map<Category, RoutingStats> stats) {
        var router = new RecordRouter(inputSource, delimiter);
        for (Category category : filesByCategory.keySet()) {
            stats.put(category, new RoutingStats(category));
        }
        var scheduler = Schedulers.newBoundedElastic(parallelism, Integer.MAX_VALUE, "partitionWorker");
        try {
            Flux.fromIterable(filesByCategory.entrySet())
                .flatMapDelayError(entry -> Mono.fromRunnable(() -> {
                        var category = entry.getKey();
                        var writers = table.forCategory(category);
                        for (Path file : entry.getValue()) {
                            log.info("Processing: {}", file);
                            try {
                                router.route(file, category, writers, stats.get(category));
                            } catch (IOException e) {
                                throw new UncheckedIOException("Failed to route " + file, e);
                            }
                        }
                    }).subscribeOn(scheduler),
                    parallelism, 1)
                .then()
                .block();
        } finally {
            scheduler.dispose();
        }
    }
}
