package org.openfda.maude.join;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.openfda.maude.common.JoinWorkerException;
import org.openfda.maude.common.SchemaIntegrityException;
import org.openfda.maude.ir.ShardId;
import org.openfda.maude.partition.PartitionManifest;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs {@link ShardJoiner} once per shard on a bounded worker pool, writing {@code <shard>.maude.json}
 * for each. Every shard job runs to completion; failures are collected and reported together once the
 * last job is done.
 *
 * A shard writes to {@code <shard>.maude.json.tmp} and renames it on success, so a final file name
 * always denotes a complete shard.
 */
@Slf4j
public class JoinOrchestrator {
    static final String TEMP_SUFFIX = ".tmp";

    private final ShardJoiner joiner;
    private final int shardCount;
    private final int workers;

    public JoinOrchestrator(ShardJoiner joiner, int shardCount, int workers) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workers);
        }
        this.joiner = joiner;
        this.shardCount = shardCount;
        this.workers = workers;
    }

    /**
     * @throws SchemaIntegrityException if the partition directory was written with another shard count
     *                                  or delimiter; nothing is written in that case
     */
    public JoinSummary joinAll(Path partitionDirectory, Path outputDirectory) throws IOException {
        PartitionManifest.verify(partitionDirectory, shardCount, joiner.getDelimiter());
        Files.createDirectories(outputDirectory);
        removePreviousOutput(outputDirectory);

        var scheduler = Schedulers.newBoundedElastic(workers, Integer.MAX_VALUE, "joinWorker");
        List<ShardOutcome> outcomes;
        try {
            outcomes = Flux.range(0, shardCount)
                .map(ShardId::new)
                .flatMap(shardId -> Mono.fromCallable(() -> joinShard(partitionDirectory, outputDirectory, shardId))
                        .map(ShardOutcome::succeeded)
                        .onErrorResume(e -> {
                            log.error("Join failed for shard {}", shardId.number(), e);
                            return Mono.just(ShardOutcome.failed(shardId, e));
                        })
                        .subscribeOn(scheduler),
                    workers)
                .collectList()
                .block();
        } finally {
            scheduler.dispose();
        }

        outcomes.sort(Comparator.comparingInt(o -> o.shardId().number()));
        var failedShards = new ArrayList<Integer>();
        var failures = new ArrayList<Throwable>();
        var stats = new ArrayList<JoinStats>();
        for (ShardOutcome outcome : outcomes) {
            if (outcome.failure() != null) {
                failedShards.add(outcome.shardId().number());
                failures.add(outcome.failure());
            } else {
                stats.add(outcome.stats());
            }
        }
        if (!failedShards.isEmpty()) {
            throw new JoinWorkerException(failedShards, failures);
        }
        var summary = new JoinSummary(outputDirectory, List.copyOf(stats));
        log.info("Joined {} shards into {} documents ({} orphaned dependent rows dropped, {} rows skipped)",
            shardCount, summary.totalDocuments(), summary.totalOrphanedRows(), summary.totalSkippedRows());
        return summary;
    }

    JoinStats joinShard(Path partitionDirectory, Path outputDirectory, ShardId shardId) throws IOException {
        log.info("Starting Partition {}", shardId.number());
        var input = ShardInput.in(partitionDirectory, shardId);
        var stats = new JoinStats(shardId.number());
        Path finalFile = outputDirectory.resolve(shardId.joinedFileName());
        Path tempFile = outputDirectory.resolve(shardId.joinedFileName() + TEMP_SUFFIX);
        try {
            try (BufferedWriter out = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8);
                 var writer = new JoinedDocumentWriter(out)) {
                joiner.join(input, stats)
                    .doOnNext(writer::write)
                    .blockLast();
            }
            Files.move(tempFile, finalFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
        log.info("Finished Partition {}: {}", shardId.number(), stats);
        return stats;
    }

    /** Drops joined and temporary files left by an earlier run, which may have used another shard count. */
    private void removePreviousOutput(Path outputDirectory) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDirectory, "*" + ShardId.JOINED_SUFFIX + "*")) {
            for (Path stale : stream) {
                log.debug("Removing previous output {}", stale);
                Files.delete(stale);
            }
        }
    }

    private record ShardOutcome(ShardId shardId, JoinStats stats, Throwable failure) {
        static ShardOutcome succeeded(JoinStats stats) {
            return new ShardOutcome(new ShardId(stats.getShard()), stats, null);
        }

        static ShardOutcome failed(ShardId shardId, Throwable failure) {
            return new ShardOutcome(shardId, null, failure);
        }
    }
}
