package org.openfda.maude.pipeline.stage;

import java.io.IOException;
import java.util.List;

import org.openfda.maude.io.LocalInputFileSource;
import org.openfda.maude.partition.ShardPartitioner;
import org.openfda.maude.pipeline.PipelineConfig;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PartitionStage implements PipelineStage {
    public static final String NAME = "partition";

    private final PipelineConfig config;

    public PartitionStage(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requires() {
        return List.of(AcquireStage.NAME);
    }

    @Override
    public String marker() {
        return "partitioned";
    }

    @Override
    public void run() throws IOException {
        var partitioner = new ShardPartitioner(
            new LocalInputFileSource(config.getExtractedDirectory()),
            config.getCategoryMatcher(),
            config.getShardCount(),
            config.getDelimiter(),
            config.getPartitionParallelism());
        var summary = partitioner.partition(config.getPartitionDirectory());
        log.info("Routed {} rows, skipped {}, ignored {} files, left {} unmatched files",
            summary.totalRouted(), summary.totalSkipped(), summary.ignoredFiles().size(),
            summary.unmatchedFiles().size());
    }
}
