package org.openfda.maude.pipeline.stage;

import java.io.IOException;
import java.util.List;

import org.openfda.maude.join.JoinOrchestrator;
import org.openfda.maude.join.ShardJoiner;
import org.openfda.maude.pipeline.PipelineConfig;

public class JoinStage implements PipelineStage {
    public static final String NAME = "join";

    private final PipelineConfig config;

    public JoinStage(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requires() {
        return List.of(PartitionStage.NAME);
    }

    @Override
    public String marker() {
        return "json";
    }

    @Override
    public void run() throws IOException {
        new JoinOrchestrator(new ShardJoiner(config.getDelimiter()), config.getShardCount(), config.getWorkers())
            .joinAll(config.getPartitionDirectory(), config.getJoinDirectory());
    }
}
