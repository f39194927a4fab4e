package org.openfda.maude.pipeline.stage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.openfda.maude.pipeline.PipelineConfig;
import org.openfda.maude.pipeline.acquire.AcquisitionCollaborator;

/**
 * Declared stage ordering: {@code acquire -> partition -> join -> load}, plus the standalone {@code swap}.
 */
public class PipelineGraph {
    private final Map<String, PipelineStage> stages = new LinkedHashMap<>();

    public PipelineGraph(Collection<? extends PipelineStage> stages) {
        for (PipelineStage stage : stages) {
            if (this.stages.putIfAbsent(stage.name(), stage) != null) {
                throw new IllegalArgumentException("Duplicate stage " + stage.name());
            }
        }
        for (PipelineStage stage : stages) {
            for (String required : stage.requires()) {
                if (!this.stages.containsKey(required)) {
                    throw new IllegalArgumentException(stage.name() + " requires unknown stage " + required);
                }
            }
        }
    }

    /**
     * The MAUDE graph. {@code load} is only declared when an index name is configured, {@code swap} only when
     * a swap index name is.
     */
    public static PipelineGraph standard(PipelineConfig config, AcquisitionCollaborator acquisition,
                                         SinkFactory sinkFactory) {
        List<PipelineStage> stages = new ArrayList<>();
        stages.add(new AcquireStage(config, acquisition));
        stages.add(new PartitionStage(config));
        stages.add(new JoinStage(config));
        if (config.getIndexName() != null) {
            stages.add(new LoadStage(config, sinkFactory));
        }
        if (config.getSwapIndexName() != null) {
            stages.add(new SwapStage(config, sinkFactory));
        }
        return new PipelineGraph(stages);
    }

    public PipelineStage get(String name) {
        PipelineStage stage = stages.get(name);
        if (stage == null) {
            throw new IllegalArgumentException("Unknown or unconfigured stage: " + name + ", known: " + stages.keySet());
        }
        return stage;
    }

    /**
     * {@code target} and everything it transitively requires, dependencies first.
     * @throws IllegalStateException on a dependency cycle
     */
    public List<PipelineStage> plan(String target) {
        List<PipelineStage> ordered = new ArrayList<>();
        visit(get(target), new HashSet<>(), new HashSet<>(), ordered);
        return ordered;
    }

    private void visit(PipelineStage stage, Set<String> visiting, Set<String> done, List<PipelineStage> ordered) {
        if (done.contains(stage.name())) {
            return;
        }
        if (!visiting.add(stage.name())) {
            throw new IllegalStateException("Dependency cycle through stage " + stage.name());
        }
        for (String required : stage.requires()) {
            visit(get(required), visiting, done, ordered);
        }
        visiting.remove(stage.name());
        done.add(stage.name());
        ordered.add(stage);
    }
}
