package org.openfda.maude.pipeline.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the incomplete stages of a target in dependency order. A marker is written only after its stage
 * succeeds; the first failure stops the run.
 */
@Slf4j
public class StageRunner {
    static final String MARKER_SUFFIX = ".done";

    private final Path metaDirectory;

    public StageRunner(Path metaDirectory) {
        this.metaDirectory = metaDirectory;
    }

    public Path markerPath(PipelineStage stage) {
        return metaDirectory.resolve(stage.marker() + MARKER_SUFFIX);
    }

    public boolean isComplete(PipelineStage stage) {
        return Files.exists(markerPath(stage));
    }

    /**
     * @return names of the stages that ran, in order
     */
    public List<String> run(PipelineGraph graph, String target) throws IOException {
        Files.createDirectories(metaDirectory);
        List<String> ran = new ArrayList<>();
        for (PipelineStage stage : graph.plan(target)) {
            if (isComplete(stage)) {
                log.info("Stage {} already complete ({})", stage.name(), markerPath(stage));
                continue;
            }
            log.info("Running stage {}", stage.name());
            long start = System.nanoTime();
            try {
                stage.run();
            } catch (IOException | RuntimeException e) {
                log.error("Stage {} failed, no marker written", stage.name(), e);
                throw e;
            }
            Files.createFile(markerPath(stage));
            ran.add(stage.name());
            log.info("Stage {} finished in {} ms", stage.name(), (System.nanoTime() - start) / 1_000_000);
        }
        return ran;
    }
}
