package org.openfda.maude.pipeline.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StageRunnerTest {

    @TempDir
    Path meta;

    private final List<String> executions = new ArrayList<>();

    private class RecordingStage implements PipelineStage {
        private final String name;
        private final List<String> requires;
        private boolean fail;

        RecordingStage(String name, String... requires) {
            this.name = name;
            this.requires = List.of(requires);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<String> requires() {
            return requires;
        }

        @Override
        public String marker() {
            return name + "-marker";
        }

        @Override
        public void run() throws IOException {
            executions.add(name);
            if (fail) {
                throw new IOException(name + " broke");
            }
        }
    }

    @Test
    void runsDependenciesFirstAndWritesMarkers() throws IOException {
        var graph = new PipelineGraph(List.of(
            new RecordingStage("load", "join"),
            new RecordingStage("acquire"),
            new RecordingStage("join", "partition"),
            new RecordingStage("partition", "acquire")));
        var runner = new StageRunner(meta);

        assertEquals(List.of("acquire", "partition", "join"), runner.run(graph, "join"));
        assertTrue(Files.exists(meta.resolve("join-marker.done")));
        assertFalse(Files.exists(meta.resolve("load-marker.done")));

        assertEquals(List.of("load"), runner.run(graph, "load"));
        assertEquals(List.of("acquire", "partition", "join", "load"), executions);
    }

    @Test
    void completedStagesAreNotRerun() throws IOException {
        var acquire = new RecordingStage("acquire");
        var graph = new PipelineGraph(List.of(acquire, new RecordingStage("partition", "acquire")));
        Files.createFile(meta.resolve("acquire-marker.done"));

        new StageRunner(meta).run(graph, "partition");

        assertEquals(List.of("partition"), executions);
    }

    @Test
    void failedStageLeavesNoMarkerAndStopsTheRun() throws IOException {
        var partition = new RecordingStage("partition", "acquire");
        partition.fail = true;
        var graph = new PipelineGraph(List.of(
            new RecordingStage("acquire"), partition, new RecordingStage("join", "partition")));
        var runner = new StageRunner(meta);

        assertThrows(IOException.class, () -> runner.run(graph, "join"));
        assertTrue(runner.isComplete(graph.get("acquire")));
        assertFalse(runner.isComplete(partition));
        assertEquals(List.of("acquire", "partition"), executions);

        partition.fail = false;
        assertEquals(List.of("partition", "join"), runner.run(graph, "join"));
    }

    @Test
    void graphRejectsUnknownDependenciesAndCycles() {
        assertThrows(IllegalArgumentException.class,
            () -> new PipelineGraph(List.of(new RecordingStage("join", "partition"))));
        var cyclic = new PipelineGraph(List.of(new RecordingStage("a", "b"), new RecordingStage("b", "a")));
        assertThrows(IllegalStateException.class, () -> cyclic.plan("a"));
        assertThrows(IllegalArgumentException.class, () -> cyclic.get("swap"));
    }
}
