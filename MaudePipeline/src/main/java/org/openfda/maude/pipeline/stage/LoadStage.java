package org.openfda.maude.pipeline.stage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.openfda.maude.bulkload.DocumentSink;
import org.openfda.maude.bulkload.LoadProgress;
import org.openfda.maude.common.MaudePipelineException;
import org.openfda.maude.pipeline.PipelineConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds a fresh index and reloads every joined file into it. The index is recreated on each run,
 * so a retried load starts from an empty index.
 */
@Slf4j
public class LoadStage implements PipelineStage {
    public static final String NAME = "load";

    private final PipelineConfig config;
    private final SinkFactory sinkFactory;

    public LoadStage(PipelineConfig config, SinkFactory sinkFactory) {
        if (config.getIndexName() == null || config.getIndexName().isBlank()) {
            throw new IllegalArgumentException("The load stage needs an index name");
        }
        this.config = config;
        this.sinkFactory = sinkFactory;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requires() {
        return List.of(JoinStage.NAME);
    }

    @Override
    public String marker() {
        return config.getIndexName() + ".loadjson";
    }

    @Override
    public void run() throws IOException {
        String indexName = config.getIndexName();
        String mapping = config.getMappingFile() == null ? null
            : Files.readString(config.getMappingFile(), StandardCharsets.UTF_8);
        List<Path> files = jsonFiles(config.getJoinDirectory());
        try (DocumentSink sink = sinkFactory.create()) {
            sink.createIndex(indexName, mapping).block();
            long docs = 0;
            for (Path file : files) {
                log.info("Running file {}", file);
                LoadProgress progress = sink.reloadFile(file, indexName).block();
                docs += progress == null ? 0 : progress.docs();
            }
            log.info("Loaded {} documents from {} files into {}", docs, files.size(), indexName);
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new MaudePipelineException("Failed to close sink", e);
        }
    }

    static List<Path> jsonFiles(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
            stream.forEach(files::add);
        }
        files.sort(null);
        return files;
    }
}
