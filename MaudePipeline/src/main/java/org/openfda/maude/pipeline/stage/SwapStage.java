package org.openfda.maude.pipeline.stage;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

import org.openfda.maude.bulkload.DocumentSink;
import org.openfda.maude.common.MaudePipelineException;
import org.openfda.maude.pipeline.PipelineConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Points the prefix alias at a built index. Standalone: it is run by hand once the new index has been
 * checked, and doubles as a rollback by naming an older index.
 */
@Slf4j
public class SwapStage implements PipelineStage {
    public static final String NAME = "swap";

    private final PipelineConfig config;
    private final SinkFactory sinkFactory;

    public SwapStage(PipelineConfig config, SinkFactory sinkFactory) {
        if (config.getSwapIndexName() == null || config.getSwapIndexName().isBlank()) {
            throw new IllegalArgumentException("The swap stage needs a swap index name");
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
        return List.of();
    }

    @Override
    public String marker() {
        return config.getSwapIndexName() + ".swap";
    }

    @Override
    public void run() {
        String swapIndex = config.getSwapIndexName();
        LocalDate indexDate = indexDate(config.getIndexPrefix(), swapIndex);
        try (DocumentSink sink = sinkFactory.create()) {
            sink.swapAlias(config.getIndexPrefix(), swapIndex).block();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new MaudePipelineException("Failed to close sink", e);
        }
        log.info("Alias {} now serves data as of {}", config.getIndexPrefix(), indexDate);
    }

    /**
     * The build date encoded in an index name of the form {@code <prefix>.yyyy-MM-dd-HH-mm}.
     */
    static LocalDate indexDate(String prefix, String indexName) {
        String expectedStart = prefix + ".";
        if (!indexName.startsWith(expectedStart)) {
            throw new IllegalArgumentException("Index " + indexName + " does not start with " + expectedStart);
        }
        try {
            return LocalDateTime.parse(indexName.substring(expectedStart.length()), PipelineConfig.INDEX_SUFFIX_FORMAT)
                .toLocalDate();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Index " + indexName + " has no yyyy-MM-dd-HH-mm suffix", e);
        }
    }
}
