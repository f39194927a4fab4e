package org.openfda.maude.pipeline;

import java.time.Clock;

import org.openfda.maude.bulkload.DocumentSink;
import org.openfda.maude.bulkload.OpenSearchDocumentSink;
import org.openfda.maude.bulkload.http.ConnectionContext;
import org.openfda.maude.bulkload.http.RestClient;
import org.openfda.maude.pipeline.acquire.PreDepositedAcquisition;
import org.openfda.maude.pipeline.stage.PipelineGraph;
import org.openfda.maude.pipeline.stage.StageRunner;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.ParseException;

/**
 * Entry point: brings the requested target stage, and everything it depends on, up to date.
 */
@Slf4j
public class MaudePipelineMain {

    public static void main(String[] args) throws Exception {
        PipelineOptions.Invocation invocation;
        try {
            invocation = PipelineOptions.parse(args, Clock.systemUTC());
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }
        if (invocation.help()) {
            printUsage();
            return;
        }
        var config = invocation.config();
        log.info("Starting target {} with {}", invocation.target(), config);
        var graph = PipelineGraph.standard(config, new PreDepositedAcquisition(), () -> openSink(config));
        var ran = new StageRunner(config.getMetaDirectory()).run(graph, invocation.target());
        log.info("Target {} is up to date; ran {}", invocation.target(), ran);
    }

    static DocumentSink openSink(PipelineConfig config) {
        var connection = new ConnectionContext(config.getHost(), config.getUsername(), config.getPassword(),
            config.isInsecure());
        return new OpenSearchDocumentSink(new RestClient(connection), config.getMaxDocsPerBatch(),
            config.getMaxBytesPerBatch());
    }

    private static void printUsage() {
        new HelpFormatter().printHelp("maude-pipeline", PipelineOptions.options());
    }
}
