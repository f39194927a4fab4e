package org.openfda.maude.pipeline.stage;

import org.openfda.maude.bulkload.DocumentSink;

/**
 * Opens a sink when a stage needs one, so stages that never talk to the cluster never connect.
 */
@FunctionalInterface
public interface SinkFactory {
    DocumentSink create();
}
