package org.openfda.maude.pipeline.stage;

import java.io.IOException;
import java.util.List;

/**
 * One node of the pipeline graph. A stage is complete once its marker file exists.
 */
public interface PipelineStage {

    String name();

    /** Names of the stages that must be complete before this one runs. */
    List<String> requires();

    /** Base name of the completion marker, written as {@code <meta>/<marker>.done}. */
    String marker();

    void run() throws IOException;
}
