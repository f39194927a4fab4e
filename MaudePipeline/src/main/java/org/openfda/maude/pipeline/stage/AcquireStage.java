package org.openfda.maude.pipeline.stage;

import java.io.IOException;
import java.util.List;

import org.openfda.maude.pipeline.PipelineConfig;
import org.openfda.maude.pipeline.acquire.AcquisitionCollaborator;

public class AcquireStage implements PipelineStage {
    public static final String NAME = "acquire";

    private final PipelineConfig config;
    private final AcquisitionCollaborator acquisition;

    public AcquireStage(PipelineConfig config, AcquisitionCollaborator acquisition) {
        this.config = config;
        this.acquisition = acquisition;
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
        return "extracted";
    }

    @Override
    public void run() throws IOException {
        acquisition.acquire(config.getExtractedDirectory());
    }
}
