package org.openfda.maude.pipeline.acquire;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Deposits the raw category files on the local filesystem, one subdirectory per source type.
 */
public interface AcquisitionCollaborator {

    /**
     * Make the extracted event files available.
     * @param extractedDirectory where the category files of the {@code events} source must end up
     * @throws IOException if the files cannot be fetched or are not there
     */
    void acquire(Path extractedDirectory) throws IOException;
}
