package org.openfda.maude.pipeline.acquire;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

/**
 * Acquisition for files fetched and unpacked out of band: only checks that they are in place.
 */
@Slf4j
public class PreDepositedAcquisition implements AcquisitionCollaborator {

    @Override
    public void acquire(Path extractedDirectory) throws IOException {
        if (!Files.isDirectory(extractedDirectory)) {
            throw new NoSuchFileException(extractedDirectory.toString(), null,
                "Extracted event files must be deposited here before running the pipeline");
        }
        long fileCount;
        try (Stream<Path> files = Files.walk(extractedDirectory)) {
            fileCount = files.filter(Files::isRegularFile).count();
        }
        if (fileCount == 0) {
            throw new IOException("No extracted files under " + extractedDirectory);
        }
        log.info("Found {} pre-deposited files under {}", fileCount, extractedDirectory);
    }
}
