package org.openfda.maude.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * InputFileSource for a local directory tree of extracted {@code *.txt} files
 */
@RequiredArgsConstructor
@Slf4j
public class LocalInputFileSource implements InputFileSource {

    static final String INPUT_EXTENSION = ".txt";

    private final Path rootPath;

    public LocalInputFileSource(String rootPath) {
        this(Paths.get(rootPath));
    }

    @Override
    public List<Path> listInputFiles() throws IOException {
        List<Path> results = new ArrayList<>();
        if (!Files.isDirectory(rootPath)) {
            throw new IOException("Input directory does not exist: " + rootPath);
        }
        walkDirectory(rootPath, results);
        results.sort(null);
        log.debug("Found {} input files under {}", results.size(), rootPath);
        return results;
    }

    private void walkDirectory(Path directory, List<Path> results) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    if (entry.getFileName().toString().toLowerCase().endsWith(INPUT_EXTENSION)) {
                        results.add(entry.toAbsolutePath());
                    }
                } else if (Files.isDirectory(entry)) {
                    walkDirectory(entry, results);
                }
            }
        }
    }

    @Override
    public BufferedReader open(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Path is not a regular file: " + file);
        }
        // Replace undecodable bytes instead of failing the whole file
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8));
    }
}
