package org.openfda.maude.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over the place where the acquisition step deposited the extracted category files.
 */
public interface InputFileSource {

    /**
     * List every candidate input file, in a stable (sorted) order
     * @return absolute paths of the files found
     * @throws IOException if the listing operation fails
     */
    List<Path> listInputFiles() throws IOException;

    /**
     * Open a listed file for line-by-line reading
     * @param file a path returned by {@link #listInputFiles()}
     * @return a reader positioned at the first line
     * @throws IOException if the file cannot be opened
     */
    BufferedReader open(Path file) throws IOException;
}
