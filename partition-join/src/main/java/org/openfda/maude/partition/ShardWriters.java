package org.openfda.maude.partition;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.openfda.maude.common.SchemaIntegrityException;
import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.ShardId;

import lombok.extern.slf4j.Slf4j;

/**
 * The N open shard files of one category. Not thread-safe: a category is routed by one worker at a time.
 */
@Slf4j
public class ShardWriters implements AutoCloseable {
    static final String LINE_SEPARATOR = "\n";

    private final Category category;
    private final BufferedWriter[] writers;
    private final Path[] paths;

    private ShardWriters(Category category, int shardCount) {
        this.category = category;
        this.writers = new BufferedWriter[shardCount];
        this.paths = new Path[shardCount];
    }

    /**
     * Create every shard file of the category and write its header line, whether or not any row is
     * routed to it later.
     */
    public static ShardWriters open(Path directory, Category category, int shardCount, char delimiter) {
        var shardWriters = new ShardWriters(category, shardCount);
        String header = category.header(delimiter);
        try {
            for (int i = 0; i < shardCount; i++) {
                Path file = directory.resolve(new ShardId(i).categoryFileName(category));
                log.debug("Creating shard file {}", file);
                shardWriters.paths[i] = file;
                try {
                    shardWriters.writers[i] = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    shardWriters.writers[i].write(header);
                    shardWriters.writers[i].write(LINE_SEPARATOR);
                } catch (IOException e) {
                    throw new SchemaIntegrityException(file, "Could not create shard file", e);
                }
            }
            return shardWriters;
        } catch (RuntimeException e) {
            shardWriters.closeQuietly();
            throw e;
        }
    }

    public void append(int shard, String line) {
        try {
            writers[shard].write(line);
            writers[shard].write(LINE_SEPARATOR);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed writing to " + paths[shard], e);
        }
    }

    public int getShardCount() {
        return writers.length;
    }

    public Category getCategory() {
        return category;
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (int i = 0; i < writers.length; i++) {
            if (writers[i] == null) {
                continue;
            }
            try {
                writers[i].close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = new IOException("Failed to close shard files for " + category, e);
                } else {
                    failure.addSuppressed(e);
                }
            } finally {
                writers[i] = null;
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            log.warn("Failed to close partially opened shard files for {}: {}", category, e.getMessage());
        }
    }
}
