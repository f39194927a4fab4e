package org.openfda.maude.partition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import org.openfda.maude.ir.Category;

import lombok.extern.slf4j.Slf4j;

/**
 * All N x 4 shard files of a partition run, owned by the partitioner for the length of the stage.
 * The per-category writer sets are disjoint, so categories can be routed concurrently.
 */
@Slf4j
public class ShardWriterTable implements AutoCloseable {
    private final Map<Category, ShardWriters> byCategory;

    private ShardWriterTable(Map<Category, ShardWriters> byCategory) {
        this.byCategory = byCategory;
    }

    public static ShardWriterTable create(Path directory, int shardCount, char delimiter) {
        var opened = new EnumMap<Category, ShardWriters>(Category.class);
        var table = new ShardWriterTable(opened);
        try {
            for (Category category : Category.values()) {
                opened.put(category, ShardWriters.open(directory, category, shardCount, delimiter));
            }
        } catch (RuntimeException e) {
            try {
                table.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        log.info("Created {} shard files in {}", shardCount * opened.size(), directory);
        return table;
    }

    public ShardWriters forCategory(Category category) {
        return byCategory.get(category);
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (ShardWriters writers : byCategory.values()) {
            try {
                writers.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
