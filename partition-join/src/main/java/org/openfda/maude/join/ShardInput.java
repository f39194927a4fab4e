package org.openfda.maude.join;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.ShardId;

/**
 * The four category files of one shard.
 */
public record ShardInput(ShardId shardId, Map<Category, Path> files) {

    /** The files the partitioner wrote for {@code shardId} under {@code partitionDirectory}. */
    public static ShardInput in(Path partitionDirectory, ShardId shardId) {
        var files = new EnumMap<Category, Path>(Category.class);
        for (Category category : Category.values()) {
            files.put(category, partitionDirectory.resolve(shardId.categoryFileName(category)));
        }
        return new ShardInput(shardId, Collections.unmodifiableMap(files));
    }

    public Path file(Category category) {
        return files.get(category);
    }
}
