package org.openfda.maude.partition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.openfda.maude.common.SchemaIntegrityException;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Layout of a partition directory, written next to the shard files. A join must use the same shard
 * count and delimiter, otherwise rows in shards it does not read would be lost.
 */
public record PartitionManifest(int shardCount, char delimiter) {
    public static final String FILE_NAME = "_partition.manifest.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public void write(Path partitionDirectory) throws IOException {
        OBJECT_MAPPER.writeValue(partitionDirectory.resolve(FILE_NAME).toFile(), this);
    }

    public static PartitionManifest read(Path partitionDirectory) throws IOException {
        Path file = partitionDirectory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            throw new SchemaIntegrityException(file, "No partition manifest, rerun the partition stage");
        }
        return OBJECT_MAPPER.readValue(file.toFile(), PartitionManifest.class);
    }

    /**
     * @throws SchemaIntegrityException if the directory was partitioned with another layout
     */
    public static PartitionManifest verify(Path partitionDirectory, int shardCount, char delimiter)
        throws IOException {
        var manifest = read(partitionDirectory);
        if (manifest.shardCount() != shardCount || manifest.delimiter() != delimiter) {
            throw new SchemaIntegrityException(partitionDirectory.resolve(FILE_NAME),
                "Partitioned with " + manifest.shardCount() + " shards and delimiter '" + manifest.delimiter()
                    + "', but the join expects " + shardCount + " shards and delimiter '" + delimiter
                    + "'; rerun the partition stage");
        }
        return manifest;
    }
}
