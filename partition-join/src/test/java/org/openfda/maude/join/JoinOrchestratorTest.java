package org.openfda.maude.join;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.openfda.maude.common.JoinWorkerException;
import org.openfda.maude.common.SchemaIntegrityException;
import org.openfda.maude.io.LocalInputFileSource;
import org.openfda.maude.ir.Category;
import org.openfda.maude.partition.CategoryMatcher;
import org.openfda.maude.partition.PartitionManifest;
import org.openfda.maude.partition.ShardPartitioner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.openfda.maude.MaudeFixtures.DELIMITER;
import static org.openfda.maude.MaudeFixtures.row;
import static org.openfda.maude.MaudeFixtures.writeFile;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JoinOrchestratorTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path partition(int shards) throws IOException {
        Path in = tempDir.resolve("extracted");
        List<String> master = new ArrayList<>();
        List<String> text = new ArrayList<>();
        for (int key = 100; key < 140; key++) {
            master.add(row(Category.MASTER, String.valueOf(key), "e" + key));
            text.add(row(Category.TEXT, String.valueOf(key), "t" + key));
        }
        writeFile(in, "mdrfoi.txt", master.toArray(new String[0]));
        writeFile(in, "foitext.txt", text.toArray(new String[0]));
        writeFile(in, "patient.txt", row(Category.PATIENT, "7", "1"));
        writeFile(in, "foidev.txt", row(Category.DEVICE, "101", "d"));
        Path out = tempDir.resolve("partitioned");
        new ShardPartitioner(new LocalInputFileSource(in), CategoryMatcher.defaults(), shards, DELIMITER, 2)
            .partition(out);
        return out;
    }

    @Test
    void joinsEveryShardIntoItsOwnFile() throws IOException {
        Path partitioned = partition(4);
        Path joined = tempDir.resolve("json");

        var summary = new JoinOrchestrator(new ShardJoiner(DELIMITER), 4, 3).joinAll(partitioned, joined);

        assertEquals(40, summary.totalDocuments());
        assertEquals(1, summary.totalOrphanedRows());
        assertEquals(4, summary.shards().size());
        for (int shard = 0; shard < 4; shard++) {
            List<String> lines = Files.readAllLines(joined.resolve(shard + ".maude.json"), StandardCharsets.UTF_8);
            assertEquals(10, lines.size());
            for (String line : lines) {
                JsonNode doc = MAPPER.readTree(line);
                assertEquals(shard, Integer.parseInt(doc.get("mdr_report_key").asText()) % 4);
                assertEquals(1, doc.get("mdr_text").size());
            }
        }
    }

    @Test
    void rerunIsByteIdentical() throws IOException {
        Path partitioned = partition(3);
        Path joined = tempDir.resolve("json");
        var orchestrator = new JoinOrchestrator(new ShardJoiner(DELIMITER), 3, 2);

        orchestrator.joinAll(partitioned, joined);
        byte[] first = Files.readAllBytes(joined.resolve("2.maude.json"));
        orchestrator.joinAll(partitioned, joined);

        assertArrayEquals(first, Files.readAllBytes(joined.resolve("2.maude.json")));
    }

    @Test
    void failedShardDoesNotStopSiblings() throws IOException {
        Path partitioned = partition(4);
        Files.writeString(partitioned.resolve("2.foidev.txt"), "not a header\n");
        Path joined = tempDir.resolve("json");

        var thrown = assertThrows(JoinWorkerException.class,
            () -> new JoinOrchestrator(new ShardJoiner(DELIMITER), 4, 2).joinAll(partitioned, joined));

        assertEquals(List.of(2), thrown.getFailedShards());
        assertInstanceOf(SchemaIntegrityException.class, thrown.getCause());
        assertFalse(Files.exists(joined.resolve("2.maude.json")));
        assertFalse(Files.exists(joined.resolve("2.maude.json" + JoinOrchestrator.TEMP_SUFFIX)));
        for (int shard : new int[] {0, 1, 3}) {
            assertTrue(Files.exists(joined.resolve(shard + ".maude.json")));
        }
    }

    @Test
    void staleOutputFromLargerShardCountIsRemoved() throws IOException {
        Path partitioned = partition(2);
        Path joined = Files.createDirectories(tempDir.resolve("json"));
        Files.writeString(joined.resolve("7.maude.json"), "{}\n");
        Files.writeString(joined.resolve("3.maude.json.tmp"), "{}\n");

        new JoinOrchestrator(new ShardJoiner(DELIMITER), 2, 2).joinAll(partitioned, joined);

        assertFalse(Files.exists(joined.resolve("7.maude.json")));
        assertFalse(Files.exists(joined.resolve("3.maude.json.tmp")));
        assertTrue(Files.exists(joined.resolve("1.maude.json")));
    }

    @Test
    void joinWithFewerShardsThanPartitionIsRejected() throws IOException {
        Path partitioned = partition(4);
        Path joined = tempDir.resolve("json");

        var thrown = assertThrows(SchemaIntegrityException.class,
            () -> new JoinOrchestrator(new ShardJoiner(DELIMITER), 2, 2).joinAll(partitioned, joined));

        assertEquals(partitioned.resolve(PartitionManifest.FILE_NAME), thrown.getFile());
        assertTrue(thrown.getMessage().contains("4 shards"), thrown.getMessage());
        assertFalse(Files.exists(joined));
    }

    @Test
    void joinWithDifferentDelimiterIsRejected() throws IOException {
        Path partitioned = partition(2);

        assertThrows(SchemaIntegrityException.class,
            () -> new JoinOrchestrator(new ShardJoiner(','), 2, 2).joinAll(partitioned, tempDir.resolve("json")));
    }

    @Test
    void partitionDirectoryWithoutManifestIsRejected() throws IOException {
        Path partitioned = partition(2);
        Files.delete(partitioned.resolve(PartitionManifest.FILE_NAME));
        Path joined = Files.createDirectories(tempDir.resolve("json"));
        Files.writeString(joined.resolve("0.maude.json"), "{}\n");

        assertThrows(SchemaIntegrityException.class,
            () -> new JoinOrchestrator(new ShardJoiner(DELIMITER), 2, 2).joinAll(partitioned, joined));
        assertEquals("{}\n", Files.readString(joined.resolve("0.maude.json")));
    }
}
