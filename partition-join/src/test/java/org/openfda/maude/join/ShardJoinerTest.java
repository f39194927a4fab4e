package org.openfda.maude.join;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.openfda.maude.common.SchemaIntegrityException;
import org.openfda.maude.io.LocalInputFileSource;
import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.ShardId;
import org.openfda.maude.partition.CategoryMatcher;
import org.openfda.maude.partition.ShardPartitioner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import static org.openfda.maude.MaudeFixtures.DELIMITER;
import static org.openfda.maude.MaudeFixtures.row;
import static org.openfda.maude.MaudeFixtures.writeFile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShardJoinerTest {

    @TempDir
    Path tempDir;

    private final ShardJoiner joiner = new ShardJoiner(DELIMITER);

    /** Master keys 4 and 5; patient rows 4, 4, 7; device row 5; no text rows. Two shards. */
    private Path partitionTwoShards() throws IOException {
        Path in = tempDir.resolve("extracted");
        writeFile(in, "mdrfoi.txt", row(Category.MASTER, "4", "e4"), row(Category.MASTER, "5", "e5"));
        writeFile(in, "patient.txt",
            row(Category.PATIENT, "4", "1"),
            row(Category.PATIENT, "4", "2"),
            row(Category.PATIENT, "7", "1"));
        writeFile(in, "foidev.txt", row(Category.DEVICE, "5", "d5"));
        writeFile(in, "foitext.txt");
        Path out = tempDir.resolve("partitioned");
        new ShardPartitioner(new LocalInputFileSource(in), CategoryMatcher.defaults(), 2, DELIMITER, 2).partition(out);
        return out;
    }

    @Test
    void shardZeroCarriesKeyFourWithBothPatients() throws IOException {
        Path partitioned = partitionTwoShards();
        var stats = new JoinStats(0);

        StepVerifier.create(joiner.join(ShardInput.in(partitioned, new ShardId(0)), stats))
            .assertNext(doc -> {
                assertEquals("4", doc.key().value());
                assertEquals("e4", doc.fields().get("event_key"));
                assertEquals(2, doc.dependents(Category.PATIENT).size());
                assertEquals("1", doc.dependents(Category.PATIENT).get(0).get("patient_sequence_number"));
                assertEquals("2", doc.dependents(Category.PATIENT).get(1).get("patient_sequence_number"));
                assertTrue(doc.dependents(Category.DEVICE).isEmpty());
                assertTrue(doc.dependents(Category.TEXT).isEmpty());
            })
            .verifyComplete();
        assertEquals(1, stats.getDocuments());
        assertEquals(0, stats.getOrphanedRows());
    }

    @Test
    void shardOneCarriesKeyFiveAndDropsOrphanSeven() throws IOException {
        Path partitioned = partitionTwoShards();
        var stats = new JoinStats(1);

        StepVerifier.create(joiner.join(ShardInput.in(partitioned, new ShardId(1)), stats))
            .assertNext(doc -> {
                assertEquals("5", doc.key().value());
                assertTrue(doc.dependents(Category.PATIENT).isEmpty());
                assertEquals(1, doc.dependents(Category.DEVICE).size());
                assertEquals("d5", doc.dependents(Category.DEVICE).get(0).get("device_event_key"));
                assertTrue(doc.dependents(Category.TEXT).isEmpty());
            })
            .verifyComplete();
        assertEquals(1, stats.getOrphanedRows());
    }

    @Test
    void shortRowsAreSkippedAndOverlongRowsFoldIntoLastColumn() throws IOException {
        Path dir = tempDir.resolve("shard");
        writeFile(dir, "0.mdrfoi.txt", Category.MASTER.header(DELIMITER), row(Category.MASTER, "8"));
        writeFile(dir, "0.patient.txt", Category.PATIENT.header(DELIMITER), "8|1|20240101");
        writeFile(dir, "0.foidev.txt", Category.DEVICE.header(DELIMITER));
        writeFile(dir, "0.foitext.txt", Category.TEXT.header(DELIMITER),
            "8|77|D|1|20240101|pump failed|then|recovered");
        var stats = new JoinStats(0);

        StepVerifier.create(joiner.join(ShardInput.in(dir, new ShardId(0)), stats))
            .assertNext(doc -> {
                assertTrue(doc.dependents(Category.PATIENT).isEmpty());
                assertEquals("pump failed|then|recovered", doc.dependents(Category.TEXT).get(0).get("text"));
            })
            .verifyComplete();
        assertEquals(1, stats.getSkippedRows());
        assertEquals(1, stats.getOverlongRows());
    }

    @Test
    void wrongHeaderIsSchemaIntegrityFailure() throws IOException {
        Path dir = tempDir.resolve("shard");
        writeFile(dir, "0.mdrfoi.txt", Category.MASTER.header(DELIMITER));
        writeFile(dir, "0.patient.txt", "mdr_report_key|something_else");
        writeFile(dir, "0.foidev.txt", Category.DEVICE.header(DELIMITER));
        writeFile(dir, "0.foitext.txt", Category.TEXT.header(DELIMITER));

        StepVerifier.create(joiner.join(ShardInput.in(dir, new ShardId(0)), new JoinStats(0)))
            .expectError(SchemaIntegrityException.class)
            .verify();
    }

    @Test
    void missingMasterFileIsSchemaIntegrityFailure() throws IOException {
        Path dir = tempDir.resolve("shard");
        writeFile(dir, "0.patient.txt", Category.PATIENT.header(DELIMITER));
        writeFile(dir, "0.foidev.txt", Category.DEVICE.header(DELIMITER));
        writeFile(dir, "0.foitext.txt", Category.TEXT.header(DELIMITER));

        StepVerifier.create(joiner.join(ShardInput.in(dir, new ShardId(0)), new JoinStats(0)))
            .expectErrorSatisfies(e -> {
                assertTrue(e instanceof SchemaIntegrityException);
                assertEquals(dir.resolve("0.mdrfoi.txt"), ((SchemaIntegrityException) e).getFile());
            })
            .verify();
    }

    @Test
    void documentsFollowMasterFileOrder() throws IOException {
        Path dir = tempDir.resolve("shard");
        writeFile(dir, "0.mdrfoi.txt", Category.MASTER.header(DELIMITER),
            row(Category.MASTER, "30"), row(Category.MASTER, "10"), row(Category.MASTER, "20"));
        writeFile(dir, "0.patient.txt", Category.PATIENT.header(DELIMITER));
        writeFile(dir, "0.foidev.txt", Category.DEVICE.header(DELIMITER));
        writeFile(dir, "0.foitext.txt", Category.TEXT.header(DELIMITER));

        List<String> keys = joiner.join(ShardInput.in(dir, new ShardId(0)), new JoinStats(0))
            .map(doc -> doc.key().value())
            .collectList()
            .block();
        assertEquals(List.of("30", "10", "20"), keys);
        assertTrue(Files.exists(dir.resolve("0.mdrfoi.txt")));
    }
}
