package org.openfda.maude.bulkload;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CollectingDocumentSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void reloadingTheSameFileDoesNotDuplicate() throws IOException {
        var file = tempDir.resolve("3.maude.json");
        Files.write(file, List.of("{\"mdr_report_key\":\"4\"}", "{\"mdr_report_key\":\"5\"}"));
        var sink = new CollectingDocumentSink();

        StepVerifier.create(sink.createIndex("idx", null)
                .then(sink.reloadFile(file, "idx"))
                .then(sink.reloadFile(file, "idx")))
            .assertNext(progress -> assertEquals(2, progress.docs()))
            .verifyComplete();

        assertEquals(2, sink.getDocuments("idx").size());
        assertEquals(2, sink.getLoads().size());
        assertEquals("{}", sink.getMapping("idx"));
    }

    @Test
    void reloadIntoMissingIndexFails() throws IOException {
        var file = tempDir.resolve("0.maude.json");
        Files.write(file, List.of("{\"mdr_report_key\":\"4\"}"));

        StepVerifier.create(new CollectingDocumentSink().reloadFile(file, "missing"))
            .expectError(SinkException.class)
            .verify();
    }

    @Test
    void swapAliasRecordsTarget() {
        var sink = new CollectingDocumentSink();
        StepVerifier.create(sink.swapAlias("deviceevent", "deviceevent.2024-01-01-00-00")).verifyComplete();
        assertEquals("deviceevent.2024-01-01-00-00", sink.getAliasTarget("deviceevent"));
    }
}
