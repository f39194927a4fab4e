package org.openfda.maude.pipeline.stage;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SwapStageTest {

    @Test
    void indexDateComesFromTheNameSuffix() {
        assertEquals(LocalDate.of(2024, 3, 5), SwapStage.indexDate("deviceevent", "deviceevent.2024-03-05-07-08"));
    }

    @Test
    void malformedIndexNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SwapStage.indexDate("deviceevent", "other.2024-03-05-07-08"));
        assertThrows(IllegalArgumentException.class, () -> SwapStage.indexDate("deviceevent", "deviceevent.latest"));
    }
}
