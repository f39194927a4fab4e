package org.openfda.maude.ir;

import java.nio.file.Path;

/**
 * A row dropped during routing or joining. Skips are recorded and counted, never thrown.
 */
public record SkippedRow(
    Path source,
    long lineNumber,
    Reason reason,
    String detail
) {
    public enum Reason {
        /** Source header on the first line. */
        HEADER,
        /** Header token found after the first line. */
        UNEXPECTED_HEADER,
        /** First field is not a non-negative integer. */
        MALFORMED_KEY,
        /** Fewer fields than the category schema. */
        SHORT_ROW
    }

    @Override
    public String toString() {
        return reason + " at " + source + ":" + lineNumber + " (" + detail + ")";
    }
}
