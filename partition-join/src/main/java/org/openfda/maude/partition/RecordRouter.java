package org.openfda.maude.partition;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;

import org.openfda.maude.io.InputFileSource;
import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.JoinKey;
import org.openfda.maude.ir.Row;
import org.openfda.maude.ir.SkippedRow;

import lombok.extern.slf4j.Slf4j;

/**
 * Streams one category file and appends each row, unchanged, to the shard file picked by
 * {@code mdr_report_key mod N}. Rows that cannot be routed are counted and logged, never fatal.
 */
@Slf4j
public class RecordRouter {

    /** Value of the first header column in the MAUDE extracts that carry a header. */
    public static final String HEADER_TOKEN = "MDR_REPORT_KEY";

    private final InputFileSource inputSource;
    private final char delimiter;

    public RecordRouter(InputFileSource inputSource, char delimiter) {
        this.inputSource = inputSource;
        this.delimiter = delimiter;
    }

    /**
     * Route every row of {@code input} into {@code writers}.
     *
     * @throws IOException if the input cannot be read; row-level problems never throw
     */
    public void route(Path input, Category category, ShardWriters writers, RoutingStats stats) throws IOException {
        if (writers.getCategory() != category) {
            throw new IllegalArgumentException("Writers for " + writers.getCategory() + " cannot take " + category);
        }
        stats.fileStarted();
        int shardCount = writers.getShardCount();
        long lineNumber = 0;
        long routedFromFile = 0;
        try (BufferedReader reader = inputSource.open(input)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String key = Row.firstField(line, delimiter);
                if (isHeaderToken(key)) {
                    var reason = lineNumber == 1 ? SkippedRow.Reason.HEADER : SkippedRow.Reason.UNEXPECTED_HEADER;
                    skip(stats, new SkippedRow(input, lineNumber, reason, key));
                } else if (!JoinKey.isValid(key)) {
                    skip(stats, new SkippedRow(input, lineNumber, SkippedRow.Reason.MALFORMED_KEY, abbreviate(line)));
                } else {
                    writers.append(new JoinKey(key).shard(shardCount), line);
                    stats.routed();
                    routedFromFile++;
                }
            }
        }
        log.info("Routed {} of {} rows from {} as {}", routedFromFile, lineNumber, input.getFileName(), category);
    }

    static boolean isHeaderToken(String firstField) {
        return HEADER_TOKEN.equalsIgnoreCase(firstField.trim());
    }

    private void skip(RoutingStats stats, SkippedRow skippedRow) {
        stats.skipped(skippedRow);
        if (skippedRow.reason() == SkippedRow.Reason.HEADER) {
            log.debug("Skipping source header of {}", skippedRow.source());
        } else {
            log.atWarn().setMessage("Skipping row: {}").addArgument(skippedRow).log();
        }
    }

    private static String abbreviate(String line) {
        return line.length() > 120 ? line.substring(0, 120) + "..." : line;
    }
}
