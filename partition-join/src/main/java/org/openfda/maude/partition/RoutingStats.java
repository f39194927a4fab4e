package org.openfda.maude.partition;

import java.util.concurrent.atomic.AtomicLong;

import org.openfda.maude.ir.Category;
import org.openfda.maude.ir.SkippedRow;

/**
 * Per-category routing counters. Every row read ends up in exactly one counter, so
 * {@code routed + skipped} equals the number of lines read.
 */
public class RoutingStats {
    private final Category category;
    private final AtomicLong files = new AtomicLong();
    private final AtomicLong routed = new AtomicLong();
    private final AtomicLong headerRows = new AtomicLong();
    private final AtomicLong malformedRows = new AtomicLong();

    public RoutingStats(Category category) {
        this.category = category;
    }

    void fileStarted() {
        files.incrementAndGet();
    }

    void routed() {
        routed.incrementAndGet();
    }

    void skipped(SkippedRow skippedRow) {
        switch (skippedRow.reason()) {
            case HEADER:
            case UNEXPECTED_HEADER:
                headerRows.incrementAndGet();
                break;
            default:
                malformedRows.incrementAndGet();
        }
    }

    public Category getCategory() {
        return category;
    }

    public long getFiles() {
        return files.get();
    }

    public long getRouted() {
        return routed.get();
    }

    public long getHeaderRows() {
        return headerRows.get();
    }

    public long getMalformedRows() {
        return malformedRows.get();
    }

    public long getSkipped() {
        return getHeaderRows() + getMalformedRows();
    }

    @Override
    public String toString() {
        return String.format("RoutingStats{category=%s, files=%d, routed=%d, headerRows=%d, malformedRows=%d}",
            category, getFiles(), getRouted(), getHeaderRows(), getMalformedRows());
    }
}
