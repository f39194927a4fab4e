package org.openfda.maude.join;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters for one shard's join.
 */
@Getter
@ToString
public class JoinStats {
    private final int shard;
    private long documents;
    private long dependentRows;
    /** Rows with fewer fields than their schema, dropped. */
    private long skippedRows;
    /** Rows with more fields than their schema, kept with the surplus folded into the last column. */
    private long overlongRows;
    /** Dependent rows whose key has no master row in the shard, dropped. */
    private long orphanedRows;

    public JoinStats(int shard) {
        this.shard = shard;
    }

    void documentEmitted() {
        documents++;
    }

    void dependentLoaded() {
        dependentRows++;
    }

    void rowSkipped() {
        skippedRows++;
    }

    void overlongRow() {
        overlongRows++;
    }

    void orphaned(long rows) {
        orphanedRows += rows;
    }
}
