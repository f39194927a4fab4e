package org.openfda.maude.common;

import java.util.List;

/**
 * Raised once every shard job has finished and at least one of them failed. Each shard failure is
 * attached as a suppressed exception.
 */
public class JoinWorkerException extends MaudePipelineException {
    private final List<Integer> failedShards;

    public JoinWorkerException(List<Integer> failedShards, List<Throwable> failures) {
        super("Join failed for " + failedShards.size() + " shard(s): " + failedShards,
            failures.isEmpty() ? null : failures.get(0));
        this.failedShards = List.copyOf(failedShards);
        failures.stream().skip(1).forEach(this::addSuppressed);
    }

    public List<Integer> getFailedShards() {
        return failedShards;
    }
}
