package com.contact.resolution.replication;

import java.time.Instant;

/**
 * Outcome of one replication run.
 *
 * @param selected rows whose mirror needed refreshing
 * @param written  rows written to the distributed cache and marked replicated
 * @param skipped  rows that failed and will be retried next run
 * @param ranAt    when the run started
 */
public record ReplicationStats(int selected, int written, int skipped, Instant ranAt) {
}
