package tech.yump.auditstore.audit;

import java.time.Instant;

/**
 * Counts captured inside a single cleanup transaction, so
 * {@code initialCount == deletedCount + remainingCount} always holds.
 */
public record CleanupSummary(
        Instant cutoff,
        Instant cleanedAt,
        long initialCount,
        int deletedCount,
        long remainingCount
) {
}
