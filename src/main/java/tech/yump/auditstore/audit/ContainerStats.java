package tech.yump.auditstore.audit;

import java.time.Instant;

/**
 * Constant-time summary of a container.
 * {@code usersCount} and {@code actionTypesCount} are the number of non-empty
 * user and action-type index buckets.
 */
public record ContainerStats(
        long totalEvents,
        Instant created,
        Instant lastCleaned,
        int retentionDays,
        int usersCount,
        int actionTypesCount,
        long indexConsistencyViolations
) {
}
