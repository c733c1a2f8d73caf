package tech.yump.auditstore.audit;

import java.time.Instant;

/**
 * Bookkeeping kept next to the indexes of an {@link AuditLogContainer}.
 *
 * @param created       when the container was created
 * @param lastCleaned   when the last retention cleanup ran, null if never
 * @param totalEvents   number of events in the primary index
 * @param retentionDays default retention policy in days
 */
public record ContainerMetadata(
        Instant created,
        Instant lastCleaned,
        long totalEvents,
        int retentionDays
) {

    public static final int DEFAULT_RETENTION_DAYS = 90;

    public static ContainerMetadata initial(Instant created, int retentionDays) {
        return new ContainerMetadata(created, null, 0, retentionDays);
    }

    ContainerMetadata withTotalEvents(long total) {
        return new ContainerMetadata(created, lastCleaned, total, retentionDays);
    }

    ContainerMetadata withLastCleaned(Instant cleaned) {
        return new ContainerMetadata(created, cleaned, totalEvents, retentionDays);
    }

    ContainerMetadata withRetentionDays(int days) {
        return new ContainerMetadata(created, lastCleaned, totalEvents, days);
    }
}
