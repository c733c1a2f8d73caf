package tech.yump.auditstore.query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import tech.yump.auditstore.audit.AuditLogHandle;
import tech.yump.auditstore.audit.CleanupSummary;
import tech.yump.auditstore.audit.ContainerMetadata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Applies the retention policy of an audit log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditRetentionService {

    private final Clock clock;

    /**
     * Deletes every event older than {@code now - retentionDays}. Running it again with
     * the same cutoff deletes nothing.
     *
     * @param retentionDays days to keep, null to use the audit log's stored policy
     * @return the counts, or an error payload if the cleanup failed
     */
    public CleanupResult cleanupOldLogs(AuditLogHandle handle, @Nullable Integer retentionDays) {
        int days = retentionDays != null ? retentionDays : ContainerMetadata.DEFAULT_RETENTION_DAYS;
        try {
            if (retentionDays == null) {
                days = handle.read(container -> container.getMetadata().retentionDays());
            }
            if (days < 1) {
                throw new IllegalArgumentException("Retention days must be at least 1, got: " + days);
            }

            Instant cutoff = clock.instant().minus(Duration.ofDays(days));
            CleanupSummary summary = handle.cleanupOldEvents(cutoff);

            log.info("Cleanup complete for scope '{}': deleted {} events, {} remaining (retention: {} days)",
                    handle.scope(), summary.deletedCount(), summary.remainingCount(), days);
            return CleanupResult.of(summary, days);
        } catch (RuntimeException e) {
            log.error("Error cleaning up audit logs of scope '{}': {}", handle.scope(), e.getMessage(), e);
            return CleanupResult.failure(days, e.getMessage());
        }
    }

    /**
     * Stores a new default retention for the audit log.
     *
     * @throws IllegalArgumentException if {@code retentionDays} is less than 1
     */
    public void updateRetentionPolicy(AuditLogHandle handle, int retentionDays) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("Retention days must be at least 1, got: " + retentionDays);
        }
        handle.setRetentionDays(retentionDays);
        log.info("Retention policy of scope '{}' updated to {} days", handle.scope(), retentionDays);
    }
}
