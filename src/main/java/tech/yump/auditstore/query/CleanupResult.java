package tech.yump.auditstore.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import tech.yump.auditstore.audit.AuditTimestamps;
import tech.yump.auditstore.audit.CleanupSummary;

/**
 * Outcome of a retention cleanup. On failure only {@code deletedCount},
 * {@code retentionDays} and {@code error} are set.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CleanupResult(
        int deletedCount,
        int retentionDays,
        String cutoffDate,
        Long remainingCount,
        Long initialCount,
        String error
) {

    static CleanupResult of(CleanupSummary summary, int retentionDays) {
        return new CleanupResult(summary.deletedCount(), retentionDays, AuditTimestamps.format(summary.cutoff()),
                summary.remainingCount(), summary.initialCount(), null);
    }

    static CleanupResult failure(int retentionDays, String error) {
        return new CleanupResult(0, retentionDays, null, null, null, error);
    }
}
