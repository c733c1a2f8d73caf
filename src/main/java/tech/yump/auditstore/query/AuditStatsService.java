package tech.yump.auditstore.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.auditstore.audit.AuditEvent;
import tech.yump.auditstore.audit.AuditLogContainer;
import tech.yump.auditstore.audit.AuditLogHandle;
import tech.yump.auditstore.audit.AuditOutcome;
import tech.yump.auditstore.audit.AuditTimestamps;
import tech.yump.auditstore.audit.ContainerStats;
import tech.yump.auditstore.config.AuditStoreProperties;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
@Slf4j
public class AuditStatsService {

    private final Clock clock;
    private final Duration recentWindow;

    public AuditStatsService(Clock clock, AuditStoreProperties properties) {
        this.clock = clock;
        this.recentWindow = properties.stats().recentWindow();
    }

    /**
     * @return statistics read from one consistent snapshot, or an error payload
     */
    public AuditStats getAuditStats(AuditLogHandle handle) {
        try {
            Instant now = clock.instant();
            return handle.read(container -> collect(container, now));
        } catch (RuntimeException e) {
            log.error("Error getting audit stats for scope '{}': {}", handle.scope(), e.getMessage(), e);
            return AuditStats.failure(e.getMessage());
        }
    }

    private AuditStats collect(AuditLogContainer container, Instant now) {
        ContainerStats base = container.getStats();

        List<AuditEvent> recent = container.queryByTimestamp(now.minus(recentWindow), now);
        Map<String, Integer> recentByAction = new TreeMap<>();
        for (AuditEvent event : recent) {
            recentByAction.merge(event.actionType().value(), 1, Integer::sum);
        }

        int success = container.countByOutcome(AuditOutcome.SUCCESS);
        int failure = container.countByOutcome(AuditOutcome.FAILURE);

        return new AuditStats(
                base.totalEvents(),
                AuditTimestamps.format(base.created()),
                AuditTimestamps.format(base.lastCleaned()),
                base.retentionDays(),
                base.usersCount(),
                base.actionTypesCount(),
                recentByAction,
                recent.size(),
                success,
                failure,
                successRate(success, failure),
                base.indexConsistencyViolations(),
                null);
    }

    static double successRate(int success, int failure) {
        int total = success + failure;
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(success * 100L)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
