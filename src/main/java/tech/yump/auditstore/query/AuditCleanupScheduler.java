package tech.yump.auditstore.query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;
import tech.yump.auditstore.audit.AuditContainerRegistry;
import tech.yump.auditstore.config.AuditStoreProperties;
import tech.yump.auditstore.storage.StorageException;

import java.time.ZoneOffset;

/**
 * Applies each scope's stored retention policy on the {@code auditstore.cleanup.cron}
 * schedule (UTC), unless {@code auditstore.cleanup.enabled} is false.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditCleanupScheduler implements SchedulingConfigurer {

    private final AuditContainerRegistry registry;
    private final AuditRetentionService retentionService;
    private final AuditStoreProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        AuditStoreProperties.CleanupProperties cleanup = properties.cleanup();
        if (!cleanup.enabled()) {
            log.info("Scheduled audit retention cleanup is disabled");
            return;
        }
        taskRegistrar.addCronTask(new CronTask(this::cleanupAllScopes, new CronTrigger(cleanup.cron(), ZoneOffset.UTC)));
        log.info("Scheduled audit retention cleanup with cron '{}' (UTC)", cleanup.cron());
    }

    public void cleanupAllScopes() {
        log.info("=== Scheduled Job: Audit Log Retention Cleanup ===");
        int scopes = 0;
        long deleted = 0;
        for (String scope : registry.knownScopes()) {
            try {
                CleanupResult result = retentionService.cleanupOldLogs(registry.getOrCreate(scope), null);
                if (result.error() == null) {
                    deleted += result.deletedCount();
                    scopes++;
                }
            } catch (StorageException e) {
                log.error("Skipping retention cleanup of scope '{}', its audit log could not be opened", scope, e);
            }
        }
        log.info("Scheduled retention cleanup finished: {} scope(s) cleaned, {} event(s) deleted", scopes, deleted);
    }
}
