package tech.yump.auditstore.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.auditstore.audit.ContainerMetadata;

import java.time.Duration;

/**
 * Configuration properties for the audit store under the 'auditstore' prefix.
 * Every section is optional; missing values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "auditstore")
@Validated
public record AuditStoreProperties(

        @Valid
        RetentionProperties retention,

        @Valid
        JournalProperties journal,

        @Valid
        AuditProperties audit,

        @Valid
        ExportProperties export,

        @Valid
        StatsProperties stats,

        @Valid
        CleanupProperties cleanup
) {

    public AuditStoreProperties {
        retention = retention != null ? retention : new RetentionProperties(null);
        journal = journal != null ? journal : new JournalProperties(null, null);
        audit = audit != null ? audit : new AuditProperties(null, null);
        export = export != null ? export : new ExportProperties(null);
        stats = stats != null ? stats : new StatsProperties(null);
        cleanup = cleanup != null ? cleanup : new CleanupProperties(null, null);
    }

    // --- RetentionProperties ---
    @Validated
    public record RetentionProperties(
            @Min(value = 1, message = "Default retention (auditstore.retention.default-days) must be at least 1 day.")
            Integer defaultDays
    ) {
        public RetentionProperties {
            if (defaultDays == null) {
                defaultDays = ContainerMetadata.DEFAULT_RETENTION_DAYS;
            }
        }
    }

    /**
     * Write-ahead journal. When disabled, audit logs live in memory only.
     */
    @Validated
    public record JournalProperties(
            Boolean enabled,
            String path
    ) {
        public static final String DEFAULT_PATH = "./auditstore-data";

        public JournalProperties {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (!StringUtils.hasText(path)) {
                path = DEFAULT_PATH;
            }
        }
    }

    @Validated
    public record AuditProperties(
            @NotNull
            AuditBackendType backend,

            @Valid
            FileAuditProperties file
    ) {
        public AuditProperties {
            if (backend == null) {
                backend = AuditBackendType.SLF4J;
            }
        }

        @AssertTrue(message = "File audit backend requires 'auditstore.audit.file.path' to be set.")
        public boolean isFilePathValid() {
            return backend != AuditBackendType.FILE || (file != null && StringUtils.hasText(file.path()));
        }

        public record FileAuditProperties(
                @NotBlank(message = "Audit file path (auditstore.audit.file.path) must not be blank.")
                String path
        ) {
            public static final String PATH_PROPERTY = "auditstore.audit.file.path";
        }
    }

    /**
     * Where mirrored audit events go besides the audit log itself.
     */
    public enum AuditBackendType {
        SLF4J, FILE, NONE
    }

    @Validated
    public record ExportProperties(
            @Min(value = 1, message = "Export limit (auditstore.export.max-events) must be at least 1.")
            Integer maxEvents
    ) {
        public static final int DEFAULT_MAX_EVENTS = 10_000;

        public ExportProperties {
            if (maxEvents == null) {
                maxEvents = DEFAULT_MAX_EVENTS;
            }
        }
    }

    @Validated
    public record StatsProperties(
            Duration recentWindow
    ) {
        public StatsProperties {
            if (recentWindow == null) {
                recentWindow = Duration.ofHours(24);
            }
        }

        @AssertTrue(message = "Stats window (auditstore.stats.recent-window) must be positive.")
        public boolean isRecentWindowValid() {
            return !recentWindow.isNegative() && !recentWindow.isZero();
        }
    }

    @Validated
    public record CleanupProperties(
            Boolean enabled,
            String cron
    ) {
        public static final String DEFAULT_CRON = "0 0 3 * * *";

        public CleanupProperties {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (!StringUtils.hasText(cron)) {
                cron = DEFAULT_CRON;
            }
        }

        @AssertTrue(message = "Cleanup schedule (auditstore.cleanup.cron) must be a valid cron expression.")
        public boolean isCronValid() {
            return CronExpression.isValidExpression(cron);
        }
    }
}
