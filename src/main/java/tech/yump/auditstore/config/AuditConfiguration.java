package tech.yump.auditstore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.auditstore.audit.AuditBackend;
import tech.yump.auditstore.audit.FileAuditBackend;
import tech.yump.auditstore.audit.LogAuditBackend;
import tech.yump.auditstore.storage.AuditJournal;
import tech.yump.auditstore.storage.FileSystemAuditJournal;
import tech.yump.auditstore.storage.NoopAuditJournal;

import java.time.Clock;

@Configuration
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    public AuditConfiguration(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    public Clock auditClock() {
        return Clock.systemUTC();
    }

    // --- Journal ---

    @Bean
    public AuditJournal auditJournal(AuditStoreProperties properties) {
        AuditStoreProperties.JournalProperties journal = properties.journal();
        if (!journal.enabled()) {
            log.warn("Audit journal disabled: audit logs are kept in memory only and are lost on restart");
            return new NoopAuditJournal();
        }
        log.info("Configuring file system audit journal at '{}'", journal.path());
        return new FileSystemAuditJournal(objectMapper, journal.path());
    }

    // --- Mirror backends ---

    @Bean
    @ConditionalOnProperty(name = "auditstore.audit.backend", havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "auditstore.audit.backend", havingValue = "file")
    public AuditBackend fileAuditBackend() {
        log.info("Configuring File Audit Backend. Ensure Logback is configured correctly for logger '{}' and path property '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, AuditStoreProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "auditstore.audit.backend", havingValue = "none")
    public AuditBackend noopAuditBackend() {
        log.info("Audit event mirroring disabled");
        return (scope, event) -> {
        };
    }
}
