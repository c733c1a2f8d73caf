package tech.yump.auditstore.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.auditstore.config.AuditStoreProperties;
import tech.yump.auditstore.storage.AuditJournal;

import java.time.Clock;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Get-or-create access to the audit log of each logical scope (for example one site).
 * Repeated calls for the same scope return the same handle.
 */
@Slf4j
@Component
public class AuditContainerRegistry {

    private final ConcurrentMap<String, AuditLogHandle> handles = new ConcurrentHashMap<>();
    private final AuditJournal journal;
    private final Clock clock;
    private final int defaultRetentionDays;

    public AuditContainerRegistry(AuditJournal journal, Clock clock, AuditStoreProperties properties) {
        this.journal = journal;
        this.clock = clock;
        this.defaultRetentionDays = properties.retention().defaultDays();
    }

    /**
     * @param scope logical scope name, must not be blank
     * @return the scope's handle, restored from its journal on first access
     * @throws tech.yump.auditstore.storage.StorageException if an existing journal cannot be replayed
     */
    public AuditLogHandle getOrCreate(String scope) {
        if (!StringUtils.hasText(scope)) {
            throw new IllegalArgumentException("Scope cannot be null or empty.");
        }
        return handles.computeIfAbsent(scope, s -> AuditLogHandle.open(s, clock, journal, defaultRetentionDays));
    }

    /**
     * Scopes opened in this process plus those that only exist in the journal.
     */
    public Set<String> knownScopes() {
        Set<String> scopes = new TreeSet<>(handles.keySet());
        scopes.addAll(journal.listScopes());
        return scopes;
    }
}
