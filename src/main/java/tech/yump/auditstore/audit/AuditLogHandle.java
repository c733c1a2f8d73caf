package tech.yump.auditstore.audit;

import lombok.extern.slf4j.Slf4j;
import tech.yump.auditstore.storage.AuditJournal;
import tech.yump.auditstore.storage.JournalRecord;
import tech.yump.auditstore.storage.StorageException;
import tech.yump.auditstore.storage.TransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * The store handle for one logical scope: its {@link AuditLogContainer}, the transaction
 * boundary every mutation runs in, and the journal each committed mutation is written to.
 * <p>
 * Obtain instances from {@link AuditContainerRegistry#getOrCreate(String)} and pass them
 * explicitly to the query, export, cleanup and stats engines.
 */
@Slf4j
public class AuditLogHandle {

    private final String scope;
    private final Clock clock;
    private final AuditJournal journal;
    private final TransactionManager transactions;
    private final AuditLogContainer container;

    private AuditLogHandle(String scope, Clock clock, AuditJournal journal, ContainerMetadata initialMetadata) {
        this.scope = scope;
        this.clock = clock;
        this.journal = journal;
        this.transactions = new TransactionManager(scope);
        this.container = new AuditLogContainer(transactions, clock, initialMetadata);
    }

    /**
     * Opens a scope: replays its journal if one exists, otherwise creates an empty container
     * and journals its creation.
     *
     * @throws StorageException if the journal cannot be read or does not replay cleanly
     */
    static AuditLogHandle open(String scope, Clock clock, AuditJournal journal, int defaultRetentionDays) {
        List<JournalRecord> records = journal.readAll(scope);
        if (records.isEmpty()) {
            ContainerMetadata metadata = ContainerMetadata.initial(clock.instant(), defaultRetentionDays);
            journal.append(scope, JournalRecord.created(metadata.created(), null, metadata.retentionDays()));
            log.info("Created new audit log container for scope '{}'", scope);
            return new AuditLogHandle(scope, clock, journal, metadata);
        }

        JournalRecord first = records.get(0);
        if (first.type() != JournalRecord.Type.CREATED || first.created() == null || first.retentionDays() == null) {
            throw new StorageException("Journal of scope '" + scope + "' does not start with a creation record");
        }
        ContainerMetadata metadata = new ContainerMetadata(first.created(), first.lastCleaned(), 0, first.retentionDays());
        AuditLogHandle handle = new AuditLogHandle(scope, clock, journal, metadata);
        handle.replay(records.subList(1, records.size()));
        log.info("Restored audit log container for scope '{}' with {} event(s) from {} journal record(s)",
                scope, handle.read(c -> c.getMetadata().totalEvents()), records.size());
        return handle;
    }

    public String scope() {
        return scope;
    }

    /**
     * Adds an event in one atomic commit: primary store, three indexes and the journal
     * record either all change or none do.
     *
     * @return the event id
     */
    public String addEvent(AuditEvent event) {
        return transactions.inTransaction(tx -> {
            String eventId = container.addEvent(event);
            tx.beforeCommit(() -> journal.append(scope, JournalRecord.eventAdded(clock.instant(), event.toMap())));
            return eventId;
        });
    }

    /**
     * Removes every event older than {@code cutoff} in one atomic commit, then compacts the
     * journal if anything was deleted.
     */
    public CleanupSummary cleanupOldEvents(Instant cutoff) {
        Instant cleanedAt = clock.instant();
        CleanupSummary summary = transactions.inTransaction(tx -> {
            long initial = container.getMetadata().totalEvents();
            int deleted = container.cleanupOldEvents(cutoff, cleanedAt);
            tx.beforeCommit(() -> journal.append(scope, JournalRecord.eventsCleaned(cleanedAt, cutoff)));
            return new CleanupSummary(cutoff, cleanedAt, initial, deleted, container.getMetadata().totalEvents());
        });
        if (summary.deletedCount() > 0) {
            compactJournal();
        }
        return summary;
    }

    public void setRetentionDays(int retentionDays) {
        transactions.inTransaction(tx -> {
            container.setRetentionDays(retentionDays);
            tx.beforeCommit(() -> journal.append(scope, JournalRecord.retentionChanged(clock.instant(), retentionDays)));
            return null;
        });
    }

    /**
     * Runs a read-only function against committed state.
     */
    public <T> T read(Function<AuditLogContainer, T> query) {
        return transactions.read(() -> query.apply(container));
    }

    private void replay(List<JournalRecord> records) {
        transactions.inTransaction(tx -> {
            for (JournalRecord record : records) {
                try {
                    apply(record);
                } catch (AuditEventValidationException | IllegalArgumentException e) {
                    throw new StorageException("Cannot replay " + record.type() + " record of scope '" + scope + "': " + e.getMessage(), e);
                }
            }
            return null;
        });
    }

    private void apply(JournalRecord record) {
        if (record.type() == null) {
            throw new IllegalArgumentException("record has no type");
        }
        switch (record.type()) {
            case EVENT_ADDED -> container.addEvent(AuditEvent.fromMap(record.event()));
            case EVENTS_CLEANED -> container.cleanupOldEvents(required(record.cutoff(), "cutoff"),
                    required(record.recordedAt(), "recordedAt"));
            case RETENTION_CHANGED -> container.setRetentionDays(required(record.retentionDays(), "retentionDays"));
            case CREATED -> throw new IllegalArgumentException("duplicate creation record");
        }
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value;
    }

    /**
     * Rewrites the journal as one creation record plus the surviving events. A failure leaves
     * the previous journal in place, which still replays to the same state.
     */
    private void compactJournal() {
        try {
            transactions.read(() -> {
                ContainerMetadata metadata = container.getMetadata();
                List<JournalRecord> records = new ArrayList<>();
                records.add(JournalRecord.created(metadata.created(), metadata.lastCleaned(), metadata.retentionDays()));
                for (AuditEvent event : container.queryByTimestamp(null, null)) {
                    records.add(JournalRecord.eventAdded(event.timestamp(), event.toMap()));
                }
                journal.rewrite(scope, records);
                return null;
            });
        } catch (StorageException e) {
            log.error("Journal compaction failed for scope '{}', keeping uncompacted journal: {}", scope, e.getMessage(), e);
        }
    }
}
