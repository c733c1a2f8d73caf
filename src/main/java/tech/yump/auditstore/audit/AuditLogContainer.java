package tech.yump.auditstore.audit;

import lombok.extern.slf4j.Slf4j;
import tech.yump.auditstore.storage.OrderedStore;
import tech.yump.auditstore.storage.StoreFactory;
import tech.yump.auditstore.storage.StoreValue;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Audit events with one primary and three secondary indexes.
 *
 * <pre>
 * events:     epochMicros -> AuditEvent
 * by_user:    userId      -> (epochMicros -> eventId)
 * by_action:  actionType  -> (epochMicros -> eventId)
 * by_outcome: outcome     -> (epochMicros -> eventId)
 * </pre>
 *
 * The primary key is the event timestamp as epoch microseconds, bumped by one
 * microsecond until unique. Secondary indexes use the same key, so every secondary
 * entry resolves to its primary entry without conversion loss. Because a bumped key can
 * lie past its event's timestamp, time ranges and cleanup cutoffs scan keys widened by the
 * largest bump seen and then select by {@link AuditEvent#timestamp()}.
 * <p>
 * The container does no locking. Mutating methods must run inside a transaction of
 * the {@link StoreFactory} that supplied its stores; readers rely on that host for isolation.
 */
@Slf4j
public class AuditLogContainer {

    private final StoreFactory stores;
    private final Clock clock;

    private final OrderedStore<Long, AuditEvent> events;
    private final OrderedStore<String, OrderedStore<Long, String>> byUser;
    private final OrderedStore<String, OrderedStore<Long, String>> byAction;
    private final OrderedStore<String, OrderedStore<Long, String>> byOutcome;
    private final StoreValue<ContainerMetadata> metadata;

    // Diagnostic only, not part of the persisted state
    private final AtomicLong consistencyViolations = new AtomicLong();

    // Largest distance between a key and its event's timestamp. Never shrinks; a
    // rolled-back add can leave it too large, which only widens scans.
    private volatile long maxKeyBump;

    public AuditLogContainer(StoreFactory stores, Clock clock, int retentionDays) {
        this(stores, clock, ContainerMetadata.initial(clock.instant(), retentionDays));
    }

    public AuditLogContainer(StoreFactory stores, Clock clock, ContainerMetadata initialMetadata) {
        if (initialMetadata.totalEvents() != 0) {
            throw new IllegalArgumentException("A new container must start with zero events");
        }
        validateRetentionDays(initialMetadata.retentionDays());
        this.stores = stores;
        this.clock = clock;
        this.events = stores.newOrderedStore();
        this.byUser = stores.newOrderedStore();
        this.byAction = stores.newOrderedStore();
        this.byOutcome = stores.newOrderedStore();
        this.metadata = stores.newValue(initialMetadata);
    }

    /**
     * Adds an event to the primary store and all three secondary indexes.
     *
     * @return the event id
     */
    public String addEvent(AuditEvent event) {
        long timestampKey = AuditTimestamps.toEpochMicros(event.timestamp());
        long key = timestampKey;
        while (events.containsKey(key)) {
            key++;
        }
        if (key - timestampKey > maxKeyBump) {
            maxKeyBump = key - timestampKey;
        }

        events.put(key, event);
        index(byUser, event.userId(), key, event.eventId());
        index(byAction, event.actionType().value(), key, event.eventId());
        index(byOutcome, event.outcome().value(), key, event.eventId());

        ContainerMetadata current = metadata.get();
        metadata.set(current.withTotalEvents(current.totalEvents() + 1));

        log.debug("Added audit event: {} ({}, {}, {})", event.eventId(), event.userId(), event.actionType(), event.outcome());
        return event.eventId();
    }

    /**
     * @param start inclusive lower bound, null for unbounded
     * @param end   inclusive upper bound, null for unbounded
     * @return events whose timestamp lies in the range, ascending by key
     */
    public List<AuditEvent> queryByTimestamp(Instant start, Instant end) {
        List<AuditEvent> results = new ArrayList<>();
        for (Long key : events.keys(lowerKey(start), upperKey(end))) {
            events.get(key)
                    .filter(event -> inRange(event, start, end))
                    .ifPresent(results::add);
        }
        return results;
    }

    public List<AuditEvent> queryByUser(String userId, Instant start, Instant end) {
        return queryIndex(byUser, "user", userId, start, end);
    }

    public List<AuditEvent> queryByAction(AuditActionType actionType, Instant start, Instant end) {
        return queryIndex(byAction, "action", actionType.value(), start, end);
    }

    public List<AuditEvent> queryByOutcome(AuditOutcome outcome, Instant start, Instant end) {
        return queryIndex(byOutcome, "outcome", outcome.value(), start, end);
    }

    /**
     * Number of events recorded with the given outcome, read from the bucket size.
     */
    public int countByOutcome(AuditOutcome outcome) {
        return byOutcome.get(outcome.value()).map(OrderedStore::size).orElse(0);
    }

    /**
     * Deletes every event whose timestamp is strictly before {@code cutoff}, together with
     * its secondary entries. Buckets left empty are removed. Membership is decided by the
     * event timestamp, not by its possibly bumped key.
     *
     * @return number of events deleted
     */
    public int cleanupOldEvents(Instant cutoff) {
        return cleanupOldEvents(cutoff, clock.instant());
    }

    /**
     * Same as {@link #cleanupOldEvents(Instant)} with an explicit cleanup time, used when
     * a recorded cleanup is replayed.
     */
    public int cleanupOldEvents(Instant cutoff, Instant cleanedAt) {
        long cutoffKey = ceilMicros(cutoff);
        int deleted = 0;

        // No key lies below Long.MIN_VALUE, so nothing can be older than such a cutoff
        List<Long> candidates = cutoffKey == Long.MIN_VALUE
                ? List.of()
                : events.keys(null, widen(cutoffKey - 1));
        for (Long key : candidates) {
            Optional<AuditEvent> removed = events.get(key);
            if (removed.isEmpty() || !removed.get().timestamp().isBefore(cutoff)) {
                continue;
            }
            AuditEvent event = removed.get();
            events.remove(key);
            unindex(byUser, "user", event.userId(), key);
            unindex(byAction, "action", event.actionType().value(), key);
            unindex(byOutcome, "outcome", event.outcome().value(), key);
            deleted++;
        }

        ContainerMetadata current = metadata.get();
        metadata.set(current.withTotalEvents(current.totalEvents() - deleted).withLastCleaned(cleanedAt));

        log.info("Cleaned up {} audit events older than {}", deleted, AuditTimestamps.format(cutoff));
        return deleted;
    }

    public void setRetentionDays(int retentionDays) {
        validateRetentionDays(retentionDays);
        metadata.set(metadata.get().withRetentionDays(retentionDays));
        log.info("Audit retention policy set to {} days", retentionDays);
    }

    public ContainerMetadata getMetadata() {
        return metadata.get();
    }

    public ContainerStats getStats() {
        ContainerMetadata current = metadata.get();
        return new ContainerStats(
                current.totalEvents(),
                current.created(),
                current.lastCleaned(),
                current.retentionDays(),
                byUser.size(),
                byAction.size(),
                consistencyViolations.get());
    }

    /**
     * Walks every index and counts entries that break the container invariants.
     */
    public IntegrityReport verifyIntegrity() {
        int dangling = 0;
        int empty = 0;
        for (OrderedStore<String, OrderedStore<Long, String>> index : List.of(byUser, byAction, byOutcome)) {
            for (String value : index.keys(null, null)) {
                OrderedStore<Long, String> bucket = index.get(value).orElseThrow();
                if (bucket.isEmpty()) {
                    empty++;
                }
                for (Long key : bucket.keys(null, null)) {
                    String eventId = bucket.get(key).orElseThrow();
                    if (events.get(key).filter(e -> e.eventId().equals(eventId)).isEmpty()) {
                        dangling++;
                    }
                }
            }
        }

        int missing = 0;
        List<Long> primaryKeys = events.keys(null, null);
        for (Long key : primaryKeys) {
            AuditEvent event = events.get(key).orElseThrow();
            missing += isIndexed(byUser, event.userId(), key, event.eventId()) ? 0 : 1;
            missing += isIndexed(byAction, event.actionType().value(), key, event.eventId()) ? 0 : 1;
            missing += isIndexed(byOutcome, event.outcome().value(), key, event.eventId()) ? 0 : 1;
        }

        IntegrityReport report = new IntegrityReport(primaryKeys.size(), metadata.get().totalEvents(), dangling, missing, empty);
        if (!report.consistent()) {
            log.error("Audit index integrity check failed: {}", report);
        }
        return report;
    }

    private static boolean isIndexed(OrderedStore<String, OrderedStore<Long, String>> index, String value,
                                     long key, String eventId) {
        return index.get(value)
                .flatMap(bucket -> bucket.get(key))
                .filter(eventId::equals)
                .isPresent();
    }

    private void index(OrderedStore<String, OrderedStore<Long, String>> index, String value, long key, String eventId) {
        OrderedStore<Long, String> bucket = index.get(value).orElse(null);
        if (bucket == null) {
            bucket = stores.newOrderedStore();
            index.put(value, bucket);
        }
        bucket.put(key, eventId);
    }

    private void unindex(OrderedStore<String, OrderedStore<Long, String>> index, String dimension, String value, long key) {
        Optional<OrderedStore<Long, String>> bucket = index.get(value);
        if (bucket.isEmpty() || !bucket.get().remove(key)) {
            log.warn("Index consistency violation: {} bucket '{}' has no entry for key {}", dimension, value, key);
            consistencyViolations.incrementAndGet();
            return;
        }
        if (bucket.get().isEmpty()) {
            index.remove(value);
        }
    }

    private List<AuditEvent> queryIndex(OrderedStore<String, OrderedStore<Long, String>> index, String dimension,
                                        String value, Instant start, Instant end) {
        OrderedStore<Long, String> bucket = index.get(value).orElse(null);
        if (bucket == null) {
            return new ArrayList<>();
        }

        List<AuditEvent> results = new ArrayList<>();
        for (Long key : bucket.keys(lowerKey(start), upperKey(end))) {
            String eventId = bucket.get(key).orElse(null);
            Optional<AuditEvent> event = events.get(key);
            if (event.isPresent() && event.get().eventId().equals(eventId)) {
                if (inRange(event.get(), start, end)) {
                    results.add(event.get());
                }
            } else {
                // Skip so the query still answers, but never silently
                long total = consistencyViolations.incrementAndGet();
                log.error("Index consistency violation: {} bucket '{}' references key {} (event {}) with no matching primary entry; {} violation(s) so far",
                        dimension, value, key, eventId, total);
            }
        }
        return results;
    }

    private static boolean inRange(AuditEvent event, Instant start, Instant end) {
        return (start == null || !event.timestamp().isBefore(start))
                && (end == null || !event.timestamp().isAfter(end));
    }

    // A key is never below its timestamp, so the lower bound needs no widening
    private static Long lowerKey(Instant start) {
        return start == null ? null : ceilMicros(start);
    }

    private Long upperKey(Instant end) {
        return end == null ? null : widen(AuditTimestamps.toEpochMicrosSaturated(end));
    }

    private long widen(long key) {
        long widened = key + maxKeyBump;
        return widened < key ? Long.MAX_VALUE : widened;
    }

    private static long ceilMicros(Instant instant) {
        long micros = AuditTimestamps.toEpochMicrosSaturated(instant);
        return instant.getNano() % 1_000 == 0 || micros == Long.MAX_VALUE ? micros : micros + 1;
    }

    private static void validateRetentionDays(int retentionDays) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("Retention days must be at least 1, got: " + retentionDays);
        }
    }
}
