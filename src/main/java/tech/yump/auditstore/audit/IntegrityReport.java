package tech.yump.auditstore.audit;

/**
 * Result of a full consistency walk over a container's primary and secondary indexes.
 *
 * @param primaryCount          events in the primary index
 * @param totalEvents           the container's event counter
 * @param danglingIndexEntries  secondary entries with no matching primary event
 * @param missingIndexEntries   primary events absent from one of their secondary buckets
 * @param emptyBuckets          secondary buckets holding no entries
 */
public record IntegrityReport(
        int primaryCount,
        long totalEvents,
        int danglingIndexEntries,
        int missingIndexEntries,
        int emptyBuckets
) {

    public boolean consistent() {
        return primaryCount == totalEvents
                && danglingIndexEntries == 0
                && missingIndexEntries == 0
                && emptyBuckets == 0;
    }
}
