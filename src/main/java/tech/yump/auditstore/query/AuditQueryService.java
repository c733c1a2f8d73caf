package tech.yump.auditstore.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import tech.yump.auditstore.audit.AuditEvent;
import tech.yump.auditstore.audit.AuditLogContainer;
import tech.yump.auditstore.audit.AuditLogHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Multi-criteria, paginated queries over an audit log.
 * <p>
 * Exactly one index is consulted, by precedence user &gt; action type &gt; outcome &gt;
 * time range; the remaining criteria are applied to that result in memory.
 */
@Service
@Slf4j
public class AuditQueryService {

    private static final Comparator<AuditEvent> MOST_RECENT_FIRST =
            Comparator.comparing(AuditEvent::timestamp).reversed();

    /**
     * Plain-dictionary variant of {@link #queryAuditLogs(AuditLogHandle, AuditQueryFilter, Integer, int)}.
     */
    public AuditQueryResult queryAuditLogs(AuditLogHandle handle, @Nullable Map<String, ?> filters,
                                           @Nullable Integer limit, int offset) {
        try {
            return queryAuditLogs(handle, AuditQueryFilter.fromMap(filters), limit, offset);
        } catch (RuntimeException e) {
            log.error("Error querying audit logs: {}", e.getMessage(), e);
            return AuditQueryResult.failure(limit, e.getMessage());
        }
    }

    /**
     * @param limit  page size, null for everything after {@code offset}
     * @param offset number of matching events to skip
     * @return the requested page, or an error payload if the query failed
     */
    public AuditQueryResult queryAuditLogs(AuditLogHandle handle, AuditQueryFilter filter,
                                           @Nullable Integer limit, int offset) {
        try {
            if (offset < 0) {
                throw new IllegalArgumentException("Offset must not be negative: " + offset);
            }
            if (limit != null && limit < 0) {
                throw new IllegalArgumentException("Limit must not be negative: " + limit);
            }

            List<AuditEvent> matching = findMatching(handle, filter);
            int total = matching.size();
            int from = Math.min(offset, total);
            int to = limit == null ? total : (int) Math.min((long) from + limit, total);
            List<Map<String, Object>> page = matching.subList(from, to).stream()
                    .map(AuditEvent::toMap)
                    .toList();

            log.debug("Audit query on scope '{}' matched {} event(s), returning {} from offset {}",
                    handle.scope(), total, page.size(), offset);
            return new AuditQueryResult(page, total, offset, limit, offset + page.size() < total, null);
        } catch (RuntimeException e) {
            log.error("Error querying audit logs: {}", e.getMessage(), e);
            return AuditQueryResult.failure(limit, e.getMessage());
        }
    }

    /**
     * Every event matching {@code filter}, most recent first. Events sharing a timestamp
     * are returned latest-inserted first.
     */
    public List<AuditEvent> findMatching(AuditLogHandle handle, AuditQueryFilter filter) {
        List<AuditEvent> events = handle.read(container -> lookup(container, filter));
        List<AuditEvent> matching = new ArrayList<>(events.stream().filter(filter::matches).toList());
        Collections.reverse(matching);
        matching.sort(MOST_RECENT_FIRST);
        return matching;
    }

    private static List<AuditEvent> lookup(AuditLogContainer container, AuditQueryFilter filter) {
        if (filter.userId() != null) {
            return container.queryByUser(filter.userId(), filter.startTime(), filter.endTime());
        }
        if (filter.actionType() != null) {
            return container.queryByAction(filter.actionType(), filter.startTime(), filter.endTime());
        }
        if (filter.outcome() != null) {
            return container.queryByOutcome(filter.outcome(), filter.startTime(), filter.endTime());
        }
        return container.queryByTimestamp(filter.startTime(), filter.endTime());
    }
}
