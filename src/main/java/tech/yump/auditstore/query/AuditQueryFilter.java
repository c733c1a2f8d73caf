package tech.yump.auditstore.query;

import lombok.Builder;
import org.springframework.util.StringUtils;
import tech.yump.auditstore.audit.AuditActionType;
import tech.yump.auditstore.audit.AuditEvent;
import tech.yump.auditstore.audit.AuditOutcome;
import tech.yump.auditstore.audit.AuditTimestamps;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Optional, combinable criteria of an audit log query. Null means "any".
 * Time bounds are inclusive.
 */
@Builder
public record AuditQueryFilter(
        String userId,
        AuditActionType actionType,
        AuditOutcome outcome,
        Instant startTime,
        Instant endTime
) {

    public static final AuditQueryFilter NONE = AuditQueryFilter.builder().build();

    private static final Set<String> KEYS = Set.of("user_id", "action_type", "outcome", "start_time", "end_time");

    /**
     * Builds a filter from the plain dictionary form used by presentation layers.
     * Times may be {@link Instant}s or ISO-8601 strings with offset.
     *
     * @throws IllegalArgumentException if a key is unknown or a value cannot be parsed
     * @throws tech.yump.auditstore.audit.AuditEventValidationException if an action type or outcome is not in the vocabulary
     */
    public static AuditQueryFilter fromMap(Map<String, ?> filters) {
        if (filters == null || filters.isEmpty()) {
            return NONE;
        }
        for (String key : filters.keySet()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown filter: " + key);
            }
        }
        Object actionType = filters.get("action_type");
        Object outcome = filters.get("outcome");
        return AuditQueryFilter.builder()
                .userId(asText(filters.get("user_id")))
                .actionType(actionType == null ? null : AuditActionType.fromValue(actionType.toString()))
                .outcome(outcome == null ? null : AuditOutcome.fromValue(outcome.toString()))
                .startTime(asInstant("start_time", filters.get("start_time")))
                .endTime(asInstant("end_time", filters.get("end_time")))
                .build();
    }

    /**
     * @return true if the event satisfies every criterion that is set
     */
    public boolean matches(AuditEvent event) {
        return (userId == null || userId.equals(event.userId()))
                && (actionType == null || actionType == event.actionType())
                && (outcome == null || outcome == event.outcome())
                && (startTime == null || !event.timestamp().isBefore(startTime))
                && (endTime == null || !event.timestamp().isAfter(endTime));
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }

    private static Instant asInstant(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text && StringUtils.hasText(text)) {
            return AuditTimestamps.parse(text);
        }
        throw new IllegalArgumentException("Filter " + key + " must be an instant or an ISO-8601 string, got: " + value);
    }
}
