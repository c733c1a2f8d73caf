package tech.yump.auditstore.audit;

import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One immutable record of a security-relevant action (a login attempt, a passkey
 * registration, an AAL2 access decision, ...).
 * Timestamps are UTC with microsecond resolution; metadata is a frozen JSON-like bag.
 */
public record AuditEvent(
        String eventId,
        Instant timestamp,
        String userId,             // Acting user, "anonymous" when not known
        AuditActionType actionType,
        AuditOutcome outcome,
        String ipAddress,
        String userAgent,
        Map<String, Object> metadata // Action-specific detail (credential id, denial reason, ...)
) {

    public static final String ANONYMOUS = "anonymous";
    public static final String UNKNOWN = "unknown";

    public AuditEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(outcome, "outcome");
        timestamp = AuditTimestamps.truncate(timestamp);
        userId = StringUtils.hasText(userId) ? userId : ANONYMOUS;
        ipAddress = StringUtils.hasText(ipAddress) ? ipAddress : UNKNOWN;
        userAgent = StringUtils.hasText(userAgent) ? userAgent : UNKNOWN;
        metadata = EventMetadata.copyOf(metadata);
    }

    /**
     * Creates a new event stamped with the clock's current instant and a fresh id.
     *
     * @param clock      source of "now"; production code passes a UTC system clock
     * @param userId     acting user, null or blank becomes {@value #ANONYMOUS}
     * @param actionType one of the {@link AuditActionType} wire values
     * @param outcome    {@code "success"} or {@code "failure"}
     * @param ipAddress  client address, null or blank becomes {@value #UNKNOWN}
     * @param userAgent  client User-Agent, null or blank becomes {@value #UNKNOWN}
     * @param metadata   optional action-specific data
     * @throws AuditEventValidationException if the action type, outcome or metadata is invalid
     */
    public static AuditEvent create(Clock clock, String userId, String actionType, String outcome,
                                    String ipAddress, String userAgent, Map<String, ?> metadata) {
        return create(clock, userId, AuditActionType.fromValue(actionType), AuditOutcome.fromValue(outcome),
                ipAddress, userAgent, metadata);
    }

    public static AuditEvent create(Clock clock, String userId, AuditActionType actionType, AuditOutcome outcome,
                                    String ipAddress, String userAgent, Map<String, ?> metadata) {
        if (actionType == null) {
            throw new AuditEventValidationException("Invalid action_type: null");
        }
        if (outcome == null) {
            throw new AuditEventValidationException("Invalid outcome: null");
        }
        return new AuditEvent(UUID.randomUUID().toString(), clock.instant(), userId, actionType, outcome,
                ipAddress, userAgent, copyMetadata(metadata));
    }

    /**
     * Rebuilds an event from its {@link #toMap()} form, re-validating every field.
     *
     * @throws AuditEventValidationException if a field is missing or invalid
     */
    public static AuditEvent fromMap(Map<String, ?> map) {
        if (map == null) {
            throw new AuditEventValidationException("Missing event");
        }
        Object eventId = map.get("event_id");
        Object timestamp = map.get("timestamp");
        if (!(eventId instanceof String id) || !StringUtils.hasText(id)) {
            throw new AuditEventValidationException("Missing event_id");
        }
        if (!(timestamp instanceof String ts)) {
            throw new AuditEventValidationException("Missing timestamp for event " + eventId);
        }
        Instant instant;
        try {
            instant = AuditTimestamps.parse(ts);
        } catch (IllegalArgumentException e) {
            throw new AuditEventValidationException("Invalid timestamp for event " + eventId + ": " + ts);
        }
        Object metadata = map.get("metadata");
        if (metadata != null && !(metadata instanceof Map)) {
            throw new AuditEventValidationException("Metadata must be an object for event " + eventId);
        }
        return new AuditEvent(
                id,
                instant,
                asString(map.get("user_id")),
                AuditActionType.fromValue(asString(map.get("action_type"))),
                AuditOutcome.fromValue(asString(map.get("outcome"))),
                asString(map.get("ip_address")),
                asString(map.get("user_agent")),
                copyMetadata((Map<?, ?>) metadata));
    }

    /**
     * Plain, JSON-ready view of the event with snake_case keys in a fixed order.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("event_id", eventId);
        map.put("timestamp", AuditTimestamps.format(timestamp));
        map.put("user_id", userId);
        map.put("action_type", actionType.value());
        map.put("outcome", outcome.value());
        map.put("ip_address", ipAddress);
        map.put("user_agent", userAgent);
        map.put("metadata", metadata);
        return map;
    }

    @Override
    public String toString() {
        return "AuditEvent[" + eventId + " " + actionType + " " + outcome + "]";
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Map<String, Object> copyMetadata(Map<?, ?> metadata) {
        if (metadata == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : metadata.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new AuditEventValidationException("Metadata keys must be strings, got: " + entry.getKey());
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }
}
