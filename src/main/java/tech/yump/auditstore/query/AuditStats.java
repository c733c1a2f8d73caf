package tech.yump.auditstore.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Container counters combined with recent activity and outcome totals.
 * On failure only {@code error} is set.
 *
 * @param recentActivity   events inside the recent window, counted per action type
 * @param recentEvents24h  total events inside the recent window
 * @param successRate      percentage of successful events, two decimals, 0.0 when there are none
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditStats(
        Long totalEvents,
        String created,
        String lastCleaned,
        Integer retentionDays,
        Integer usersCount,
        Integer actionTypesCount,
        Map<String, Integer> recentActivity,
        @JsonProperty("recent_events_24h")
        Integer recentEvents24h,
        Integer successEvents,
        Integer failureEvents,
        Double successRate,
        Long indexConsistencyViolations,
        String error
) {

    static AuditStats failure(String error) {
        return new AuditStats(null, null, null, null, null, null, null, null, null, null, null, null, error);
    }
}
