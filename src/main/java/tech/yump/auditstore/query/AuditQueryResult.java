package tech.yump.auditstore.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * One page of a query. {@code total} counts the whole filtered set, not just this page.
 *
 * @param events  the page, most recent first, each event in its plain map form
 * @param limit   requested page size, null for unlimited
 * @param hasMore whether events exist after this page
 * @param error   failure description; only set on the error payload
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditQueryResult(
        List<Map<String, Object>> events,
        int total,
        int offset,
        Integer limit,
        boolean hasMore,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        String error
) {

    static AuditQueryResult failure(Integer limit, String error) {
        return new AuditQueryResult(List.of(), 0, 0, limit, false, error);
    }
}
