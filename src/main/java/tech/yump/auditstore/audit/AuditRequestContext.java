package tech.yump.auditstore.audit;

/**
 * Client provenance of the request that triggered an audit event.
 * Either field may be null; the event records {@code "unknown"} instead.
 */
public record AuditRequestContext(String ipAddress, String userAgent) {

    public static final AuditRequestContext UNKNOWN = new AuditRequestContext(null, null);
}
