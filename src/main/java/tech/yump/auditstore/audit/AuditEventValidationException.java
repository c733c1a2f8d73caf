package tech.yump.auditstore.audit;

/**
 * Thrown when an audit event cannot be constructed because one of its fields
 * is outside the accepted vocabulary or carries an unsupported metadata value.
 */
public class AuditEventValidationException extends RuntimeException {

    public AuditEventValidationException(String message) {
        super(message);
    }
}
