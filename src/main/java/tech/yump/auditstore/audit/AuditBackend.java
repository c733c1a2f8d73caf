package tech.yump.auditstore.audit;

/**
 * Secondary sink every stored audit event is mirrored to.
 * Implementations determine where the copy goes (application log, dedicated file, nowhere).
 */
public interface AuditBackend {

    /**
     * Mirrors an event that has already been committed to its audit log.
     *
     * @param scope the scope the event was stored in
     * @param event the stored event, never null
     */
    void logEvent(String scope, AuditEvent event);

}
