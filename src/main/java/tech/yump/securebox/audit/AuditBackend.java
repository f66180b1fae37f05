package tech.yump.securebox.audit;

/**
 * Destination for vault audit events.
 */
public interface AuditBackend {

    /**
     * Records a single event. Implementations decide where it goes (application log, dedicated file).
     *
     * @param event The event to record. Must not be null.
     */
    void logEvent(AuditEvent event);

}
