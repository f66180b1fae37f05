package tech.yump.securebox.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    private final AuditBackend auditBackend;

    /**
     * Logs the outcome of a vault operation. Failures of the audit backend itself are logged and
     * swallowed so they never change the result of the operation being audited.
     *
     * @param type        Event type ("vault", "container", "backup").
     * @param action      The operation (e.g. "open", "update_container").
     * @param outcome     {@link #SUCCESS} or {@link #FAILURE}.
     * @param vault       Path of the vault file involved.
     * @param containerId Container id, if the operation targets one.
     * @param errorKind   Error kind name for failures.
     * @param errorMessage Error message for failures.
     * @param data        Optional extra context. Must not contain secrets.
     */
    public void logVaultEvent(
            String type,
            String action,
            String outcome,
            @Nullable Path vault,
            @Nullable Integer containerId,
            @Nullable String errorKind,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .vault(vault != null ? vault.toString() : null)
                    .containerId(containerId)
                    .errorKind(errorKind)
                    .errorMessage(errorMessage)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    public void success(String type, String action, @Nullable Path vault, @Nullable Integer containerId) {
        logVaultEvent(type, action, SUCCESS, vault, containerId, null, null, null);
    }

    public void failure(String type, String action, @Nullable Path vault, @Nullable Integer containerId,
                        String errorKind, String errorMessage) {
        logVaultEvent(type, action, FAILURE, vault, containerId, errorKind, errorMessage, null);
    }
}
