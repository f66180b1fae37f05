package tech.yump.securebox.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry for a vault operation. Serialized as one JSON object per line.
 * <p>
 * Never carries passwords, keys, container names or container data.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // "vault", "container", "backup"
        String action,          // e.g. "open", "add_container", "upload"
        String outcome,         // "success" or "failure"
        String vault,           // vault file path
        Integer containerId,
        String errorKind,
        String errorMessage,
        Map<String, Object> data
) {
}
