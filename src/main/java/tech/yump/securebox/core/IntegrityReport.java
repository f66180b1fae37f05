package tech.yump.securebox.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of checking every persisted record against the session key.
 *
 * @param headerVerified True if the vault header MAC (salt, IV, iterations and all record MACs) verified.
 * @param containers     Per-container results keyed by id, in file order.
 */
public record IntegrityReport(boolean headerVerified, Map<Integer, ContainerCheck> containers) {

  public enum Status {
    VERIFIED,
    /** MAC mismatch: tampered record or wrong key. */
    INTEGRITY_FAILED,
    /** Record could not be decoded, or decrypted to an invalid payload after its MAC verified. */
    MALFORMED,
    /** Present in the unlocked session but absent from the persisted file. */
    MISSING
  }

  public record ContainerCheck(int id, Status status, String detail) {
    public boolean verified() {
      return status == Status.VERIFIED;
    }
  }

  public IntegrityReport {
    containers = Collections.unmodifiableMap(new LinkedHashMap<>(containers));
  }

  /**
   * Aggregate result: the header and every container verified.
   */
  public boolean passed() {
    return headerVerified && containers.values().stream().allMatch(ContainerCheck::verified);
  }

  public boolean verified(int id) {
    ContainerCheck check = containers.get(id);
    return check != null && check.verified();
  }

  public List<Integer> failedIds() {
    return containers.values().stream()
        .filter(check -> !check.verified())
        .map(ContainerCheck::id)
        .toList();
  }
}
