package tech.yump.securebox.core;

/**
 * Exception thrown when an operation is attempted on a {@link Vault} session that has already
 * been locked. This is a programming error, not an outcome.
 */
public class VaultLockedException extends IllegalStateException {
  public VaultLockedException(String message) {
    super(message);
  }
}
