package tech.yump.securebox.backup;

/**
 * The backup transport failed (network, credentials, remote service). Local state is never
 * touched when this is thrown.
 */
public class BackupTransportException extends RuntimeException {

  public BackupTransportException(String message) {
    super(message);
  }

  public BackupTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
