package tech.yump.securebox.crypto;

/**
 * Thrown when an authentication tag does not verify. No decryption has been attempted when this
 * is raised.
 */
public class IntegrityException extends RuntimeException {

  public IntegrityException(String message) {
    super(message);
  }

  public IntegrityException(String message, Throwable cause) {
    super(message, cause);
  }
}
