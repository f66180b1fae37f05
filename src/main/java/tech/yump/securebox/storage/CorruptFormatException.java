package tech.yump.securebox.storage;

/**
 * The persisted vault (or a decrypted payload) does not match the expected schema: unparseable
 * JSON, missing fields, bad Base64 or byte fields of the wrong length.
 */
public class CorruptFormatException extends RuntimeException {

  public CorruptFormatException(String message) {
    super(message);
  }

  public CorruptFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
