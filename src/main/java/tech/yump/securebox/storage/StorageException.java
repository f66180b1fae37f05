package tech.yump.securebox.storage;

/**
 * Custom runtime exception for I/O errors while reading or writing the vault file.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
