package tech.yump.securebox.core;

/**
 * What went wrong, so callers can branch without catching exceptions.
 */
public enum ErrorKind {
  /** The master password does not unlock the vault (or the vault was tampered with; the two are not distinguished). */
  AUTH,
  /** A specific container failed MAC verification under an otherwise correct key. */
  INTEGRITY,
  /** No container with the requested id, or no vault file at the requested path. */
  NOT_FOUND,
  /** The persisted file does not match the vault schema. */
  CORRUPT_FORMAT,
  /** The backup gateway failed. Local state is untouched. */
  BACKUP_TRANSPORT,
  ALREADY_EXISTS,
  INVALID_INPUT,
  /** Local file I/O failed. */
  STORAGE,
  /** A cryptographic primitive failed unexpectedly (missing provider, broken JCE). */
  CRYPTO
}
