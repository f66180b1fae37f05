package tech.yump.securebox.core;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import tech.yump.securebox.backup.BackupTransportException;
import tech.yump.securebox.crypto.EncryptionService;
import tech.yump.securebox.crypto.IntegrityException;
import tech.yump.securebox.storage.CorruptFormatException;
import tech.yump.securebox.storage.StorageException;

/**
 * Turns the typed exceptions of the lower layers into {@link Outcome} failures at the API boundary.
 * Anything else (programming errors, {@link VaultLockedException}) propagates.
 */
@Slf4j
final class Failures {

  private Failures() {
  }

  static <T> Outcome<T> capture(String action, Supplier<Outcome<T>> body) {
    try {
      return body.get();
    } catch (IntegrityException e) {
      log.warn("{} failed integrity verification: {}", action, e.getMessage());
      return Outcome.failure(ErrorKind.INTEGRITY, e.getMessage());
    } catch (CorruptFormatException e) {
      log.warn("{} failed on malformed data: {}", action, e.getMessage());
      return Outcome.failure(ErrorKind.CORRUPT_FORMAT, e.getMessage());
    } catch (StorageException e) {
      log.error("{} failed on storage: {}", action, e.getMessage());
      return Outcome.failure(ErrorKind.STORAGE, e.getMessage());
    } catch (BackupTransportException e) {
      log.error("{} failed on backup transport: {}", action, e.getMessage());
      return Outcome.failure(ErrorKind.BACKUP_TRANSPORT, e.getMessage());
    } catch (EncryptionService.EncryptionException e) {
      log.error("{} failed in a cryptographic primitive: {}", action, e.getMessage(), e);
      return Outcome.failure(ErrorKind.CRYPTO, e.getMessage());
    } catch (IllegalArgumentException e) {
      log.warn("{} rejected its input: {}", action, e.getMessage());
      return Outcome.failure(ErrorKind.INVALID_INPUT, e.getMessage());
    }
  }
}
