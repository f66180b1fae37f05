package tech.yump.securebox.backup;

import java.nio.file.Path;

/**
 * Moves the already encrypted vault file to and from a remote store. Implementations never see
 * plaintext.
 */
public interface BackupGateway extends AutoCloseable {

  /**
   * Uploads the local file under the given remote name, replacing any previous object.
   *
   * @return true once the object is stored.
   * @throws BackupTransportException if the transfer fails.
   */
  boolean upload(Path localFile, String remoteName);

  /**
   * Downloads the remote object into the target file.
   *
   * @return false if no such remote object exists.
   * @throws BackupTransportException if the transfer fails.
   */
  boolean download(String remoteName, Path targetFile);

  /**
   * @return false if no such remote object exists.
   * @throws BackupTransportException if the request fails.
   */
  boolean delete(String remoteName);

  @Override
  default void close() {
  }
}
