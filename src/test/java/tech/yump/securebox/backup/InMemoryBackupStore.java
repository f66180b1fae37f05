package tech.yump.securebox.backup;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Test double for the remote store: keeps uploaded objects in memory and records the credentials
 * each gateway was created with.
 */
public class InMemoryBackupStore implements BackupGatewayFactory {

  private final Map<String, byte[]> objects = new HashMap<>();
  private CloudCredentials lastCredentials;
  private CloudToken lastToken;
  private boolean failing;

  public void failTransfers() {
    failing = true;
  }

  public Map<String, byte[]> objects() {
    return objects;
  }

  public CloudCredentials lastCredentials() {
    return lastCredentials;
  }

  public CloudToken lastToken() {
    return lastToken;
  }

  @Override
  public BackupGateway create(CloudCredentials credentials, CloudToken token) {
    lastCredentials = credentials;
    lastToken = token;
    return new BackupGateway() {
      @Override
      public boolean upload(Path localFile, String remoteName) {
        checkConnection();
        try {
          objects.put(remoteName, Files.readAllBytes(localFile));
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
        return true;
      }

      @Override
      public boolean download(String remoteName, Path targetFile) {
        checkConnection();
        byte[] content = objects.get(remoteName);
        if (content == null) {
          return false;
        }
        try {
          Files.write(targetFile, content);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
        return true;
      }

      @Override
      public boolean delete(String remoteName) {
        checkConnection();
        return objects.remove(remoteName) != null;
      }
    };
  }

  private void checkConnection() {
    if (failing) {
      throw new BackupTransportException("Connection refused");
    }
  }
}
