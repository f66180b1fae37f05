package tech.yump.securebox.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.securebox.backup.BackupGateway;
import tech.yump.securebox.backup.CloudCredentials;
import tech.yump.securebox.backup.CloudToken;
import tech.yump.securebox.crypto.IntegrityException;
import tech.yump.securebox.crypto.KeyMaterial;
import tech.yump.securebox.storage.ContainerRecord;
import tech.yump.securebox.storage.CorruptFormatException;
import tech.yump.securebox.storage.StorageException;
import tech.yump.securebox.storage.VaultFile;

/**
 * An unlocked vault session over one vault file.
 * <p>
 * Every mutating operation builds the candidate state, writes it atomically and only then swaps it
 * into memory, so a failed write leaves both the file and the session as they were. Containers
 * are re-encrypted only when they change; password change and key rotation re-encrypt all of them.
 * <p>
 * Not thread-safe. One session owns the file while it is unlocked.
 */
@Slf4j
public class Vault implements AutoCloseable {

  static final String CREDENTIALS_NAME = "cloud-credentials";
  static final String TOKEN_NAME = "cloud-token";
  static final String PREVIOUS_COPY_SUFFIX = ".old";
  static final String DOWNLOAD_SUFFIX = ".download";

  private static final String TYPE_VAULT = "vault";
  private static final String TYPE_CONTAINER = "container";
  private static final String TYPE_BACKUP = "backup";

  private final Path path;
  private final VaultContext context;

  private char[] password;
  private KeyMaterial key;
  private Map<Integer, Container> containers;
  private Map<Integer, ContainerRecord> records;
  private int nextId;
  private boolean locked;

  /**
   * @param persistedIds Every id in the vault file, including records that did not verify. New ids
   *                     are allocated above all of them.
   */
  Vault(Path path, char[] password, KeyMaterial key, Map<Integer, Container> containers,
      Map<Integer, ContainerRecord> records, Collection<Integer> persistedIds, VaultContext context) {
    this.path = path;
    this.password = password.clone();
    this.key = key;
    this.containers = new LinkedHashMap<>(containers);
    this.records = new LinkedHashMap<>(records);
    this.context = context;
    this.nextId = nextIdAfter(persistedIds, nextIdAfter(containers.keySet(), 1));
  }

  public Path getPath() {
    return path;
  }

  public boolean isLocked() {
    return locked;
  }

  /**
   * Adds a container under the next free id and persists the vault.
   *
   * @param name Label. A null or blank name becomes {@code Container <id>}.
   * @param data Secret text. Must not be null.
   * @return A copy of the stored container.
   */
  public Outcome<Container> addContainer(@Nullable String name, String data) {
    checkUnlocked();
    if (data == null) {
      return audited(TYPE_CONTAINER, "add_container", null, Outcome.failure(ErrorKind.INVALID_INPUT, "Container data must not be null."));
    }
    if (nextId > ContainerRecord.MAX_ID) {
      return audited(TYPE_CONTAINER, "add_container", null,
          Outcome.failure(ErrorKind.INVALID_INPUT, "No container ids left in this vault."));
    }
    // consumed even if the write fails, ids are never handed out twice in a session
    int id = nextId++;
    return run(TYPE_CONTAINER, "add_container", id, () -> {
      String effectiveName = name == null || name.isBlank() ? "Container " + id : name;
      Container container = new Container(id, effectiveName, data);

      Map<Integer, Container> nextContainers = new LinkedHashMap<>(containers);
      Map<Integer, ContainerRecord> nextRecords = new LinkedHashMap<>(records);
      nextContainers.put(id, container);
      nextRecords.put(id, context.containerCipher().encrypt(container, key));
      persist(key, nextContainers, nextRecords);
      log.info("Added container {}.", id);
      return Outcome.success(container.copy());
    });
  }

  /**
   * Returns the container as decrypted and verified when the session was opened. The file is not
   * re-read; use {@link #verifyIntegrity()} for a whole-vault check.
   */
  public Outcome<Container> getContainer(int id) {
    checkUnlocked();
    Container container = visible(id);
    if (container == null) {
      return audited(TYPE_CONTAINER, "get_container", id, notFound(id));
    }
    return audited(TYPE_CONTAINER, "get_container", id, Outcome.success(container.copy()));
  }

  /**
   * Visible containers in insertion order. Hidden system containers are never listed.
   */
  public List<Container> listContainers() {
    checkUnlocked();
    List<Container> result = new ArrayList<>();
    for (Container container : containers.values()) {
      if (!container.isHidden()) {
        result.add(container.copy());
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Changes the given fields, re-encrypts the container with a fresh IV and persists.
   *
   * @param name New name, or null to keep it. Must not be blank.
   * @param data New data, or null to keep it.
   */
  public Outcome<Container> updateContainer(int id, @Nullable String name, @Nullable String data) {
    checkUnlocked();
    Container existing = visible(id);
    if (existing == null) {
      return audited(TYPE_CONTAINER, "update_container", id, notFound(id));
    }
    if (name == null && data == null) {
      return audited(TYPE_CONTAINER, "update_container", id,
          Outcome.failure(ErrorKind.INVALID_INPUT, "Nothing to update: provide a name, data or both."));
    }
    if (name != null && name.isBlank()) {
      return audited(TYPE_CONTAINER, "update_container", id,
          Outcome.failure(ErrorKind.INVALID_INPUT, "Container name must not be blank."));
    }
    return run(TYPE_CONTAINER, "update_container", id, () -> {
      Container updated = existing.copy();
      if (name != null) {
        updated.setName(name);
      }
      if (data != null) {
        updated.setData(data);
      }
      Map<Integer, Container> nextContainers = new LinkedHashMap<>(containers);
      Map<Integer, ContainerRecord> nextRecords = new LinkedHashMap<>(records);
      nextContainers.put(id, updated);
      nextRecords.put(id, context.containerCipher().encrypt(updated, key));
      persist(key, nextContainers, nextRecords);
      log.info("Updated container {}.", id);
      return Outcome.success(updated.copy());
    });
  }

  /**
   * Removes the container and persists the smaller vault. The id is not reused in this session.
   */
  public Outcome<Void> removeContainer(int id) {
    checkUnlocked();
    if (visible(id) == null) {
      return audited(TYPE_CONTAINER, "remove_container", id, notFound(id));
    }
    return run(TYPE_CONTAINER, "remove_container", id, () -> {
      Map<Integer, Container> nextContainers = new LinkedHashMap<>(containers);
      Map<Integer, ContainerRecord> nextRecords = new LinkedHashMap<>(records);
      nextContainers.remove(id);
      nextRecords.remove(id);
      persist(key, nextContainers, nextRecords);
      log.info("Removed container {}.", id);
      return Outcome.done();
    });
  }

  /**
   * Re-reads the vault file and checks the header MAC and every record MAC against the session key.
   * Containers held by the session but absent from the file are reported as
   * {@link IntegrityReport.Status#MISSING}.
   */
  public Outcome<IntegrityReport> verifyIntegrity() {
    checkUnlocked();
    return run(TYPE_VAULT, "verify_integrity", null, () -> {
      Optional<VaultFile> file = context.store().read(path);
      if (file.isEmpty()) {
        return Outcome.failure(ErrorKind.NOT_FOUND, "Vault file no longer exists: " + path);
      }
      VaultCodec.Inspection inspection = context.codec().inspect(file.get(), key, password);

      Map<Integer, IntegrityReport.ContainerCheck> checks = new LinkedHashMap<>(inspection.report().containers());
      for (Integer id : containers.keySet()) {
        if (!checks.containsKey(id)) {
          checks.put(id, new IntegrityReport.ContainerCheck(id, IntegrityReport.Status.MISSING, "Container " + id + " is not in the vault file."));
        }
      }
      IntegrityReport report = new IntegrityReport(inspection.report().headerVerified(), checks);
      if (report.passed()) {
        log.info("Integrity verified for {} container records.", checks.size());
      } else {
        log.warn("Integrity check failed. Header verified: {}, failed containers: {}", report.headerVerified(), report.failedIds());
      }
      return Outcome.success(report);
    });
  }

  /**
   * Re-encrypts everything under key material derived from the new password and persists. On
   * failure the file and the session keep the old password.
   */
  public Outcome<Void> changeMasterPassword(char[] newPassword) {
    checkUnlocked();
    return run(TYPE_VAULT, "change_password", null, () -> {
      KeyMaterial.requirePassword(newPassword);
      rotate(newPassword.clone());
      log.info("Master password changed.");
      return Outcome.done();
    });
  }

  /**
   * Issues a fresh salt, IV and keys for the current password and re-encrypts everything.
   */
  public Outcome<Void> regenerateKeys() {
    checkUnlocked();
    return run(TYPE_VAULT, "regenerate_keys", null, () -> {
      rotate(password);
      log.info("Vault keys regenerated.");
      return Outcome.done();
    });
  }

  /**
   * Stores backup credentials and/or a session token in the hidden containers and persists.
   * A null argument leaves the stored value unchanged.
   */
  public Outcome<Void> setCloudCredentials(@Nullable CloudCredentials credentials, @Nullable CloudToken token) {
    checkUnlocked();
    if (credentials == null && token == null) {
      return audited(TYPE_BACKUP, "set_credentials", null,
          Outcome.failure(ErrorKind.INVALID_INPUT, "Provide credentials, a token or both."));
    }
    return run(TYPE_BACKUP, "set_credentials", null, () -> {
      Map<Integer, Container> nextContainers = new LinkedHashMap<>(containers);
      Map<Integer, ContainerRecord> nextRecords = new LinkedHashMap<>(records);
      if (credentials != null) {
        putHidden(nextContainers, nextRecords, Container.CREDENTIALS_ID, CREDENTIALS_NAME, toJson(credentials));
      }
      if (token != null) {
        putHidden(nextContainers, nextRecords, Container.TOKEN_ID, TOKEN_NAME, toJson(token));
      }
      persist(key, nextContainers, nextRecords);
      log.info("Stored cloud {}.", credentials != null && token != null ? "credentials and token" : credentials != null ? "credentials" : "token");
      return Outcome.done();
    });
  }

  /**
   * Clears the stored session token. Credentials stay.
   */
  public Outcome<Void> signOut() {
    checkUnlocked();
    return run(TYPE_BACKUP, "sign_out", null, () -> {
      if (!containers.containsKey(Container.TOKEN_ID)) {
        log.debug("No cloud token stored, nothing to sign out of.");
        return Outcome.done();
      }
      Map<Integer, Container> nextContainers = new LinkedHashMap<>(containers);
      Map<Integer, ContainerRecord> nextRecords = new LinkedHashMap<>(records);
      nextContainers.remove(Container.TOKEN_ID);
      nextRecords.remove(Container.TOKEN_ID);
      persist(key, nextContainers, nextRecords);
      log.info("Signed out: cloud token removed.");
      return Outcome.done();
    });
  }

  /**
   * Uploads the persisted (encrypted) vault file as {@code <file-name><remote-suffix>}.
   */
  public Outcome<Void> uploadBackup() {
    checkUnlocked();
    return run(TYPE_BACKUP, "upload", null, () -> {
      Optional<CloudCredentials> credentials = storedCredentials();
      if (credentials.isEmpty()) {
        return noCredentials();
      }
      if (!context.store().exists(path)) {
        return Outcome.failure(ErrorKind.NOT_FOUND, "Vault file no longer exists: " + path);
      }
      try (BackupGateway gateway = context.backupGatewayFactory().create(credentials.get(), storedToken().orElse(null))) {
        if (!gateway.upload(path, remoteName())) {
          return Outcome.failure(ErrorKind.BACKUP_TRANSPORT, "Upload of " + remoteName() + " was not accepted.");
        }
      }
      return Outcome.done();
    });
  }

  /**
   * Downloads the remote backup beside the vault file and opens it with the session password. Only
   * if that succeeds does it replace the local file (which is kept as {@code <file-name>.old}) and
   * the session state. Any failure leaves the local file and session untouched.
   */
  public Outcome<Void> downloadBackup() {
    checkUnlocked();
    return run(TYPE_BACKUP, "download", null, () -> {
      Optional<CloudCredentials> credentials = storedCredentials();
      if (credentials.isEmpty()) {
        return noCredentials();
      }
      Path candidate = sibling(DOWNLOAD_SUFFIX);
      try (BackupGateway gateway = context.backupGatewayFactory().create(credentials.get(), storedToken().orElse(null))) {
        if (!gateway.download(remoteName(), candidate)) {
          discard(candidate);
          return Outcome.failure(ErrorKind.NOT_FOUND, "No backup named " + remoteName() + " found in remote storage.");
        }
      } catch (RuntimeException e) {
        discard(candidate);
        throw e;
      }

      VaultCodec.Unlocked downloaded;
      try {
        VaultFile file = context.store().read(candidate)
            .orElseThrow(() -> new CorruptFormatException("Downloaded backup is empty."));
        downloaded = context.codec().unlock(file, password);
      } catch (IntegrityException e) {
        discard(candidate);
        return Outcome.failure(ErrorKind.AUTH, "Downloaded backup could not be opened with the current password: "
            + VaultService.AUTH_FAILURE_MESSAGE);
      } catch (RuntimeException e) {
        discard(candidate);
        throw e;
      }

      try {
        context.store().promote(candidate, path, sibling(PREVIOUS_COPY_SUFFIX));
      } catch (RuntimeException e) {
        downloaded.key().destroy();
        discard(candidate);
        throw e;
      }

      KeyMaterial previous = key;
      key = downloaded.key();
      containers = downloaded.containers();
      records = downloaded.records();
      nextId = nextIdAfter(containers.keySet(), nextId);
      previous.destroy();
      log.info("Backup downloaded and loaded ({} containers). Previous file kept as {}.", containers.size(), sibling(PREVIOUS_COPY_SUFFIX));
      return Outcome.done();
    });
  }

  /**
   * Deletes the remote backup object.
   */
  public Outcome<Void> deleteBackup() {
    checkUnlocked();
    return run(TYPE_BACKUP, "delete", null, () -> {
      Optional<CloudCredentials> credentials = storedCredentials();
      if (credentials.isEmpty()) {
        return noCredentials();
      }
      try (BackupGateway gateway = context.backupGatewayFactory().create(credentials.get(), storedToken().orElse(null))) {
        if (!gateway.delete(remoteName())) {
          return Outcome.failure(ErrorKind.NOT_FOUND, "No backup named " + remoteName() + " found in remote storage.");
        }
      }
      return Outcome.done();
    });
  }

  public String remoteName() {
    return path.getFileName().toString() + context.remoteSuffix();
  }

  /**
   * Wipes the password and keys and drops the plaintext containers. Idempotent.
   */
  public void lock() {
    if (locked) {
      return;
    }
    Arrays.fill(password, '\0');
    key.destroy();
    containers = Collections.emptyMap();
    records = Collections.emptyMap();
    locked = true;
    log.debug("Vault session for {} locked.", path);
    context.audit().success(TYPE_VAULT, "lock", path, null);
  }

  @Override
  public void close() {
    lock();
  }

  private void rotate(char[] nextPassword) {
    KeyMaterial nextKey = KeyMaterial.generate(nextPassword, context.kdfIterations());
    Map<Integer, ContainerRecord> nextRecords = new LinkedHashMap<>();
    try {
      for (Container container : containers.values()) {
        nextRecords.put(container.getId(), context.containerCipher().encrypt(container, nextKey));
      }
      persist(nextKey, containers, nextRecords);
    } catch (RuntimeException e) {
      nextKey.destroy();
      if (nextPassword != password) {
        Arrays.fill(nextPassword, '\0');
      }
      throw e;
    }
    KeyMaterial previous = key;
    key = nextKey;
    previous.destroy();
    if (nextPassword != password) {
      Arrays.fill(password, '\0');
      password = nextPassword;
    }
  }

  /**
   * Writes the candidate state and, once the write succeeded, makes it the session state.
   */
  private void persist(KeyMaterial candidateKey, Map<Integer, Container> candidateContainers,
      Map<Integer, ContainerRecord> candidateRecords) {
    VaultFile file = context.codec().encode(candidateKey, candidateRecords.values());
    context.store().write(path, file);
    containers = candidateContainers;
    records = candidateRecords;
  }

  private void putHidden(Map<Integer, Container> nextContainers, Map<Integer, ContainerRecord> nextRecords,
      int id, String name, String data) {
    Container hidden = new Container(id, name, data);
    nextContainers.put(id, hidden);
    nextRecords.put(id, context.containerCipher().encrypt(hidden, key));
  }

  private Optional<CloudCredentials> storedCredentials() {
    return readHidden(Container.CREDENTIALS_ID, CloudCredentials.class);
  }

  private Optional<CloudToken> storedToken() {
    return readHidden(Container.TOKEN_ID, CloudToken.class);
  }

  private <T> Optional<T> readHidden(int id, Class<T> type) {
    Container hidden = containers.get(id);
    if (hidden == null || hidden.getData().isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(context.objectMapper().readValue(hidden.getData(), type));
    } catch (JsonProcessingException e) {
      throw new CorruptFormatException("Stored " + hidden.getName() + " could not be parsed.", e);
    }
  }

  private String toJson(Object value) {
    try {
      return context.objectMapper().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Could not serialize " + value.getClass().getSimpleName() + ".", e);
    }
  }

  @Nullable
  private Container visible(int id) {
    Container container = containers.get(id);
    return container == null || container.isHidden() ? null : container;
  }

  private Path sibling(String suffix) {
    return path.resolveSibling(path.getFileName().toString() + suffix);
  }

  private void discard(Path candidate) {
    try {
      context.store().deleteIfExists(candidate);
    } catch (StorageException e) {
      log.warn("Could not remove downloaded candidate {}: {}", candidate, e.getMessage());
    }
  }

  private <T> Outcome<T> run(String type, String action, @Nullable Integer containerId, Supplier<Outcome<T>> body) {
    return audited(type, action, containerId, Failures.capture(action, body));
  }

  private <T> Outcome<T> audited(String type, String action, @Nullable Integer containerId, Outcome<T> outcome) {
    if (outcome.isSuccess()) {
      context.audit().success(type, action, path, containerId);
    } else {
      context.audit().failure(type, action, path, containerId, outcome.error().kind().name(), outcome.error().message());
    }
    return outcome;
  }

  private void checkUnlocked() {
    if (locked) {
      throw new VaultLockedException("Vault session for " + path + " is locked.");
    }
  }

  private static <T> Outcome<T> notFound(int id) {
    return Outcome.failure(ErrorKind.NOT_FOUND, "No container with id " + id + ".");
  }

  private static <T> Outcome<T> noCredentials() {
    return Outcome.failure(ErrorKind.INVALID_INPUT, "No cloud credentials stored. Set them first with --set-credentials.");
  }

  private static int nextIdAfter(Iterable<Integer> ids, int floor) {
    int next = floor;
    for (int id : ids) {
      if (id >= next) {
        next = id + 1;
      }
    }
    return next;
  }
}
