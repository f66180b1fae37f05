package tech.yump.securebox.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import tech.yump.securebox.audit.AuditHelper;
import tech.yump.securebox.backup.BackupGatewayFactory;
import tech.yump.securebox.config.SecureBoxProperties;
import tech.yump.securebox.crypto.IntegrityException;
import tech.yump.securebox.crypto.KeyMaterial;
import tech.yump.securebox.storage.VaultFile;
import tech.yump.securebox.storage.VaultFileStore;

/**
 * Entry point for vault sessions: creates new vaults, opens existing ones (strictly or in recovery
 * mode) and reads single containers straight from a file.
 * <p>
 * A wrong password and a tampered file are reported the same way ({@link ErrorKind#AUTH}), so a
 * failed open says nothing about which records were modified.
 */
@Slf4j
@Service
public class VaultService {

  public static final String AUTH_FAILURE_MESSAGE = "password may be incorrect or the vault may have been tampered with.";

  private static final String TYPE_VAULT = "vault";

  private final VaultContext context;

  public VaultService(VaultCodec codec, ContainerCipher containerCipher, VaultFileStore store,
      BackupGatewayFactory backupGatewayFactory, AuditHelper audit, ObjectMapper objectMapper,
      SecureBoxProperties properties) {
    this.context = new VaultContext(codec, containerCipher, store, backupGatewayFactory, audit, objectMapper,
        properties.crypto().kdfIterations(), properties.backup().remoteSuffix());
  }

  /**
   * Creates an empty vault at the path, protected by the password.
   *
   * @return The unlocked session, or ALREADY_EXISTS if a file is already there.
   */
  public Outcome<Vault> create(char[] password, Path path) {
    return run("create", path, null, () -> {
      KeyMaterial.requirePassword(password);
      if (context.store().exists(path)) {
        return Outcome.failure(ErrorKind.ALREADY_EXISTS, "A vault already exists at " + path + ".");
      }
      KeyMaterial key = KeyMaterial.generate(password, context.kdfIterations());
      try {
        context.store().write(path, context.codec().encode(key, List.of()));
      } catch (RuntimeException e) {
        key.destroy();
        throw e;
      }
      log.info("Created new vault at {}", path);
      return Outcome.success(new Vault(path, password, key, Map.of(), Map.of(), List.of(), context));
    });
  }

  /**
   * Opens the vault, verifying the header MAC and every container before returning a session.
   */
  public Outcome<Vault> open(char[] password, Path path) {
    return run("open", path, null, () -> {
      KeyMaterial.requirePassword(password);
      Optional<VaultFile> file = context.store().read(path);
      if (file.isEmpty()) {
        return Outcome.failure(ErrorKind.NOT_FOUND, "No vault found at " + path + ".");
      }
      VaultCodec.Unlocked unlocked;
      try {
        unlocked = context.codec().unlock(file.get(), password);
      } catch (IntegrityException e) {
        log.warn("Failed to unlock vault {}: {}", path, e.getMessage());
        return authFailure();
      }
      log.info("Opened vault {} ({} container records).", path, unlocked.records().size());
      return Outcome.success(new Vault(path, password, unlocked.key(), unlocked.containers(), unlocked.records(),
          unlocked.records().keySet(), context));
    });
  }

  /**
   * Degraded unlock. Returns a session holding only the containers that verified, with a report of
   * the rest. Fails with AUTH when neither the header nor any container verifies.
   */
  public Outcome<RecoveredVault> recover(char[] password, Path path) {
    return run("recover", path, null, () -> {
      KeyMaterial.requirePassword(password);
      Optional<VaultFile> file = context.store().read(path);
      if (file.isEmpty()) {
        return Outcome.failure(ErrorKind.NOT_FOUND, "No vault found at " + path + ".");
      }
      KeyMaterial key = context.codec().deriveKey(file.get(), password);
      VaultCodec.Inspection inspection;
      try {
        inspection = context.codec().inspect(file.get(), key, password);
      } catch (RuntimeException e) {
        key.destroy();
        throw e;
      }
      IntegrityReport report = inspection.report();
      if (!report.headerVerified() && inspection.verified().isEmpty()) {
        key.destroy();
        log.warn("Recovery of {} found nothing that verifies.", path);
        return authFailure();
      }
      log.warn("Recovered vault {}: header verified {}, {} of {} containers verified.",
          path, report.headerVerified(), inspection.verified().size(), report.containers().size());
      Vault vault = new Vault(path, password, key, inspection.verified(), inspection.records(),
          inspection.report().containers().keySet(), context);
      return Outcome.success(new RecoveredVault(vault, report));
    });
  }

  /**
   * Reads and decrypts one container straight from the file, without unlocking or verifying the rest
   * of the vault. Weaker than {@link #open}: the header MAC is not checked.
   */
  public Outcome<Container> fetchContainer(char[] password, Path path, int id) {
    return run("fetch_container", path, id, () -> {
      KeyMaterial.requirePassword(password);
      if (id < 0) {
        return Outcome.failure(ErrorKind.NOT_FOUND, "No container with id " + id + ".");
      }
      Optional<VaultFile> file = context.store().read(path);
      if (file.isEmpty()) {
        return Outcome.failure(ErrorKind.NOT_FOUND, "No vault found at " + path + ".");
      }
      Container container;
      try {
        container = context.codec().decryptSingle(file.get(), id, password);
      } catch (IntegrityException e) {
        log.warn("Failed to decrypt container {} of {}: {}", id, path, e.getMessage());
        return authFailure();
      }
      if (container == null) {
        return Outcome.failure(ErrorKind.NOT_FOUND, "No container with id " + id + ".");
      }
      return Outcome.success(container);
    });
  }

  public boolean exists(Path path) {
    return context.store().exists(path);
  }

  private static <T> Outcome<T> authFailure() {
    return Outcome.failure(ErrorKind.AUTH, "Could not unlock vault: " + AUTH_FAILURE_MESSAGE);
  }

  private <T> Outcome<T> run(String action, Path path, @Nullable Integer containerId, Supplier<Outcome<T>> body) {
    Outcome<T> outcome = Failures.capture(action, body);
    if (outcome.isSuccess()) {
      context.audit().success(TYPE_VAULT, action, path, containerId);
    } else {
      context.audit().failure(TYPE_VAULT, action, path, containerId, outcome.error().kind().name(), outcome.error().message());
    }
    return outcome;
  }
}
