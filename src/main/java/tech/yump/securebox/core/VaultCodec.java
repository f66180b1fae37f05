package tech.yump.securebox.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.securebox.crypto.EncryptionService;
import tech.yump.securebox.crypto.IntegrityException;
import tech.yump.securebox.crypto.KeyMaterial;
import tech.yump.securebox.storage.ContainerRecord;
import tech.yump.securebox.storage.CorruptFormatException;
import tech.yump.securebox.storage.KeyHeader;
import tech.yump.securebox.storage.VaultFile;

/**
 * Maps between the persisted {@link VaultFile} and decrypted vault state.
 * <p>
 * Besides the per-container MACs the file carries a header MAC over the salt, IV, iteration count
 * and the (id, MAC) pair of every record sorted by id. It binds the record set together, so
 * dropping, duplicating or swapping in a record from another vault is detected, and it makes a
 * wrong password fail even for a vault without containers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VaultCodec {

  private static final byte[] HEADER_CONTEXT = "securebox/v1/header".getBytes(StandardCharsets.UTF_8);

  private final ContainerCipher containerCipher;
  private final EncryptionService encryptionService;

  /** Fully verified vault contents. */
  record Unlocked(KeyMaterial key, LinkedHashMap<Integer, Container> containers, LinkedHashMap<Integer, ContainerRecord> records) {}

  /** Lenient per-record check, used by integrity verification and recovery. */
  record Inspection(IntegrityReport report, LinkedHashMap<Integer, Container> verified, LinkedHashMap<Integer, ContainerRecord> records) {}

  /**
   * Builds the file for the given records (in the order given) under the vault key.
   */
  public VaultFile encode(KeyMaterial key, Collection<ContainerRecord> records) {
    List<ContainerRecord> ordered = new ArrayList<>(records);
    byte[] headerMac = headerMac(key, ordered);
    return new VaultFile(VaultFile.CURRENT_VERSION, KeyHeader.of(key), Base64.getEncoder().encodeToString(headerMac), ordered);
  }

  /**
   * Derives the vault key from the header parameters.
   *
   * @throws CorruptFormatException if the header salt, IV or iteration count is malformed.
   */
  public KeyMaterial deriveKey(VaultFile file, char[] password) {
    KeyHeader header = file.getKey();
    byte[] salt = header.decodeSalt();
    byte[] iv = header.decodeIv();
    int iterations = header.requireIterations();
    return KeyMaterial.derive(password, salt, iv, iterations);
  }

  /**
   * Strict unlock: the header MAC and every container must verify and decrypt.
   *
   * @throws IntegrityException     if any MAC fails (wrong password or tampering, not distinguished).
   * @throws CorruptFormatException if the file or a decrypted payload is malformed.
   */
  Unlocked unlock(VaultFile file, char[] password) {
    file.validate();
    KeyMaterial key = deriveKey(file, password);
    Map<String, KeyMaterial> foreignKeys = new HashMap<>();
    try {
      verifyHeader(file, key);
      LinkedHashMap<Integer, Container> containers = new LinkedHashMap<>();
      LinkedHashMap<Integer, ContainerRecord> records = new LinkedHashMap<>();
      for (ContainerRecord record : file.getContainers()) {
        KeyMaterial recordKey = keyFor(record, key, password, foreignKeys);
        Container container = containerCipher.decrypt(record, recordKey);
        containers.put(container.getId(), container);
        records.put(container.getId(), record);
      }
      log.debug("Unlocked {} container records.", records.size());
      return new Unlocked(key, containers, records);
    } catch (RuntimeException e) {
      key.destroy();
      throw e;
    } finally {
      foreignKeys.values().forEach(KeyMaterial::destroy);
    }
  }

  /**
   * Checks every record independently under the given key, never failing as a whole.
   */
  Inspection inspect(VaultFile file, KeyMaterial key, char[] password) {
    boolean headerVerified;
    try {
      verifyHeader(file, key);
      headerVerified = true;
    } catch (IntegrityException | CorruptFormatException e) {
      log.warn("Vault header did not verify: {}", e.getMessage());
      headerVerified = false;
    }

    Map<Integer, IntegrityReport.ContainerCheck> checks = new LinkedHashMap<>();
    LinkedHashMap<Integer, Container> verified = new LinkedHashMap<>();
    LinkedHashMap<Integer, ContainerRecord> records = new LinkedHashMap<>();
    Map<String, KeyMaterial> foreignKeys = new HashMap<>();
    try {
      for (ContainerRecord record : file.getContainers()) {
        int id = record.requireId();
        try {
          KeyMaterial recordKey = keyFor(record, key, password, foreignKeys);
          Container container = containerCipher.decrypt(record, recordKey);
          verified.put(id, container);
          records.put(id, record);
          checks.put(id, new IntegrityReport.ContainerCheck(id, IntegrityReport.Status.VERIFIED, "ok"));
        } catch (IntegrityException e) {
          log.warn("Container {} failed integrity verification.", id);
          checks.put(id, new IntegrityReport.ContainerCheck(id, IntegrityReport.Status.INTEGRITY_FAILED, e.getMessage()));
        } catch (CorruptFormatException | IllegalArgumentException e) {
          log.warn("Container {} is malformed: {}", id, e.getMessage());
          checks.put(id, new IntegrityReport.ContainerCheck(id, IntegrityReport.Status.MALFORMED, e.getMessage()));
        }
      }
    } finally {
      foreignKeys.values().forEach(KeyMaterial::destroy);
    }
    return new Inspection(new IntegrityReport(headerVerified, checks), verified, records);
  }

  /**
   * Decrypts a single record straight from a file, deriving a key from the record's own salt.
   */
  Container decryptSingle(VaultFile file, int id, char[] password) {
    ContainerRecord record = file.getContainers().stream()
        .filter(candidate -> candidate.requireId() == id)
        .findFirst()
        .orElse(null);
    if (record == null) {
      return null;
    }
    KeyMaterial key = KeyMaterial.derive(password, record.decodeSalt(), record.decodeIv(), file.getKey().requireIterations());
    try {
      return containerCipher.decrypt(record, key);
    } finally {
      key.destroy();
    }
  }

  /**
   * Verifies the header MAC over the parameters stored in the file, so an edited salt, IV or
   * iteration count fails even when the key itself came from elsewhere.
   */
  void verifyHeader(VaultFile file, KeyMaterial key) {
    byte[] expected = file.decodeMac();
    KeyHeader header = file.getKey();
    byte[][] parts = headerParts(header.decodeSalt(), header.decodeIv(), header.requireIterations(), file.getContainers());
    try {
      encryptionService.verifyMac(key.macKey(), expected, parts);
    } catch (IntegrityException e) {
      throw new IntegrityException("Integrity error: invalid vault MAC. The vault may have been tampered with.", e);
    }
  }

  private byte[] headerMac(KeyMaterial key, List<ContainerRecord> records) {
    return encryptionService.mac(key.macKey(), headerParts(key.getSalt(), key.getIv(), key.getIterations(), records));
  }

  private static byte[][] headerParts(byte[] salt, byte[] iv, int iterations, List<ContainerRecord> records) {
    List<ContainerRecord> sorted = new ArrayList<>(records);
    sorted.sort(Comparator.comparingInt(ContainerRecord::requireId));

    ByteBuffer params = ByteBuffer.allocate(Integer.BYTES * 2)
        .putInt(iterations)
        .putInt(sorted.size());
    byte[][] parts = new byte[4 + sorted.size() * 2][];
    parts[0] = HEADER_CONTEXT;
    parts[1] = salt;
    parts[2] = iv;
    parts[3] = params.array();
    int i = 4;
    for (ContainerRecord record : sorted) {
      parts[i++] = ContainerCipher.idBytes(record.requireId());
      parts[i++] = record.decodeMac();
    }
    return parts;
  }

  private static KeyMaterial keyFor(ContainerRecord record, KeyMaterial vaultKey, char[] password, Map<String, KeyMaterial> foreignKeys) {
    byte[] salt = record.decodeSalt();
    if (vaultKey.hasSalt(salt)) {
      return vaultKey;
    }
    String cacheKey = Base64.getEncoder().encodeToString(salt);
    KeyMaterial cached = foreignKeys.get(cacheKey);
    if (cached == null) {
      log.debug("Container {} uses its own salt, deriving a separate key.", record.getId());
      cached = KeyMaterial.derive(password, salt, record.decodeIv(), vaultKey.getIterations());
      foreignKeys.put(cacheKey, cached);
    }
    return cached;
  }
}
