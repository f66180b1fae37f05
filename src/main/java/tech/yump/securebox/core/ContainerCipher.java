package tech.yump.securebox.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.securebox.crypto.EncryptionService;
import tech.yump.securebox.crypto.IntegrityException;
import tech.yump.securebox.crypto.KeyMaterial;
import tech.yump.securebox.storage.ContainerRecord;
import tech.yump.securebox.storage.CorruptFormatException;

/**
 * Seals a {@link Container} into a {@link ContainerRecord} and opens it again.
 * <p>
 * The plaintext is the canonical JSON {@code {"name":..,"data":..}}. The MAC covers
 * {@code id || salt || iv || cipher}, so a record cannot be moved to another id or paired with
 * another IV without detection.
 */
@Slf4j
@Component
public class ContainerCipher {

  record Payload(String name, String data) {}

  private final EncryptionService encryptionService;
  private final ObjectMapper objectMapper;
  private final ObjectReader payloadReader;

  public ContainerCipher(EncryptionService encryptionService, ObjectMapper objectMapper) {
    this.encryptionService = encryptionService;
    this.objectMapper = objectMapper;
    this.payloadReader = objectMapper.readerFor(Payload.class)
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Encrypts the container under the key with a freshly drawn IV.
   */
  public ContainerRecord encrypt(Container container, KeyMaterial key) {
    byte[] plaintext;
    try {
      plaintext = objectMapper.writeValueAsBytes(new Payload(container.getName(), container.getData()));
    } catch (JsonProcessingException e) {
      throw new EncryptionService.EncryptionException("Failed to serialize container " + container.getId() + ".", e);
    }

    try {
      byte[] salt = key.getSalt();
      byte[] iv = KeyMaterial.randomBytes(KeyMaterial.IV_LENGTH_BYTE);
      byte[] cipher = encryptionService.encrypt(key.encryptionKey(), iv, plaintext);
      byte[] mac = encryptionService.mac(key.macKey(), idBytes(container.getId()), salt, iv, cipher);
      log.debug("Encrypted container {} ({} ciphertext bytes).", container.getId(), cipher.length);
      return ContainerRecord.of(container.getId(), cipher, mac, salt, iv);
    } finally {
      Arrays.fill(plaintext, (byte) 0);
    }
  }

  /**
   * Verifies the record's MAC and, only if it matches, decrypts it.
   *
   * @param record The persisted record.
   * @param key    Key material derived with the record's salt.
   * @return The plaintext container.
   * @throws IntegrityException     if the MAC does not verify. Nothing is decrypted.
   * @throws CorruptFormatException if the record is malformed, or the MAC verified but the
   *                                plaintext cannot be unpadded or parsed.
   */
  public Container decrypt(ContainerRecord record, KeyMaterial key) {
    int id = record.requireId();
    byte[] salt = record.decodeSalt();
    byte[] iv = record.decodeIv();
    byte[] mac = record.decodeMac();
    byte[] cipher = record.decodeCipher();

    if (!key.hasSalt(salt)) {
      throw new IllegalArgumentException("Key material was not derived with the salt of container " + id + ".");
    }

    try {
      encryptionService.verifyMac(key.macKey(), mac, idBytes(id), salt, iv, cipher);
    } catch (IntegrityException e) {
      throw new IntegrityException("Integrity error: invalid MAC for container " + id + ". The container may have been tampered with.", e);
    }

    byte[] plaintext;
    try {
      plaintext = encryptionService.decrypt(key.encryptionKey(), iv, cipher);
    } catch (EncryptionService.EncryptionException e) {
      throw new CorruptFormatException("Container " + id + " passed MAC verification but could not be decrypted.", e);
    }

    try {
      Payload payload = payloadReader.readValue(plaintext);
      if (payload == null || payload.name() == null || payload.data() == null) {
        throw new CorruptFormatException("Container " + id + " payload is missing 'name' or 'data'.");
      }
      log.debug("Decrypted container {}.", id);
      return new Container(id, payload.name(), payload.data());
    } catch (IOException e) {
      throw new CorruptFormatException("Container " + id + " payload is not valid JSON.", e);
    } finally {
      Arrays.fill(plaintext, (byte) 0);
    }
  }

  static byte[] idBytes(int id) {
    return ByteBuffer.allocate(Integer.BYTES).putInt(id).array();
  }
}
