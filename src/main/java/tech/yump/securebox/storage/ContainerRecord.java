package tech.yump.securebox.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Base64;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import tech.yump.securebox.crypto.EncryptionService;
import tech.yump.securebox.crypto.KeyMaterial;

/**
 * One encrypted container as stored in the vault file. Only the id is in the clear.
 *
 * <pre>
 * {
 *   "id": 3,
 *   "cipher": "BASE64_AES_CBC_CIPHERTEXT",
 *   "mac": "BASE64_HMAC_SHA256",
 *   "salt": "BASE64_32_BYTES",
 *   "iv": "BASE64_16_BYTES"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor // Needed for Jackson deserialization
@AllArgsConstructor
@JsonPropertyOrder({"id", "cipher", "mac", "salt", "iv"})
public class ContainerRecord {

  /** Largest id a record may carry; keeps {@code id + 1} from overflowing into the hidden range. */
  public static final int MAX_ID = Integer.MAX_VALUE - 1;

  @JsonProperty("id")
  private Integer id;

  @JsonProperty("cipher")
  private String cipherBase64;

  @JsonProperty("mac")
  private String macBase64;

  @JsonProperty("salt")
  private String saltBase64;

  @JsonProperty("iv")
  private String ivBase64;

  public static ContainerRecord of(int id, byte[] cipher, byte[] mac, byte[] salt, byte[] iv) {
    Base64.Encoder encoder = Base64.getEncoder();
    return new ContainerRecord(id, encoder.encodeToString(cipher), encoder.encodeToString(mac),
        encoder.encodeToString(salt), encoder.encodeToString(iv));
  }

  public int requireId() {
    if (id == null) {
      throw new CorruptFormatException("Container record is missing its id.");
    }
    return id;
  }

  public byte[] decodeCipher() {
    byte[] cipher = decode(cipherBase64, "cipher");
    if (cipher.length == 0 || cipher.length % KeyMaterial.IV_LENGTH_BYTE != 0) {
      throw new CorruptFormatException("Container " + id + ": ciphertext length " + cipher.length + " is not a positive multiple of the block size.");
    }
    return cipher;
  }

  public byte[] decodeMac() {
    return decodeExact(macBase64, "mac", EncryptionService.MAC_LENGTH_BYTE);
  }

  public byte[] decodeSalt() {
    return decodeExact(saltBase64, "salt", KeyMaterial.SALT_LENGTH_BYTE);
  }

  public byte[] decodeIv() {
    return decodeExact(ivBase64, "iv", KeyMaterial.IV_LENGTH_BYTE);
  }

  private byte[] decodeExact(String value, String field, int expectedLength) {
    byte[] bytes = decode(value, field);
    if (bytes.length != expectedLength) {
      throw new CorruptFormatException("Container " + id + ": field '" + field + "' must be " + expectedLength + " bytes but was " + bytes.length + ".");
    }
    return bytes;
  }

  private byte[] decode(String value, String field) {
    if (value == null) {
      throw new CorruptFormatException("Container " + id + ": field '" + field + "' is missing.");
    }
    try {
      return Base64.getDecoder().decode(value);
    } catch (IllegalArgumentException e) {
      throw new CorruptFormatException("Container " + id + ": field '" + field + "' is not valid Base64.", e);
    }
  }
}
