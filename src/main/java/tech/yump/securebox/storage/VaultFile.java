package tech.yump.securebox.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import tech.yump.securebox.crypto.EncryptionService;

/**
 * Root of the persisted vault file.
 *
 * <pre>
 * {
 *   "version": 1,
 *   "key": { "salt": "...", "iv": "...", "iterations": 500000 },
 *   "mac": "BASE64_HEADER_MAC",
 *   "containers": [ { "id": 1, "cipher": "...", "mac": "...", "salt": "...", "iv": "..." } ]
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"version", "key", "mac", "containers"})
public class VaultFile {

  public static final int CURRENT_VERSION = 1;

  @JsonProperty("version")
  private Integer version;

  @JsonProperty("key")
  private KeyHeader key;

  @JsonProperty("mac")
  private String macBase64;

  @JsonProperty("containers")
  private List<ContainerRecord> containers = new ArrayList<>();

  /**
   * Checks the structure that every operation relies on. Byte field lengths are checked when the
   * fields are decoded.
   *
   * @throws CorruptFormatException if the file does not match the schema.
   */
  public void validate() {
    if (version == null || version != CURRENT_VERSION) {
      throw new CorruptFormatException("Unsupported vault file version: " + version);
    }
    if (key == null) {
      throw new CorruptFormatException("Vault file is missing the 'key' section.");
    }
    if (macBase64 == null) {
      throw new CorruptFormatException("Vault file is missing the header 'mac'.");
    }
    if (containers == null) {
      throw new CorruptFormatException("Vault file is missing the 'containers' list.");
    }
    Set<Integer> seen = new HashSet<>();
    for (ContainerRecord record : containers) {
      if (record == null) {
        throw new CorruptFormatException("Vault file contains a null container record.");
      }
      if (record.requireId() > ContainerRecord.MAX_ID) {
        throw new CorruptFormatException("Vault file contains out-of-range container id " + record.getId() + ".");
      }
      if (!seen.add(record.getId())) {
        throw new CorruptFormatException("Vault file contains duplicate container id " + record.getId() + ".");
      }
    }
  }

  public byte[] decodeMac() {
    if (macBase64 == null) {
      throw new CorruptFormatException("Vault file is missing the header 'mac'.");
    }
    byte[] mac;
    try {
      mac = Base64.getDecoder().decode(macBase64);
    } catch (IllegalArgumentException e) {
      throw new CorruptFormatException("Vault header MAC is not valid Base64.", e);
    }
    if (mac.length != EncryptionService.MAC_LENGTH_BYTE) {
      throw new CorruptFormatException("Vault header MAC must be " + EncryptionService.MAC_LENGTH_BYTE + " bytes.");
    }
    return mac;
  }
}
