package tech.yump.securebox.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Base64;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import tech.yump.securebox.crypto.KeyMaterial;

/**
 * Vault-level key parameters: the salt and IV the vault key was derived with, plus the PBKDF2
 * iteration count so the vault stays openable after the configured count changes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"salt", "iv", "iterations"})
public class KeyHeader {

  @JsonProperty("salt")
  private String saltBase64;

  @JsonProperty("iv")
  private String ivBase64;

  @JsonProperty("iterations")
  private Integer iterations;

  public static KeyHeader of(KeyMaterial key) {
    return new KeyHeader(
        Base64.getEncoder().encodeToString(key.getSalt()),
        Base64.getEncoder().encodeToString(key.getIv()),
        key.getIterations());
  }

  public byte[] decodeSalt() {
    return decodeExact(saltBase64, "salt", KeyMaterial.SALT_LENGTH_BYTE);
  }

  public byte[] decodeIv() {
    return decodeExact(ivBase64, "iv", KeyMaterial.IV_LENGTH_BYTE);
  }

  public int requireIterations() {
    if (iterations == null || iterations < 1 || iterations > KeyMaterial.MAX_ITERATIONS) {
      throw new CorruptFormatException("Vault key header has an invalid iteration count: " + iterations);
    }
    return iterations;
  }

  private static byte[] decodeExact(String value, String field, int expectedLength) {
    if (value == null) {
      throw new CorruptFormatException("Vault key header is missing '" + field + "'.");
    }
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(value);
    } catch (IllegalArgumentException e) {
      throw new CorruptFormatException("Vault key header field '" + field + "' is not valid Base64.", e);
    }
    if (bytes.length != expectedLength) {
      throw new CorruptFormatException("Vault key header field '" + field + "' must be " + expectedLength + " bytes but was " + bytes.length + ".");
    }
    return bytes;
  }
}
