package tech.yump.securebox.crypto;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

class EncryptionServiceTest {

  private EncryptionService encryptionService;

  private SecretKey encryptionKey;
  private SecretKey macKey;
  private byte[] iv;
  private byte[] samplePlaintext;

  @BeforeEach
  void setUp() {
    encryptionService = new EncryptionService();

    SecureRandom random = new SecureRandom();
    byte[] keyBytes = new byte[32];
    random.nextBytes(keyBytes);
    encryptionKey = new SecretKeySpec(keyBytes, "AES");
    byte[] macKeyBytes = new byte[32];
    random.nextBytes(macKeyBytes);
    macKey = new SecretKeySpec(macKeyBytes, "HmacSHA256");
    iv = new byte[16];
    random.nextBytes(iv);

    samplePlaintext = "This is my secret data!".getBytes(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Encrypt then Decrypt should return original plaintext")
  void encryptDecrypt_RoundTrip_Success() {
    // Act
    byte[] ciphertext = encryptionService.encrypt(encryptionKey, iv, samplePlaintext);
    byte[] decrypted = encryptionService.decrypt(encryptionKey, iv, ciphertext);

    // Assert
    assertEquals(0, ciphertext.length % 16, "CBC ciphertext is a whole number of blocks");
    assertTrue(ciphertext.length > samplePlaintext.length, "Padding makes the ciphertext longer");
    assertArrayEquals(samplePlaintext, decrypted, "Decrypted data should match original plaintext");
  }

  @Test
  @DisplayName("Encrypting the same plaintext with different IVs gives different ciphertexts")
  void encrypt_DifferentIv_DifferentCiphertext() {
    byte[] otherIv = iv.clone();
    otherIv[0] ^= 0x01;

    byte[] first = encryptionService.encrypt(encryptionKey, iv, samplePlaintext);
    byte[] second = encryptionService.encrypt(encryptionKey, otherIv, samplePlaintext);

    assertFalse(java.util.Arrays.equals(first, second));
  }

  @Test
  @DisplayName("Encrypt should throw EncryptionException for null plaintext or bad IV")
  void encrypt_InvalidInput_Throws() {
    assertThrows(EncryptionService.EncryptionException.class,
        () -> encryptionService.encrypt(encryptionKey, iv, null));
    assertThrows(EncryptionService.EncryptionException.class,
        () -> encryptionService.encrypt(encryptionKey, new byte[12], samplePlaintext));
  }

  @Test
  @DisplayName("Decrypt with the wrong key fails on padding or yields garbage, never the plaintext")
  void decrypt_WrongKey_NeverReturnsPlaintext() {
    byte[] ciphertext = encryptionService.encrypt(encryptionKey, iv, samplePlaintext);
    byte[] otherKeyBytes = encryptionKey.getEncoded().clone();
    otherKeyBytes[0] ^= 0x01;
    SecretKey otherKey = new SecretKeySpec(otherKeyBytes, "AES");

    try {
      byte[] decrypted = encryptionService.decrypt(otherKey, iv, ciphertext);
      assertFalse(java.util.Arrays.equals(samplePlaintext, decrypted));
    } catch (EncryptionService.EncryptionException expected) {
      assertTrue(expected.getMessage().contains("Failed to decrypt"));
    }
  }

  @Test
  @DisplayName("Decrypt should throw EncryptionException for empty ciphertext")
  void decrypt_EmptyCiphertext_Throws() {
    assertThrows(EncryptionService.EncryptionException.class,
        () -> encryptionService.decrypt(encryptionKey, iv, new byte[0]));
  }

  @Test
  @DisplayName("verifyMac accepts the computed tag and rejects any flipped bit")
  void verifyMac_DetectsTampering() {
    byte[] ciphertext = encryptionService.encrypt(encryptionKey, iv, samplePlaintext);
    byte[] tag = encryptionService.mac(macKey, iv, ciphertext);

    assertEquals(EncryptionService.MAC_LENGTH_BYTE, tag.length);
    assertDoesNotThrow(() -> encryptionService.verifyMac(macKey, tag, iv, ciphertext));

    byte[] tamperedCiphertext = ciphertext.clone();
    tamperedCiphertext[tamperedCiphertext.length - 1] ^= 0x01;
    assertThrows(IntegrityException.class, () -> encryptionService.verifyMac(macKey, tag, iv, tamperedCiphertext));

    byte[] tamperedTag = tag.clone();
    tamperedTag[0] ^= 0x01;
    assertThrows(IntegrityException.class, () -> encryptionService.verifyMac(macKey, tamperedTag, iv, ciphertext));
    assertThrows(IntegrityException.class, () -> encryptionService.verifyMac(macKey, null, iv, ciphertext));
  }
}
