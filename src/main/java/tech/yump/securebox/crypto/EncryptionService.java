package tech.yump.securebox.crypto;

import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.NoSuchProviderException;
import java.security.Security;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.Mac;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.stereotype.Service;

/**
 * Encrypt-then-MAC primitives: AES-256-CBC for confidentiality and HMAC-SHA256 for integrity.
 * Callers always verify the tag with {@link #verifyMac} before calling {@link #decrypt}.
 */
@Slf4j
@Service
public class EncryptionService {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private static final String ALGORITHM = "AES/CBC/PKCS7Padding";
  private static final String MAC_ALGORITHM = "HmacSHA256";
  public static final int MAC_LENGTH_BYTE = 32;

  /**
   * Encrypts the plaintext with AES-256-CBC under the given key and IV.
   *
   * @param key       AES key. Must not be null.
   * @param iv        16-byte IV. Must never be reused with the same key for a different plaintext.
   * @param plaintext The bytes to encrypt. Cannot be null.
   * @return The ciphertext.
   * @throws EncryptionException If any cryptographic error occurs during encryption.
   */
  public byte[] encrypt(SecretKey key, byte[] iv, byte[] plaintext) {
    if (plaintext == null) {
      throw new EncryptionException("Plaintext cannot be null.");
    }
    requireIv(iv);
    log.trace("Attempting to encrypt {} bytes of data.", plaintext.length);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
      cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
      byte[] ciphertext = cipher.doFinal(plaintext);
      log.trace("Encryption successful, ciphertext length: {} bytes.", ciphertext.length);
      return ciphertext;
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException | NoSuchProviderException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Encryption failed: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to encrypt data.", e);
    }
  }

  /**
   * Decrypts AES-256-CBC ciphertext. Performs no authentication: the MAC must already have been
   * verified, so a padding failure here means a format bug rather than tampering.
   *
   * @throws EncryptionException If the ciphertext cannot be decrypted or unpadded.
   */
  public byte[] decrypt(SecretKey key, byte[] iv, byte[] ciphertext) {
    if (ciphertext == null || ciphertext.length == 0) {
      throw new EncryptionException("Invalid input: ciphertext is null or empty.");
    }
    requireIv(iv);
    log.trace("Attempting to decrypt {} bytes of ciphertext.", ciphertext.length);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM, BouncyCastleProvider.PROVIDER_NAME);
      cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(iv));
      return cipher.doFinal(ciphertext);
    } catch (BadPaddingException | IllegalBlockSizeException e) {
      log.error("Decryption failed after successful MAC verification: {}", e.getMessage());
      throw new EncryptionException("Failed to decrypt data: invalid padding or block size.", e);
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException | NoSuchProviderException |
             InvalidAlgorithmParameterException e) {
      log.error("Decryption failed due to other cryptographic error: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to decrypt data.", e);
    }
  }

  /**
   * Computes HMAC-SHA256 over the concatenation of the given parts.
   */
  public byte[] mac(SecretKey macKey, byte[]... parts) {
    try {
      Mac mac = Mac.getInstance(MAC_ALGORITHM);
      mac.init(macKey);
      for (byte[] part : parts) {
        mac.update(part);
      }
      return mac.doFinal();
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      log.error("MAC computation failed: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to compute MAC.", e);
    }
  }

  /**
   * Recomputes the MAC and compares it to the expected tag in constant time.
   *
   * @throws IntegrityException if the tags differ.
   */
  public void verifyMac(SecretKey macKey, byte[] expected, byte[]... parts) {
    byte[] computed = mac(macKey, parts);
    if (expected == null || !MessageDigest.isEqual(computed, expected)) {
      log.debug("MAC verification failed.");
      throw new IntegrityException("Invalid authentication tag. Data may be corrupt, tampered with, or the key is wrong.");
    }
  }

  private static void requireIv(byte[] iv) {
    if (iv == null || iv.length != KeyMaterial.IV_LENGTH_BYTE) {
      throw new EncryptionException("Invalid IV: expected " + KeyMaterial.IV_LENGTH_BYTE + " bytes.");
    }
  }

  /**
   * Custom runtime exception for encryption/decryption errors.
   */
  public static class EncryptionException extends RuntimeException {
    public EncryptionException(String message) {
      super(message);
    }
    public EncryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

}
