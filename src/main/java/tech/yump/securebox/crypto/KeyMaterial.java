package tech.yump.securebox.crypto;

import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import javax.security.auth.Destroyable;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

/**
 * Salt, vault-level IV and the keys derived from the master password.
 * <p>
 * PBKDF2-HMAC-SHA256 stretches the password into a 32-byte master key, which HKDF-SHA256 then
 * expands into two independent keys: one for AES-256-CBC and one for HMAC-SHA256. Only the salt,
 * the IV and the iteration count are ever persisted.
 */
@Slf4j
public final class KeyMaterial implements Destroyable {

  public static final int SALT_LENGTH_BYTE = 32;
  public static final int IV_LENGTH_BYTE = 16; // AES block size
  public static final int KEY_LENGTH_BYTE = 32; // AES-256 / HMAC-SHA256
  public static final int MAX_ITERATIONS = 10_000_000;

  private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
  private static final byte[] ENCRYPTION_KEY_INFO = "securebox/v1/aes-256-cbc".getBytes(StandardCharsets.UTF_8);
  private static final byte[] MAC_KEY_INFO = "securebox/v1/hmac-sha256".getBytes(StandardCharsets.UTF_8);
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final byte[] salt;
  private final byte[] iv;
  private final int iterations;
  private final byte[] encryptionKey;
  private final byte[] macKey;
  private volatile boolean destroyed = false;

  private KeyMaterial(byte[] salt, byte[] iv, int iterations, byte[] encryptionKey, byte[] macKey) {
    this.salt = salt;
    this.iv = iv;
    this.iterations = iterations;
    this.encryptionKey = encryptionKey;
    this.macKey = macKey;
  }

  /**
   * Draws a fresh salt and IV and derives the keys for the given password.
   *
   * @param password   The master password. Must not be null or empty.
   * @param iterations PBKDF2 iteration count.
   * @return New key material.
   * @throws IllegalArgumentException if the password is empty or the iteration count is out of range.
   */
  public static KeyMaterial generate(char[] password, int iterations) {
    byte[] salt = randomBytes(SALT_LENGTH_BYTE);
    byte[] iv = randomBytes(IV_LENGTH_BYTE);
    log.debug("Generated fresh salt ({} bytes) and IV ({} bytes).", salt.length, iv.length);
    return derive(password, salt, iv, iterations);
  }

  /**
   * Re-derives the keys from a password and persisted salt/IV. Deterministic for fixed inputs.
   *
   * @throws IllegalArgumentException if the password is empty, the salt or IV has the wrong length,
   *                                  or the iteration count is out of range.
   */
  public static KeyMaterial derive(char[] password, byte[] salt, byte[] iv, int iterations) {
    requirePassword(password);
    if (salt == null || salt.length != SALT_LENGTH_BYTE) {
      throw new IllegalArgumentException("Salt must be exactly " + SALT_LENGTH_BYTE + " bytes.");
    }
    if (iv == null || iv.length != IV_LENGTH_BYTE) {
      throw new IllegalArgumentException("IV must be exactly " + IV_LENGTH_BYTE + " bytes.");
    }
    if (iterations < 1 || iterations > MAX_ITERATIONS) {
      throw new IllegalArgumentException("KDF iteration count out of range: " + iterations);
    }

    long start = System.nanoTime();
    byte[] masterKey = pbkdf2(password, salt, iterations);
    try {
      byte[] encryptionKey = expand(masterKey, ENCRYPTION_KEY_INFO);
      byte[] macKey = expand(masterKey, MAC_KEY_INFO);
      log.debug("Derived vault keys with {} PBKDF2 iterations in {} ms.", iterations, (System.nanoTime() - start) / 1_000_000);
      return new KeyMaterial(salt.clone(), iv.clone(), iterations, encryptionKey, macKey);
    } finally {
      Arrays.fill(masterKey, (byte) 0);
    }
  }

  /**
   * Rejects a null or empty password before any cryptographic work is done.
   */
  public static void requirePassword(char[] password) {
    if (password == null || password.length == 0) {
      throw new IllegalArgumentException("Master password cannot be null or empty.");
    }
  }

  public static byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    SECURE_RANDOM.nextBytes(bytes);
    return bytes;
  }

  public byte[] getSalt() {
    return salt.clone();
  }

  public byte[] getIv() {
    return iv.clone();
  }

  public int getIterations() {
    return iterations;
  }

  /**
   * True if this material was derived with the given salt, i.e. it can open records sealed with it.
   */
  public boolean hasSalt(byte[] otherSalt) {
    return Arrays.equals(salt, otherSalt);
  }

  public SecretKey encryptionKey() {
    checkNotDestroyed();
    return new SecretKeySpec(encryptionKey, "AES");
  }

  public SecretKey macKey() {
    checkNotDestroyed();
    return new SecretKeySpec(macKey, "HmacSHA256");
  }

  @Override
  public void destroy() {
    Arrays.fill(encryptionKey, (byte) 0);
    Arrays.fill(macKey, (byte) 0);
    destroyed = true;
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public String toString() {
    return "KeyMaterial{iterations=" + iterations + ", destroyed=" + destroyed + "}";
  }

  private void checkNotDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("Key material has been destroyed.");
    }
  }

  private static byte[] pbkdf2(char[] password, byte[] salt, int iterations) {
    PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, KEY_LENGTH_BYTE * 8);
    try {
      SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
      return factory.generateSecret(spec).getEncoded();
    } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
      log.error("Key derivation failed: {}", e.getMessage(), e);
      throw new EncryptionService.EncryptionException("Failed to derive key from master password.", e);
    } finally {
      spec.clearPassword();
    }
  }

  private static byte[] expand(byte[] masterKey, byte[] info) {
    HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
    hkdf.init(HKDFParameters.skipExtractParameters(masterKey, info));
    byte[] out = new byte[KEY_LENGTH_BYTE];
    hkdf.generateBytes(out, 0, out.length);
    return out;
  }
}
