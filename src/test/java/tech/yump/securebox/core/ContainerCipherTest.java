package tech.yump.securebox.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.securebox.crypto.EncryptionService;
import tech.yump.securebox.crypto.IntegrityException;
import tech.yump.securebox.crypto.KeyMaterial;
import tech.yump.securebox.storage.ContainerRecord;
import tech.yump.securebox.storage.CorruptFormatException;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContainerCipherTest {

  private ContainerCipher containerCipher;
  private EncryptionService encryptionService;
  private KeyMaterial key;

  @BeforeEach
  void setUp() {
    encryptionService = new EncryptionService();
    containerCipher = new ContainerCipher(encryptionService, TestVaults.objectMapper());
    key = KeyMaterial.generate("P1".toCharArray(), TestVaults.ITERATIONS);
  }

  @Test
  @DisplayName("A sealed container opens to the same id, name and data")
  void encryptDecrypt_Success() {
    Container original = new Container(7, "bank", "secret1 éè \n multi-line");

    ContainerRecord record = containerCipher.encrypt(original, key);
    Container opened = containerCipher.decrypt(record, key);

    assertThat(opened).isEqualTo(original);
    assertThat(record.getId()).isEqualTo(7);
    assertThat(record.decodeSalt()).isEqualTo(key.getSalt());
  }

  @Test
  @DisplayName("Every encryption draws a fresh IV")
  void encrypt_FreshIvEachTime() {
    Container container = new Container(1, "a", "b");

    ContainerRecord first = containerCipher.encrypt(container, key);
    ContainerRecord second = containerCipher.encrypt(container, key);

    assertThat(first.getIvBase64()).isNotEqualTo(second.getIvBase64());
    assertThat(first.getCipherBase64()).isNotEqualTo(second.getCipherBase64());
  }

  @Test
  @DisplayName("A flipped bit in cipher, MAC or IV fails integrity without decrypting")
  void decrypt_Tampered_IntegrityException() {
    ContainerRecord record = containerCipher.encrypt(new Container(1, "bank", "secret1"), key);

    ContainerRecord badCipher = copy(record);
    badCipher.setCipherBase64(TestVaults.flipFirstBit(record.getCipherBase64()));
    ContainerRecord badMac = copy(record);
    badMac.setMacBase64(TestVaults.flipFirstBit(record.getMacBase64()));
    ContainerRecord badIv = copy(record);
    badIv.setIvBase64(TestVaults.flipFirstBit(record.getIvBase64()));

    assertThatThrownBy(() -> containerCipher.decrypt(badCipher, key))
        .isInstanceOf(IntegrityException.class)
        .hasMessageContaining("container 1");
    assertThatThrownBy(() -> containerCipher.decrypt(badMac, key)).isInstanceOf(IntegrityException.class);
    assertThatThrownBy(() -> containerCipher.decrypt(badIv, key)).isInstanceOf(IntegrityException.class);
  }

  @Test
  @DisplayName("A record moved to another id fails integrity")
  void decrypt_MovedToOtherId_IntegrityException() {
    ContainerRecord record = containerCipher.encrypt(new Container(1, "bank", "secret1"), key);
    record.setId(2);

    assertThatThrownBy(() -> containerCipher.decrypt(record, key)).isInstanceOf(IntegrityException.class);
  }

  @Test
  @DisplayName("A key derived from the wrong password fails integrity")
  void decrypt_WrongPassword_IntegrityException() {
    ContainerRecord record = containerCipher.encrypt(new Container(1, "bank", "secret1"), key);
    KeyMaterial wrong = KeyMaterial.derive("WRONG".toCharArray(), key.getSalt(), key.getIv(), TestVaults.ITERATIONS);

    assertThatThrownBy(() -> containerCipher.decrypt(record, wrong)).isInstanceOf(IntegrityException.class);
  }

  @Test
  @DisplayName("A payload that verifies but is not the expected JSON is a corrupt format")
  void decrypt_ValidMacInvalidPayload_CorruptFormat() {
    byte[] iv = KeyMaterial.randomBytes(KeyMaterial.IV_LENGTH_BYTE);
    byte[] cipher = encryptionService.encrypt(key.encryptionKey(), iv, "not json".getBytes());
    byte[] mac = encryptionService.mac(key.macKey(), ContainerCipher.idBytes(3), key.getSalt(), iv, cipher);
    ContainerRecord record = ContainerRecord.of(3, cipher, mac, key.getSalt(), iv);

    assertThatThrownBy(() -> containerCipher.decrypt(record, key))
        .isInstanceOf(CorruptFormatException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  @DisplayName("Malformed Base64 or wrong lengths are corrupt formats")
  void decrypt_Malformed_CorruptFormat() {
    ContainerRecord record = containerCipher.encrypt(new Container(1, "bank", "secret1"), key);
    record.setSaltBase64(Base64.getEncoder().encodeToString(new byte[8]));

    assertThatThrownBy(() -> containerCipher.decrypt(record, key)).isInstanceOf(CorruptFormatException.class);
  }

  private static ContainerRecord copy(ContainerRecord record) {
    return new ContainerRecord(record.getId(), record.getCipherBase64(), record.getMacBase64(),
        record.getSaltBase64(), record.getIvBase64());
  }
}
