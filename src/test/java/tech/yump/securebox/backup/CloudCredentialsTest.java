package tech.yump.securebox.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CloudCredentialsTest {

  @Test
  @DisplayName("The prefix is trimmed of slashes and used as a folder for object keys")
  void objectKey_WithPrefix() {
    CloudCredentials credentials = new CloudCredentials("id", "secret", "eu-west-1", "bucket", " /vaults/home/ ");

    assertThat(credentials.prefix()).isEqualTo("vaults/home");
    assertThat(credentials.objectKey("securebox.json.BAK")).isEqualTo("vaults/home/securebox.json.BAK");
  }

  @Test
  @DisplayName("Without a prefix the object key is the file name")
  void objectKey_NoPrefix() {
    CloudCredentials credentials = new CloudCredentials("id", "secret", "eu-west-1", "bucket", null);

    assertThat(credentials.objectKey("securebox.json.BAK")).isEqualTo("securebox.json.BAK");
  }

  @Test
  @DisplayName("Blank required fields are rejected")
  void blankField_Rejected() {
    assertThatThrownBy(() -> new CloudCredentials("id", " ", "eu-west-1", "bucket", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("secretAccessKey");
    assertThatThrownBy(() -> new CloudToken(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Secrets never appear in toString")
  void toString_MasksSecrets() {
    CloudCredentials credentials = new CloudCredentials("id", "very-secret", "eu-west-1", "bucket", null);

    assertThat(credentials.toString()).doesNotContain("very-secret").contains("bucket=bucket");
    assertThat(new CloudToken("session-abc").toString()).doesNotContain("session-abc");
  }

  @Test
  @DisplayName("Credentials are read from the JSON a user supplies")
  void readFromJson() throws Exception {
    String json = "{\"accessKeyId\":\"id\",\"secretAccessKey\":\"secret\",\"region\":\"us-east-1\",\"bucket\":\"b\"}";

    CloudCredentials credentials = new ObjectMapper().readValue(json, CloudCredentials.class);

    assertThat(credentials.region()).isEqualTo("us-east-1");
    assertThat(credentials.prefix()).isEmpty();
  }
}
