package tech.yump.securebox.backup;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credentials and location of the remote backup store. Kept encrypted inside the vault, in the
 * hidden credentials container.
 *
 * @param accessKeyId     Access key id.
 * @param secretAccessKey Secret access key. Never logged.
 * @param region          Region of the bucket, e.g. {@code eu-west-1}.
 * @param bucket          Bucket that receives the backups.
 * @param prefix          Optional key prefix ("folder") inside the bucket.
 */
public record CloudCredentials(
    @JsonProperty("accessKeyId") String accessKeyId,
    @JsonProperty("secretAccessKey") String secretAccessKey,
    @JsonProperty("region") String region,
    @JsonProperty("bucket") String bucket,
    @JsonProperty("prefix") String prefix) {

  public CloudCredentials {
    requireText(accessKeyId, "accessKeyId");
    requireText(secretAccessKey, "secretAccessKey");
    requireText(region, "region");
    requireText(bucket, "bucket");
    prefix = prefix == null ? "" : trimSlashes(prefix.trim());
  }

  /**
   * Object key for a file name, below the configured prefix.
   */
  public String objectKey(String fileName) {
    return prefix.isEmpty() ? fileName : prefix + "/" + fileName;
  }

  @Override
  public String toString() {
    return "CloudCredentials[accessKeyId=" + accessKeyId + ", secretAccessKey=******, region=" + region
        + ", bucket=" + bucket + ", prefix=" + prefix + "]";
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Cloud credentials field '" + field + "' must not be blank.");
    }
  }

  private static String trimSlashes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '/') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '/') {
      end--;
    }
    return value.substring(start, end);
  }
}
