package tech.yump.securebox.backup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Creates S3 gateways with static credentials taken from the vault rather than the default AWS
 * provider chain, so the backup account is whatever the vault owner stored.
 */
@Slf4j
@Component
public class S3BackupGatewayFactory implements BackupGatewayFactory {

  @Override
  public BackupGateway create(CloudCredentials credentials, @Nullable CloudToken token) {
    AwsCredentials awsCredentials = token == null
        ? AwsBasicCredentials.create(credentials.accessKeyId(), credentials.secretAccessKey())
        : AwsSessionCredentials.create(credentials.accessKeyId(), credentials.secretAccessKey(), token.sessionToken());

    try {
      S3Client s3 = S3Client.builder()
          .region(Region.of(credentials.region()))
          .credentialsProvider(StaticCredentialsProvider.create(awsCredentials))
          .httpClient(ApacheHttpClient.builder().build())
          .build();
      log.debug("Created S3 client for bucket {} in region {} (session token: {}).",
          credentials.bucket(), credentials.region(), token != null);
      return new S3BackupGateway(s3, credentials);
    } catch (SdkException e) {
      log.error("Failed to create S3 client: {}", e.getMessage(), e);
      throw new BackupTransportException("Could not connect to backup storage: " + e.getMessage(), e);
    }
  }
}
