package tech.yump.securebox.backup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * {@link BackupGateway} backed by an S3 bucket.
 */
@Slf4j
public class S3BackupGateway implements BackupGateway {

  private static final int HTTP_NOT_FOUND = 404;

  private final S3Client s3;
  private final CloudCredentials credentials;

  S3BackupGateway(S3Client s3, CloudCredentials credentials) {
    this.s3 = s3;
    this.credentials = credentials;
  }

  @Override
  public boolean upload(Path localFile, String remoteName) {
    String key = credentials.objectKey(remoteName);
    try {
      s3.putObject(PutObjectRequest.builder()
              .bucket(credentials.bucket())
              .key(key)
              .contentType("application/json")
              .build(),
          RequestBody.fromFile(localFile));
      log.info("Uploaded {} to s3://{}/{}", localFile, credentials.bucket(), key);
      return true;
    } catch (SdkException e) {
      log.error("Upload of {} to s3://{}/{} failed: {}", localFile, credentials.bucket(), key, e.getMessage(), e);
      throw new BackupTransportException("Upload failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean download(String remoteName, Path targetFile) {
    String key = credentials.objectKey(remoteName);
    GetObjectRequest request = GetObjectRequest.builder()
        .bucket(credentials.bucket())
        .key(key)
        .build();
    try (ResponseInputStream<GetObjectResponse> in = s3.getObject(request)) {
      Files.copy(in, targetFile, StandardCopyOption.REPLACE_EXISTING);
      log.info("Downloaded s3://{}/{} to {}", credentials.bucket(), key, targetFile);
      return true;
    } catch (NoSuchKeyException e) {
      log.warn("No backup found at s3://{}/{}", credentials.bucket(), key);
      return false;
    } catch (SdkException e) {
      log.error("Download of s3://{}/{} failed: {}", credentials.bucket(), key, e.getMessage(), e);
      throw new BackupTransportException("Download failed: " + e.getMessage(), e);
    } catch (IOException e) {
      log.error("Failed to write downloaded backup to {}: {}", targetFile, e.getMessage(), e);
      throw new BackupTransportException("Download failed: could not write " + targetFile, e);
    }
  }

  @Override
  public boolean delete(String remoteName) {
    String key = credentials.objectKey(remoteName);
    try {
      if (!exists(key)) {
        log.warn("No backup to delete at s3://{}/{}", credentials.bucket(), key);
        return false;
      }
      s3.deleteObject(DeleteObjectRequest.builder()
          .bucket(credentials.bucket())
          .key(key)
          .build());
      log.info("Deleted s3://{}/{}", credentials.bucket(), key);
      return true;
    } catch (SdkException e) {
      log.error("Delete of s3://{}/{} failed: {}", credentials.bucket(), key, e.getMessage(), e);
      throw new BackupTransportException("Delete failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    s3.close();
  }

  private boolean exists(String key) {
    try {
      s3.headObject(HeadObjectRequest.builder()
          .bucket(credentials.bucket())
          .key(key)
          .build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == HTTP_NOT_FOUND) {
        return false;
      }
      throw e;
    }
  }
}
