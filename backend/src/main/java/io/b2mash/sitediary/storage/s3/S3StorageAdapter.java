package io.b2mash.sitediary.storage.s3;

import io.b2mash.sitediary.config.S3Config.S3Properties;
import io.b2mash.sitediary.storage.StorageException;
import io.b2mash.sitediary.storage.StorageService;
import io.b2mash.sitediary.storage.StoredFileNotFoundException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** S3 implementation of {@link StorageService}. All AWS SDK types are confined to this class. */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3")
public class S3StorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

  private final S3Client s3Client;
  private final String bucketName;
  private final String keyPrefix;

  public S3StorageAdapter(S3Client s3Client, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.bucketName = s3Properties.bucketName();
    this.keyPrefix = s3Properties.keyPrefix() != null ? s3Properties.keyPrefix() : "";
  }

  @Override
  public String store(String key, InputStream content, long contentLength, String contentType) {
    var putRequest =
        PutObjectRequest.builder()
            .bucket(bucketName)
            .key(objectKey(key))
            .contentType(contentType)
            .build();
    try {
      s3Client.putObject(putRequest, RequestBody.fromInputStream(content, contentLength));
      return key;
    } catch (SdkException e) {
      throw new StorageException("Failed to upload object " + key, e);
    }
  }

  @Override
  public byte[] load(String key) {
    var getRequest = GetObjectRequest.builder().bucket(bucketName).key(objectKey(key)).build();
    try (var response = s3Client.getObject(getRequest)) {
      return response.readAllBytes();
    } catch (NoSuchKeyException e) {
      throw new StoredFileNotFoundException(key);
    } catch (Exception e) {
      log.warn("Download failed for key: {}", key, e);
      throw new StorageException("Failed to download object " + key, e);
    }
  }

  @Override
  public boolean delete(String key) {
    var objectKey = objectKey(key);
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(objectKey).build());
    } catch (NoSuchKeyException e) {
      return false;
    } catch (SdkException e) {
      throw new StorageException("Failed to inspect object " + key, e);
    }
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucketName).key(objectKey).build());
      return true;
    } catch (SdkException e) {
      throw new StorageException("Failed to delete object " + key, e);
    }
  }

  private String objectKey(String key) {
    return keyPrefix + key;
  }
}
