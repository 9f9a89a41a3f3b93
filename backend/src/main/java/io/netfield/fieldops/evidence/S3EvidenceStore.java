package io.netfield.fieldops.evidence;

import io.netfield.fieldops.config.S3Config.S3Properties;
import java.io.InputStream;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** S3 implementation of {@link EvidenceStore}. References have the form {@code s3://bucket/key}. */
@Component
@ConditionalOnProperty(name = "fieldops.evidence.provider", havingValue = "s3")
public class S3EvidenceStore implements EvidenceStore {

  private static final Logger log = LoggerFactory.getLogger(S3EvidenceStore.class);

  private final S3Client s3Client;
  private final String bucketName;

  public S3EvidenceStore(S3Client s3Client, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public String store(
      UUID ticketId, String filename, String contentType, InputStream content, long size) {
    String key = EvidenceKeys.keyFor(ticketId, filename);
    var putRequest =
        PutObjectRequest.builder().bucket(bucketName).key(key).contentType(contentType).build();
    s3Client.putObject(putRequest, RequestBody.fromInputStream(content, size));
    log.info("Stored {} bytes of evidence for ticket {} at {}", size, ticketId, key);
    return "s3://" + bucketName + "/" + key;
  }

  @Override
  public void delete(String reference) {
    String prefix = "s3://" + bucketName + "/";
    if (reference == null || !reference.startsWith(prefix)) {
      log.warn("Ignoring delete of evidence outside bucket {}: {}", bucketName, reference);
      return;
    }
    String key = reference.substring(prefix.length());
    try {
      var deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(key).build();
      s3Client.deleteObject(deleteRequest);
      log.info("Deleted evidence at {}", key);
    } catch (Exception e) {
      log.warn("Best-effort evidence deletion failed for key={}: {}", key, e.getMessage());
    }
  }
}
