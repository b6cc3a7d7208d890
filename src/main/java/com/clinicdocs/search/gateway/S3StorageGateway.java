package com.clinicdocs.search.gateway;

import com.clinicdocs.search.exception.StorageGatewayException;
import com.clinicdocs.search.model.StorageLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.InputStream;

/**
 * S3-backed storage. A single PUT is atomic, so a failed upload never leaves a partial object.
 * Transient client-side failures are retried before being reported.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
public class S3StorageGateway implements StorageGateway {

    private final S3Client s3Client;
    private final String bucketName;

    public S3StorageGateway(S3Client s3Client,
                            @Value("${app.storage.container-name}") String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    @Retryable(retryFor = SdkClientException.class, notRecoverable = StorageGatewayException.class,
        maxAttempts = 3, backoff = @Backoff(delay = 500, multiplier = 2))
    public StorageLocation put(byte[] content, String suggestedName, String contentType) {
        String key = BlobNames.sanitize(suggestedName);
        log.debug("Uploading {} bytes to s3://{}/{}", content.length, bucketName, key);

        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(contentType)
            .contentLength((long) content.length)
            .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (S3Exception e) {
            throw new StorageGatewayException("S3 rejected upload of " + key + ": " + e.getMessage(), e);
        }

        String url = s3Client.utilities()
            .getUrl(GetUrlRequest.builder().bucket(bucketName).key(key).build())
            .toExternalForm();
        log.info("Stored blob {} in bucket {}", key, bucketName);
        return new StorageLocation(key, url, bucketName);
    }

    @Recover
    public StorageLocation recoverPut(SdkClientException e, byte[] content, String suggestedName, String contentType) {
        throw new StorageGatewayException("S3 upload of " + suggestedName + " failed after retries: " + e.getMessage(), e);
    }

    @Override
    public boolean delete(String blobName) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(blobName).build());
        } catch (NoSuchKeyException e) {
            log.warn("Blob {} not found in bucket {}, presumed already deleted", blobName, bucketName);
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                log.warn("Blob {} not found in bucket {}, presumed already deleted", blobName, bucketName);
                return false;
            }
            throw new StorageGatewayException("Could not inspect blob " + blobName, e);
        }

        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(blobName).build());
            log.info("Deleted blob {} from bucket {}", blobName, bucketName);
            return true;
        } catch (S3Exception | SdkClientException e) {
            throw new StorageGatewayException("Could not delete blob " + blobName, e);
        }
    }

    @Override
    public InputStream open(String blobName) {
        try {
            return s3Client.getObject(GetObjectRequest.builder().bucket(bucketName).key(blobName).build());
        } catch (NoSuchKeyException e) {
            throw new StorageGatewayException("Blob not found: " + blobName, e);
        } catch (S3Exception | SdkClientException e) {
            throw new StorageGatewayException("Could not read blob " + blobName, e);
        }
    }
}
