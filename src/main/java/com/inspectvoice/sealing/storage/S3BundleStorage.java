package com.inspectvoice.sealing.storage;

import com.inspectvoice.sealing.util.AlertLogger;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.net.URI;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * S3-compatible archive store (AWS, MinIO, R2).
 */
@ApplicationScoped
@Named("s3-storage")
public class S3BundleStorage implements BundleStorage {

    private static final Logger LOG = Logger.getLogger(S3BundleStorage.class);
    private static final int PRECONDITION_FAILED = 412;

    @ConfigProperty(name = "app.storage.mode", defaultValue = "s3")
    String mode;

    @ConfigProperty(name = "s3.endpoint-url")
    Optional<String> endpointUrl;

    @ConfigProperty(name = "s3.aws.region", defaultValue = "us-east-1")
    String region;

    @ConfigProperty(name = "s3.aws.credentials.static-provider.access-key-id")
    Optional<String> accessKeyId;

    @ConfigProperty(name = "s3.aws.credentials.static-provider.secret-access-key")
    Optional<String> secretAccessKey;

    @ConfigProperty(name = "app.storage.bucket", defaultValue = "inspectvoice-exports")
    String bucketName;

    S3Client s3Client;

    @PostConstruct
    void init() {
        if ("in-memory".equalsIgnoreCase(mode)) {
            return;
        }
        S3ClientBuilder builder = S3Client.builder().region(Region.of(region));
        if (endpointUrl.isPresent() && !endpointUrl.get().isBlank()) {
            LOG.infof("Initializing S3 client for endpoint: %s", endpointUrl.get());
            builder.endpointOverride(URI.create(endpointUrl.get()))
                    .forcePathStyle(true); // Required for MinIO
        }
        if (accessKeyId.isPresent() && secretAccessKey.isPresent()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(accessKeyId.get(), secretAccessKey.get())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }
        s3Client = builder.build();
        LOG.infof("S3 bundle storage initialized for bucket: %s", bucketName);
    }

    @Override
    public void put(String objectKey, byte[] archive, Map<String, String> metadata) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(objectKey)
                    .contentType(CONTENT_TYPE)
                    .contentLength((long) archive.length)
                    .metadata(metadata)
                    .ifNoneMatch("*")
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(archive));
            LOG.debugf("Stored bundle archive: s3://%s/%s (%d bytes)", bucketName, objectKey, archive.length);
        } catch (S3Exception e) {
            if (e.statusCode() != PRECONDITION_FAILED) {
                throw new StorageException("Failed to store " + objectKey + " in bucket " + bucketName, e);
            }
            requireSameContent(objectKey, archive, e);
        } catch (Exception e) {
            throw new StorageException("Failed to store " + objectKey + " in bucket " + bucketName, e);
        }
    }

    /** An earlier attempt may have landed before its response was lost; identical bytes count as stored. */
    private void requireSameContent(String objectKey, byte[] archive, S3Exception conflict) {
        Optional<byte[]> existing = get(objectKey);
        if (existing.isPresent() && Arrays.equals(existing.get(), archive)) {
            LOG.infof("Bundle archive already stored by an earlier attempt: s3://%s/%s", bucketName, objectKey);
            return;
        }
        throw new StorageException("Object already exists with different content: " + objectKey, conflict);
    }

    @Override
    public Optional<byte[]> get(String objectKey) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .build();
        try (ResponseInputStream<GetObjectResponse> inputStream = s3Client.getObject(request)) {
            return Optional.of(inputStream.readAllBytes());
        } catch (NoSuchKeyException e) {
            LOG.debugf("Bundle archive not found: %s", objectKey);
            return Optional.empty();
        } catch (Exception e) {
            throw new StorageException("Failed to read " + objectKey + " from bucket " + bucketName, e);
        }
    }

    @Override
    public boolean isAccessible() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            return true;
        } catch (Exception e) {
            AlertLogger.storageAccessFailed("bundle-storage", "S3", e.getMessage());
            return false;
        }
    }
}
