package ai.pipestream.frames.storage;

import ai.pipestream.frames.exception.BlobStorageException;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * {@link BlobStore} backed by an S3 bucket (MinIO in development).
 * All keys are written under the configured key prefix.
 */
public class S3BlobStore implements BlobStore {

    private static final Logger LOG = Logger.getLogger(S3BlobStore.class);

    private final S3AsyncClient s3;
    private final String bucket;
    private final String keyPrefix;

    public S3BlobStore(S3AsyncClient s3, String bucket, String keyPrefix) {
        this.s3 = s3;
        this.bucket = bucket;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "" : trimSlashes(keyPrefix) + "/";
    }

    @Override
    public void put(String key, byte[] data, String contentType) {
        String objectKey = objectKey(key);
        try {
            s3.putObject(PutObjectRequest.builder()
                                    .bucket(bucket)
                                    .key(objectKey)
                                    .contentType(contentType)
                                    .contentLength((long) data.length)
                                    .build(),
                            AsyncRequestBody.fromBytes(data))
                    .join();
            LOG.debugf("Stored s3://%s/%s (bytes=%d)", bucket, objectKey, data.length);
        } catch (CompletionException e) {
            throw BlobStorageException.writeFailed(objectKey, unwrap(e));
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        String objectKey = objectKey(key);
        try {
            ResponseBytes<GetObjectResponse> bytes = s3.getObject(
                            GetObjectRequest.builder().bucket(bucket).key(objectKey).build(),
                            AsyncResponseTransformer.toBytes())
                    .join();
            return Optional.of(bytes.asByteArray());
        } catch (CompletionException e) {
            if (unwrap(e) instanceof NoSuchKeyException) {
                return Optional.empty();
            }
            throw BlobStorageException.readFailed(objectKey, unwrap(e));
        }
    }

    @Override
    public void delete(String key) {
        String objectKey = objectKey(key);
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(objectKey).build()).join();
        } catch (CompletionException e) {
            throw BlobStorageException.deleteFailed(objectKey, unwrap(e));
        }
    }

    @Override
    public int deletePrefix(String prefix) {
        String objectPrefix = objectKey(prefix);
        int removed = 0;
        String continuation = null;
        try {
            do {
                ListObjectsV2Response page = s3.listObjectsV2(ListObjectsV2Request.builder()
                                .bucket(bucket)
                                .prefix(objectPrefix)
                                .continuationToken(continuation)
                                .build())
                        .join();
                if (!page.contents().isEmpty()) {
                    List<ObjectIdentifier> ids = page.contents().stream()
                            .map(o -> ObjectIdentifier.builder().key(o.key()).build())
                            .collect(Collectors.toList());
                    s3.deleteObjects(DeleteObjectsRequest.builder()
                                    .bucket(bucket)
                                    .delete(Delete.builder().objects(ids).quiet(true).build())
                                    .build())
                            .join();
                    removed += ids.size();
                }
                continuation = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (continuation != null);
        } catch (CompletionException e) {
            throw BlobStorageException.deleteFailed(objectPrefix, unwrap(e));
        }
        LOG.debugf("Deleted %d objects under s3://%s/%s", removed, bucket, objectPrefix);
        return removed;
    }

    @Override
    public void ping() {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build()).join();
        } catch (CompletionException e) {
            throw new BlobStorageException("ping", bucket, unwrap(e).getMessage());
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucket + "/" + keyPrefix;
    }

    String objectKey(String key) {
        return keyPrefix + key;
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }

    private static String trimSlashes(String value) {
        String v = value.trim();
        while (v.startsWith("/")) {
            v = v.substring(1);
        }
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }
}
