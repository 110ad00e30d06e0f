package ai.pipestream.frames.exception;

/**
 * Thrown when template or output blobs cannot be read, written or deleted.
 */
public class BlobStorageException extends FrameServiceException {

    public static final String CODE = "BLOB_STORAGE_ERROR";

    public BlobStorageException(String operation, String key, Throwable cause) {
        super(CODE, operation, String.format("blob operation failed: key=%s", key), cause);
    }

    public BlobStorageException(String operation, String key, String details) {
        super(CODE, operation, String.format("blob operation failed: key=%s, details=%s", key, details));
    }

    public static BlobStorageException writeFailed(String key, Throwable cause) {
        return new BlobStorageException("write", key, cause);
    }

    public static BlobStorageException readFailed(String key, Throwable cause) {
        return new BlobStorageException("read", key, cause);
    }

    public static BlobStorageException deleteFailed(String key, Throwable cause) {
        return new BlobStorageException("delete", key, cause);
    }
}
