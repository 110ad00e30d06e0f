package ai.pipestream.frames.storage;

import java.util.Optional;

/**
 * Binary storage for templates and output images, addressed by key.
 */
public interface BlobStore {

    void put(String key, byte[] data, String contentType);

    Optional<byte[]> get(String key);

    void delete(String key);

    /**
     * Deletes every blob whose key starts with {@code prefix}.
     *
     * @return number of blobs removed
     */
    int deletePrefix(String prefix);

    /**
     * Cheap connectivity probe used by the readiness check.
     *
     * @throws ai.pipestream.frames.exception.BlobStorageException when the backend is unreachable
     */
    void ping();

    /**
     * Human-readable location, for logs and health data.
     */
    String describe();
}
