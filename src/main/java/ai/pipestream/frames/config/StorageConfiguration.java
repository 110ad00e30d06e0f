package ai.pipestream.frames.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Selects the blob backend for templates and output images.
 */
@ConfigMapping(prefix = "frames.storage")
public interface StorageConfiguration {

    enum Type {
        S3,
        FILESYSTEM
    }

    @WithDefault("s3")
    Type type();

    /**
     * Root directory used by the filesystem backend.
     */
    @WithDefault("data/blobs")
    String filesystemRoot();
}
