package ai.pipestream.frames.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * S3 configuration for the blob store (MinIO compatible).
 */
@ConfigMapping(prefix = "frames.s3")
public interface S3Config {

    @WithDefault("http://localhost:9000")
    String endpoint();

    @WithDefault("us-east-1")
    String region();

    @WithDefault("minioadmin")
    String accessKey();

    @WithDefault("minioadmin")
    String secretKey();

    @WithDefault("frame-composer")
    String bucket();

    /**
     * Whether to use path-style access (required for most MinIO setups).
     */
    @WithDefault("true")
    boolean pathStyleAccess();

    /**
     * Object key prefix for every blob written by this service.
     */
    @WithDefault("frames")
    String keyPrefix();
}
