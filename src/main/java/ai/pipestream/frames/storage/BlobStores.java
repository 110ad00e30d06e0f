package ai.pipestream.frames.storage;

import ai.pipestream.frames.config.S3Config;
import ai.pipestream.frames.config.StorageConfiguration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.s3.S3AsyncClient;

import java.nio.file.Path;

/**
 * Produces the configured {@link BlobStore}.
 */
@ApplicationScoped
public class BlobStores {

    private static final Logger LOG = Logger.getLogger(BlobStores.class);

    @Produces
    @ApplicationScoped
    public BlobStore blobStore(StorageConfiguration storage, S3Config s3Config, Instance<S3AsyncClient> s3) {
        BlobStore store;
        if (storage.type() == StorageConfiguration.Type.FILESYSTEM) {
            store = new FileSystemBlobStore(Path.of(storage.filesystemRoot()));
        } else {
            store = new S3BlobStore(s3.get(), s3Config.bucket(), s3Config.keyPrefix());
        }
        LOG.infof("Blob storage: %s", store.describe());
        return store;
    }
}
