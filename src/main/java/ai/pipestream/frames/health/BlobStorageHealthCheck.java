package ai.pipestream.frames.health;

import ai.pipestream.frames.storage.BlobStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class BlobStorageHealthCheck implements HealthCheck {

    @Inject
    BlobStore blobStore;

    @Override
    public HealthCheckResponse call() {
        try {
            blobStore.ping();
            return HealthCheckResponse.named("blob-storage")
                    .withData("location", blobStore.describe())
                    .up()
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("blob-storage")
                    .withData("location", blobStore.describe())
                    .withData("error", String.valueOf(e.getMessage()))
                    .down()
                    .build();
        }
    }
}
