package ai.pipestream.frames.health;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Process liveness. Deliberately independent of storage and remote hosts.
 */
@Liveness
@ApplicationScoped
public class LivenessCheck implements HealthCheck {

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("frame-composer")
                .withData("version", versionOf())
                .up()
                .build();
    }

    private static String versionOf() {
        String version = LivenessCheck.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }
}
