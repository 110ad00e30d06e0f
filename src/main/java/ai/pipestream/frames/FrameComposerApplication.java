package ai.pipestream.frames;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Main application entry point for the Frame Composer Service.
 * Composites product feed images onto frame templates.
 */
@QuarkusMain
@ApplicationScoped
public class FrameComposerApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(FrameComposerApplication.class);

    public static void main(String... args) {
        Quarkus.run(FrameComposerApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Frame Composer Service started successfully");
        Quarkus.waitForExit();
        return 0;
    }
}
