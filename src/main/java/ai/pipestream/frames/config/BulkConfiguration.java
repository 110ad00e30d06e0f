package ai.pipestream.frames.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Bulk run settings. Keys are namespaced under {@code frames.bulk.*}.
 */
@ConfigMapping(prefix = "frames.bulk")
public interface BulkConfiguration {

    /**
     * Maximum number of item tasks in flight for one run. Items beyond the
     * bound wait for a slot.
     * Default: 16.
     */
    @WithDefault("16")
    int maxInFlight();

    /**
     * Project progress counters are written every N resolved items.
     * Default: 10.
     */
    @WithDefault("10")
    int progressInterval();
}
