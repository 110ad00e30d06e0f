package ai.pipestream.frames.bulk;

import java.util.List;

/**
 * Progress callbacks from a running bulk job. Item callbacks arrive from
 * worker threads, concurrently.
 */
public interface BulkRunListener {

    BulkRunListener NONE = new BulkRunListener() {
    };

    default void onFeedParsed(int distinctProducts, List<String> warnings) {
    }

    /**
     * @param resolved  items resolved so far, including this one
     * @param succeeded successes so far
     * @param failed    failures so far
     */
    default void onItemResolved(ItemOutcome outcome, int resolved, int succeeded, int failed) {
    }
}
