package ai.pipestream.frames.output;

import java.util.Optional;

/**
 * Persisted record set of outputs, keyed on (frame project, product id).
 */
public interface OutputStore {

    int MAX_PAGE_SIZE = 100;

    /**
     * Inserts or replaces the output for the pair. Re-runs overwrite instead of
     * accumulating rows.
     *
     * @return {@code false} when the project no longer exists and nothing was written
     */
    boolean upsert(long projectId, String productId, OutputResult result);

    /**
     * Outputs ordered by generation time (newest first), then product id.
     *
     * @param filter case-insensitive substring over product id; {@code null} or blank for none
     * @param limit  clamped to 1..{@value #MAX_PAGE_SIZE}
     */
    OutputPage page(long projectId, String filter, int offset, int limit);

    Optional<StoredOutput> find(long projectId, String productId);

    /**
     * Reads the generated image of a succeeded output.
     */
    Optional<byte[]> readImage(long projectId, String productId);

    /**
     * Removes every output row and image of the project.
     *
     * @return rows removed
     */
    long deleteAll(long projectId);

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
    }
}
