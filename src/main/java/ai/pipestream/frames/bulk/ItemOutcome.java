package ai.pipestream.frames.bulk;

/**
 * How one feed item ended within a bulk run.
 *
 * @param errorCode error code of the failure, {@code null} unless FAILED
 */
public record ItemOutcome(String productId, String imageUrl, Status status, String reason, String errorCode,
                          long durationMillis) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        /**
         * Resolved after the run was cancelled; nothing was written.
         */
        ABANDONED
    }

    public static ItemOutcome succeeded(String productId, String imageUrl, long durationMillis) {
        return new ItemOutcome(productId, imageUrl, Status.SUCCEEDED, null, null, durationMillis);
    }

    public static ItemOutcome failed(String productId, String imageUrl, String errorCode, String reason,
                                     long durationMillis) {
        return new ItemOutcome(productId, imageUrl, Status.FAILED, reason, errorCode, durationMillis);
    }

    public static ItemOutcome abandoned(String productId, String imageUrl, String reason) {
        return new ItemOutcome(productId, imageUrl, Status.ABANDONED, reason, null, 0L);
    }

    /**
     * Failure line as reported in the run result.
     */
    public String describeFailure() {
        return productId + ": " + reason;
    }
}
