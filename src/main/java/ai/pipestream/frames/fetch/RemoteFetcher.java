package ai.pipestream.frames.fetch;

/**
 * Fetches a remote resource under a {@link FetchPolicy}. Every implementation
 * must apply the URL safety rules before connecting.
 */
public interface RemoteFetcher {

    /**
     * @throws ai.pipestream.frames.exception.UrlValidationException when the target or response is rejected
     * @throws ai.pipestream.frames.exception.FetchException when the target cannot be reached or answers non-2xx
     */
    FetchedResource fetch(String url, FetchPolicy policy);
}
