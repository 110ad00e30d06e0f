package ai.pipestream.frames.fetch;

/**
 * Body and declared content type of a successful fetch.
 *
 * @param finalUrl the URL the body was read from, after redirects
 */
public record FetchedResource(String finalUrl, String contentType, byte[] body) {

    public int size() {
        return body.length;
    }
}
