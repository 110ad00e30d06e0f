package ai.pipestream.frames.fetch;

import ai.pipestream.frames.exception.FetchException;
import ai.pipestream.frames.exception.UrlValidationException;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * {@link RemoteFetcher} on top of the JDK HTTP client.
 * <p>
 * Redirects are never followed by the client itself: each hop is resolved and
 * validated before it is requested. Declared content length and the streamed
 * body are both held to the policy's byte ceiling.
 */
public class SafeHttpFetcher implements RemoteFetcher {

    private static final Logger LOG = Logger.getLogger(SafeHttpFetcher.class);

    private static final int BUFFER_SIZE = 8192;

    private final UrlSafetyValidator validator;
    private final HttpClient client;
    private final int maxRedirects;
    private final String userAgent;

    public SafeHttpFetcher(UrlSafetyValidator validator, Duration connectTimeout, int maxRedirects, String userAgent) {
        this(validator, HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), maxRedirects, userAgent);
    }

    SafeHttpFetcher(UrlSafetyValidator validator, HttpClient client, int maxRedirects, String userAgent) {
        this.validator = validator;
        this.client = client;
        this.maxRedirects = maxRedirects;
        this.userAgent = userAgent;
    }

    @Override
    public FetchedResource fetch(String url, FetchPolicy policy) {
        String current = url;
        for (int hop = 0; hop <= maxRedirects; hop++) {
            URI target = validator.require(current);
            HttpResponse<InputStream> response = send(current, target, policy);
            int status = response.statusCode();

            if (isRedirect(status)) {
                String location = response.headers().firstValue("Location").orElse(null);
                closeQuietly(response.body());
                if (location == null || location.isBlank()) {
                    throw new FetchException(current, status);
                }
                String next = target.resolve(location.trim()).toString();
                LOG.debugf("Following redirect %d from %s to %s", status, current, next);
                current = next;
                continue;
            }
            if (status < 200 || status >= 300) {
                closeQuietly(response.body());
                throw new FetchException(current, status);
            }
            return readBody(current, response, policy);
        }
        throw new UrlValidationException(url, "too many redirects (max " + maxRedirects + ")");
    }

    private HttpResponse<InputStream> send(String url, URI target, FetchPolicy policy) {
        HttpRequest request = HttpRequest.newBuilder(target)
                .GET()
                .timeout(policy.timeout())
                .header("User-Agent", userAgent)
                .header("Accept", policy.acceptHeader())
                .build();
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new FetchException(url, "timed out after " + policy.timeout(), e);
        } catch (IOException e) {
            throw new FetchException(url, "unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "interrupted", e);
        }
    }

    private FetchedResource readBody(String url, HttpResponse<InputStream> response, FetchPolicy policy) {
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        if (!policy.accepts(contentType)) {
            closeQuietly(response.body());
            throw new UrlValidationException(url, String.format("content type %s not accepted for %s",
                    contentType == null ? "<missing>" : contentType, policy.purpose()));
        }

        OptionalLong declared = response.headers().firstValueAsLong("Content-Length");
        if (declared.isPresent() && declared.getAsLong() > policy.maxBytes()) {
            closeQuietly(response.body());
            throw new UrlValidationException(url, String.format("%s too large: %d bytes (max %d)",
                    policy.purpose(), declared.getAsLong(), policy.maxBytes()));
        }

        try (InputStream in = response.body()) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            long total = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (total > policy.maxBytes()) {
                    throw new UrlValidationException(url, String.format("%s exceeds %d bytes",
                            policy.purpose(), policy.maxBytes()));
                }
                out.write(buffer, 0, read);
            }
            LOG.debugf("Fetched %s (%s, %d bytes)", url, contentType, total);
            return new FetchedResource(url, contentType, out.toByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchException(url, "timed out reading body", e);
        } catch (IOException e) {
            throw new FetchException(url, "failed reading body: " + e.getMessage(), e);
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            LOG.debugf("Ignoring close failure: %s", e.getMessage());
        }
    }
}
