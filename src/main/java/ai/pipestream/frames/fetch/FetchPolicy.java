package ai.pipestream.frames.fetch;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a caller expects back from a fetch: accepted media types, a byte
 * ceiling and a timeout.
 */
public record FetchPolicy(String purpose, Set<String> acceptedTypes, long maxBytes, Duration timeout) {

    public static final Set<String> FEED_TYPES = Set.of(
            "application/xml", "text/xml", "application/atom+xml", "application/rss+xml");

    public static final Set<String> IMAGE_TYPES = Set.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp");

    public static FetchPolicy feed(long maxBytes, Duration timeout) {
        return new FetchPolicy("feed", FEED_TYPES, maxBytes, timeout);
    }

    public static FetchPolicy image(long maxBytes, Duration timeout) {
        return new FetchPolicy("image", IMAGE_TYPES, maxBytes, timeout);
    }

    /**
     * Matches the media type of a Content-Type header value, ignoring parameters and case.
     */
    public boolean accepts(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return acceptedTypes.contains(mediaType);
    }

    /**
     * Value for the Accept request header.
     */
    public String acceptHeader() {
        return String.join(", ", acceptedTypes.stream().sorted().collect(Collectors.toList()));
    }
}
