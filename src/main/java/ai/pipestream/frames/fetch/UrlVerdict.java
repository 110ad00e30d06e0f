package ai.pipestream.frames.fetch;

import java.net.InetAddress;
import java.net.URI;
import java.util.List;

/**
 * Result of validating a fetch target.
 *
 * @param allowed   whether the target may be fetched
 * @param reason    why the target was rejected, {@code null} when allowed
 * @param uri       the parsed target, {@code null} when it did not parse
 * @param addresses the resolved addresses that were checked; empty for syntax-only checks
 */
public record UrlVerdict(boolean allowed, String reason, URI uri, List<InetAddress> addresses) {

    public static UrlVerdict allow(URI uri, List<InetAddress> addresses) {
        return new UrlVerdict(true, null, uri, List.copyOf(addresses));
    }

    public static UrlVerdict reject(URI uri, String reason) {
        return new UrlVerdict(false, reason, uri, List.of());
    }
}
