package ai.pipestream.frames.fetch;

import ai.pipestream.frames.exception.UrlValidationException;
import org.jboss.logging.Logger;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Guards every outbound fetch against server-side request forgery.
 * <p>
 * A target is allowed only when its scheme is http or https, its port is in the
 * allowed set, and every address its host resolves to is publicly routable.
 * The check runs on resolved addresses, so a public-looking hostname that
 * resolves to a loopback or private address is rejected. Any resolution
 * failure rejects the target.
 */
public class UrlSafetyValidator {

    private static final Logger LOG = Logger.getLogger(UrlSafetyValidator.class);

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private final HostResolver resolver;
    private final Set<Integer> allowedPorts;

    public UrlSafetyValidator(HostResolver resolver, Set<Integer> allowedPorts) {
        this.resolver = resolver;
        this.allowedPorts = Set.copyOf(allowedPorts);
    }

    /**
     * Full validation: syntax, scheme, port and resolved address ranges.
     *
     * @param url the candidate URL
     * @return the verdict, never {@code null}
     */
    public UrlVerdict validate(String url) {
        UrlVerdict syntax = checkSyntax(url);
        if (!syntax.allowed()) {
            return syntax;
        }
        URI uri = syntax.uri();
        String host = hostOf(uri);

        InetAddress[] resolved;
        try {
            resolved = resolver.resolve(host);
        } catch (UnknownHostException e) {
            return reject(url, uri, "unable to resolve host " + host);
        } catch (RuntimeException e) {
            return reject(url, uri, "resolution failed for host " + host + ": " + e.getMessage());
        }
        if (resolved == null || resolved.length == 0) {
            return reject(url, uri, "host " + host + " resolved to no addresses");
        }
        for (InetAddress address : resolved) {
            String blockedRange = blockedRange(address);
            if (blockedRange != null) {
                return reject(url, uri, String.format("host %s resolves to %s address %s",
                        host, blockedRange, address.getHostAddress()));
            }
        }
        return UrlVerdict.allow(uri, Arrays.asList(resolved));
    }

    /**
     * Static checks only (no DNS): used when a URL is stored for later use.
     */
    public UrlVerdict checkSyntax(String url) {
        if (url == null || url.isBlank()) {
            return UrlVerdict.reject(null, "URL is empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return UrlVerdict.reject(null, "malformed URL: " + e.getReason());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            return reject(url, uri, "scheme not allowed: " + (scheme.isEmpty() ? "<none>" : scheme));
        }
        if (uri.getRawUserInfo() != null) {
            return reject(url, uri, "credentials in URL are not allowed");
        }
        String host = hostOf(uri);
        if (host == null || host.isBlank()) {
            return reject(url, uri, "URL has no host");
        }
        int port = effectivePort(uri);
        if (!allowedPorts.contains(port)) {
            return reject(url, uri, "port not allowed: " + port);
        }
        return UrlVerdict.allow(uri, List.of());
    }

    /**
     * Validates and throws on rejection.
     *
     * @throws UrlValidationException when the target is not allowed
     */
    public URI require(String url) {
        UrlVerdict verdict = validate(url);
        if (!verdict.allowed()) {
            throw new UrlValidationException(url, verdict.reason());
        }
        return verdict.uri();
    }

    /**
     * @return a label for the blocked range the address falls into, or {@code null} when public
     */
    static String blockedRange(InetAddress address) {
        if (address.isAnyLocalAddress()) {
            return "unspecified";
        }
        if (address.isLoopbackAddress()) {
            return "loopback";
        }
        if (address.isLinkLocalAddress()) {
            return "link-local";
        }
        if (address.isSiteLocalAddress()) {
            return "private";
        }
        if (address.isMulticastAddress()) {
            return "multicast";
        }
        byte[] raw = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = raw[0] & 0xff;
            int second = raw[1] & 0xff;
            if (first == 0) {
                return "unspecified";
            }
            // 100.64.0.0/10 carrier-grade NAT
            if (first == 100 && (second & 0xc0) == 64) {
                return "private";
            }
            if (first == 255 && second == 255 && (raw[2] & 0xff) == 255 && (raw[3] & 0xff) == 255) {
                return "broadcast";
            }
        } else if (address instanceof Inet6Address) {
            // fc00::/7 unique local
            if ((raw[0] & 0xfe) == 0xfc) {
                return "private";
            }
            // ::ffff:a.b.c.d mapped and ::a.b.c.d compatible forms carry an IPv4 target
            if (isIpv4Mapped(raw) || ((Inet6Address) address).isIPv4CompatibleAddress()) {
                try {
                    InetAddress embedded = InetAddress.getByAddress(Arrays.copyOfRange(raw, 12, 16));
                    return blockedRange(embedded);
                } catch (UnknownHostException e) {
                    return "unresolvable";
                }
            }
        }
        return null;
    }

    private static boolean isIpv4Mapped(byte[] raw) {
        if (raw.length != 16) {
            return false;
        }
        for (int i = 0; i < 10; i++) {
            if (raw[i] != 0) {
                return false;
            }
        }
        return (raw[10] & 0xff) == 0xff && (raw[11] & 0xff) == 0xff;
    }

    private static String hostOf(URI uri) {
        String host = uri.getHost();
        if (host != null && host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static UrlVerdict reject(String url, URI uri, String reason) {
        LOG.warnf("Blocked fetch target %s: %s", url, reason);
        return UrlVerdict.reject(uri, reason);
    }
}
