package ai.pipestream.frames.fetch;

import ai.pipestream.frames.exception.FetchException;
import ai.pipestream.frames.exception.UrlValidationException;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Set;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the fetcher against an in-process WireMock server. The resolver maps
 * {@code localhost} to a public address so the loopback server passes
 * validation, while {@code internal.test} maps to a private one.
 */
class SafeHttpFetcherTest {

    private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3, 4};

    private WireMockServer server;
    private SafeHttpFetcher fetcher;
    private String base;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        base = "http://localhost:" + server.port();

        HostResolver resolver = host -> {
            switch (host) {
                case "localhost":
                    return new InetAddress[]{InetAddress.getByAddress(host, new byte[]{93, (byte) 184, (byte) 216, 34})};
                case "internal.test":
                    return new InetAddress[]{InetAddress.getByAddress(host, new byte[]{10, 0, 0, 5})};
                default:
                    throw new UnknownHostException(host);
            }
        };
        UrlSafetyValidator validator = new UrlSafetyValidator(resolver, Set.of(server.port()));
        fetcher = new SafeHttpFetcher(validator, Duration.ofSeconds(2), 3, "FrameComposerTest/1.0");
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static FetchPolicy imagePolicy(long maxBytes) {
        return FetchPolicy.image(maxBytes, Duration.ofSeconds(2));
    }

    @Test
    void fetchesImageWithAcceptedContentType() {
        server.stubFor(get("/a.png").willReturn(aResponse()
                .withHeader("Content-Type", "image/png")
                .withBody(PNG_BYTES)));

        FetchedResource resource = fetcher.fetch(base + "/a.png", imagePolicy(1024));

        assertArrayEquals(PNG_BYTES, resource.body());
        assertEquals("image/png", resource.contentType());
        server.verify(getRequestedFor(urlEqualTo("/a.png"))
                .withHeader("User-Agent", equalTo("FrameComposerTest/1.0")));
    }

    @Test
    void acceptsContentTypeParameters() {
        server.stubFor(get("/feed.xml").willReturn(aResponse()
                .withHeader("Content-Type", "application/xml; charset=utf-8")
                .withBody("<feed/>")));

        FetchedResource resource = fetcher.fetch(base + "/feed.xml", FetchPolicy.feed(1024, Duration.ofSeconds(2)));

        assertEquals(7, resource.size());
    }

    @Test
    void rejectsUnexpectedContentType() {
        server.stubFor(get("/page").willReturn(aResponse()
                .withHeader("Content-Type", "text/html")
                .withBody("<html></html>")));

        UrlValidationException e = assertThrows(UrlValidationException.class,
                () -> fetcher.fetch(base + "/page", imagePolicy(1024)));
        assertTrue(e.getDetail().contains("text/html"));
    }

    @Test
    void rejectsMissingContentType() {
        server.stubFor(get("/untyped").willReturn(aResponse().withBody(PNG_BYTES)));

        assertThrows(UrlValidationException.class, () -> fetcher.fetch(base + "/untyped", imagePolicy(1024)));
    }

    @Test
    void rejectsBodiesOverTheCeiling() {
        server.stubFor(get("/big.png").willReturn(aResponse()
                .withHeader("Content-Type", "image/png")
                .withBody(new byte[4096])));

        UrlValidationException e = assertThrows(UrlValidationException.class,
                () -> fetcher.fetch(base + "/big.png", imagePolicy(1000)));
        assertTrue(e.getDetail().contains("1000"));
    }

    @Test
    void nonSuccessStatusIsAFetchFailure() {
        server.stubFor(get("/missing.png").willReturn(aResponse().withStatus(404)));

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetch(base + "/missing.png", imagePolicy(1024)));
        assertEquals(404, e.getStatusCode());
    }

    @Test
    void followsRedirectsToAllowedTargets() {
        server.stubFor(get("/old.png").willReturn(aResponse()
                .withStatus(302)
                .withHeader("Location", "/new.png")));
        server.stubFor(get("/new.png").willReturn(aResponse()
                .withHeader("Content-Type", "image/png")
                .withBody(PNG_BYTES)));

        FetchedResource resource = fetcher.fetch(base + "/old.png", imagePolicy(1024));

        assertEquals(base + "/new.png", resource.finalUrl());
        assertArrayEquals(PNG_BYTES, resource.body());
    }

    @Test
    void revalidatesEveryRedirectHop() {
        server.stubFor(get("/bounce").willReturn(aResponse()
                .withStatus(301)
                .withHeader("Location", "http://internal.test:" + server.port() + "/secret")));

        UrlValidationException e = assertThrows(UrlValidationException.class,
                () -> fetcher.fetch(base + "/bounce", imagePolicy(1024)));

        assertTrue(e.getUrl().contains("internal.test"));
        server.verify(0, getRequestedFor(urlEqualTo("/secret")));
    }

    @Test
    void stopsAfterTooManyRedirects() {
        server.stubFor(get("/loop").willReturn(aResponse()
                .withStatus(302)
                .withHeader("Location", "/loop")));

        UrlValidationException e = assertThrows(UrlValidationException.class,
                () -> fetcher.fetch(base + "/loop", imagePolicy(1024)));

        assertTrue(e.getDetail().contains("too many redirects"));
        server.verify(4, getRequestedFor(urlEqualTo("/loop")));
    }

    @Test
    void slowResponsesTimeOut() {
        server.stubFor(get("/slow.png").willReturn(aResponse()
                .withHeader("Content-Type", "image/png")
                .withBody(PNG_BYTES)
                .withFixedDelay(1500)));

        FetchPolicy quick = FetchPolicy.image(1024, Duration.ofMillis(200));

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(base + "/slow.png", quick));
        assertEquals(-1, e.getStatusCode());
    }

    @Test
    void neverConnectsToRejectedTargets() {
        assertThrows(UrlValidationException.class,
                () -> fetcher.fetch("http://internal.test:" + server.port() + "/a.png", imagePolicy(1024)));

        assertEquals(0, server.getAllServeEvents().size());
    }
}
