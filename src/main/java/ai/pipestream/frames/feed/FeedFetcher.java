package ai.pipestream.frames.feed;

import ai.pipestream.frames.exception.FeedException;
import ai.pipestream.frames.exception.FetchException;
import ai.pipestream.frames.fetch.FetchPolicy;
import ai.pipestream.frames.fetch.FetchedResource;
import ai.pipestream.frames.fetch.RemoteFetcher;
import org.jboss.logging.Logger;

/**
 * Retrieves a feed through the {@link RemoteFetcher} and parses it.
 * <p>
 * Transport failures (unreachable, timeout, non-2xx) surface as
 * {@link FeedException}. URL safety rejections propagate unchanged as
 * {@link ai.pipestream.frames.exception.UrlValidationException}.
 */
public class FeedFetcher {

    private static final Logger LOG = Logger.getLogger(FeedFetcher.class);

    private final RemoteFetcher fetcher;
    private final FeedParser parser;
    private final FetchPolicy policy;

    public FeedFetcher(RemoteFetcher fetcher, FeedParser parser, FetchPolicy policy) {
        this.fetcher = fetcher;
        this.parser = parser;
        this.policy = policy;
    }

    public FeedParseResult fetchAndParse(String feedUrl) {
        FetchedResource resource;
        try {
            resource = fetcher.fetch(feedUrl, policy);
        } catch (FetchException e) {
            LOG.warnf("Feed fetch failed for %s: %s", feedUrl, e.getDetail());
            throw new FeedException("feed unreachable: " + e.getDetail(), e);
        }
        LOG.debugf("Fetched feed %s (%d bytes)", feedUrl, resource.size());
        return parser.parse(resource.body());
    }
}
