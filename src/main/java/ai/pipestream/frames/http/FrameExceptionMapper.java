package ai.pipestream.frames.http;

import ai.pipestream.frames.exception.AlreadyRunningException;
import ai.pipestream.frames.exception.CompositeException;
import ai.pipestream.frames.exception.FeedException;
import ai.pipestream.frames.exception.FetchException;
import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.exception.FrameProjectNotFoundException;
import ai.pipestream.frames.exception.FrameServiceException;
import ai.pipestream.frames.exception.UrlValidationException;
import ai.pipestream.frames.metrics.FrameMetrics;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Turns service exceptions into {@link ErrorResponse} bodies with a status per error kind.
 */
@Provider
public class FrameExceptionMapper implements ExceptionMapper<FrameServiceException> {

    private static final Logger LOG = Logger.getLogger(FrameExceptionMapper.class);

    static final int UNPROCESSABLE = 422;

    @Inject
    FrameMetrics metrics;

    @Override
    public Response toResponse(FrameServiceException e) {
        int status = statusOf(e);
        if (status >= 500) {
            LOG.errorf(e, "%s failed", e.getOperation());
        } else {
            LOG.debugf("%s rejected: %s", e.getOperation(), e.getMessage());
        }
        if (e instanceof UrlValidationException) {
            metrics.recordUrlRejected();
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(e.getErrorCode(), e.getOperation(), e.getDetail()))
                .build();
    }

    static int statusOf(FrameServiceException e) {
        if (e instanceof FrameConfigurationException) {
            return ((FrameConfigurationException) e).isBoundsError() ? UNPROCESSABLE : 400;
        }
        if (e instanceof UrlValidationException || e instanceof CompositeException) {
            return 400;
        }
        if (e instanceof FrameProjectNotFoundException || FrameProjectNotFoundException.CODE.equals(e.getErrorCode())) {
            return 404;
        }
        if (e instanceof AlreadyRunningException) {
            return 409;
        }
        if (e instanceof FeedException || e instanceof FetchException) {
            return 502;
        }
        return 500;
    }
}
