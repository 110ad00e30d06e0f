package ai.pipestream.frames.http;

import ai.pipestream.frames.composite.OverlayRect;
import ai.pipestream.frames.entity.FrameProject;
import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.metrics.FrameMetrics;
import ai.pipestream.frames.preview.PreviewImage;
import ai.pipestream.frames.project.FrameProjectService;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;
import org.jboss.logging.Logger;

/**
 * Frame projects: upload a template, place the overlay, preview it.
 */
@Path("/api/frames")
@Produces(MediaType.APPLICATION_JSON)
public class FrameProjectResource {

    private static final Logger LOG = Logger.getLogger(FrameProjectResource.class);

    @Inject
    FrameProjectService projects;

    @Inject
    FrameMetrics metrics;

    /**
     * Raw template upload (single request). Name, owner and feed arrive as headers.
     */
    @POST
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Blocking
    public Response create(byte[] template,
                           @HeaderParam("x-frame-name") String name,
                           @HeaderParam("x-owner-id") String ownerId,
                           @HeaderParam("x-feed-url") String feedUrl) {
        FrameProject project = projects.create(name, ownerId, feedUrl, template);
        return Response.created(UriBuilder.fromPath("/api/frames/{id}").build(project.id))
                .entity(FrameProjectView.from(project))
                .build();
    }

    @GET
    @Path("/{id}")
    @Blocking
    public FrameProjectView get(@PathParam("id") long id) {
        return FrameProjectView.from(projects.get(id));
    }

    @DELETE
    @Path("/{id}")
    @Blocking
    public Response delete(@PathParam("id") long id) {
        projects.delete(id);
        return Response.noContent().build();
    }

    @PUT
    @Path("/{id}/overlay")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public FrameProjectView setOverlay(@PathParam("id") long id, OverlayRequest request) {
        OverlayRect rect = requireBody(request, "set-overlay").toRect("set-overlay");
        return FrameProjectView.from(projects.setOverlayRect(id, rect));
    }

    /**
     * Renders a preview; nothing is stored.
     */
    @POST
    @Path("/{id}/preview")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public PreviewResponse preview(@PathParam("id") long id, PreviewRequest request) {
        PreviewRequest body = requireBody(request, "preview");
        OverlayRect rect = body.overlay().toRect("preview");
        PreviewImage image = projects.preview(id, rect, body.imageRef());
        metrics.recordPreview();
        LOG.debugf("Preview for project %d: %dx%d", id, image.width(), image.height());
        return new PreviewResponse(image.mediaType(), image.width(), image.height(), image.bytes().length,
                image.dataUri());
    }

    private static <T> T requireBody(T body, String operation) {
        if (body == null) {
            throw FrameConfigurationException.missingField(operation, "body");
        }
        return body;
    }
}
