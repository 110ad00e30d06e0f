package ai.pipestream.frames.http;

import ai.pipestream.frames.bulk.BulkRunService;
import ai.pipestream.frames.bulk.RunStatus;
import ai.pipestream.frames.exception.FrameProjectNotFoundException;
import ai.pipestream.frames.exception.FrameServiceException;
import ai.pipestream.frames.project.FrameProjectService;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Bulk runs of a frame project. A run is accepted (202) and proceeds in the
 * background; poll {@code runs/current} for progress.
 */
@Path("/api/frames/{id}/runs")
@Produces(MediaType.APPLICATION_JSON)
public class BulkRunResource {

    @Inject
    BulkRunService runs;

    @Inject
    FrameProjectService projects;

    @POST
    @Blocking
    public Response trigger(@PathParam("id") long id) {
        RunStatus status = runs.trigger(id);
        String statusUrl = "/api/frames/" + id + "/runs/current";
        return Response.accepted(new RunHandle(status.runId(), id, status.startedAt(), statusUrl)).build();
    }

    @GET
    @Path("/current")
    @Blocking
    public RunStatusView current(@PathParam("id") long id) {
        projects.get(id);
        return runs.status(id)
                .map(RunStatusView::from)
                .orElseThrow(() -> new FrameServiceException(FrameProjectNotFoundException.CODE, "run-status",
                        "frame project " + id + " has no run since the service started"));
    }

    @DELETE
    @Path("/current")
    @Blocking
    public Response cancel(@PathParam("id") long id) {
        projects.get(id);
        return runs.cancel(id).isPresent()
                ? Response.accepted().build()
                : Response.noContent().build();
    }
}
