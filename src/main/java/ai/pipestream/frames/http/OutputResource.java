package ai.pipestream.frames.http;

import ai.pipestream.frames.exception.FrameProjectNotFoundException;
import ai.pipestream.frames.output.OutputPage;
import ai.pipestream.frames.output.OutputStore;
import ai.pipestream.frames.output.StoredOutput;
import ai.pipestream.frames.project.FrameProjectService;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.stream.Collectors;

@Path("/api/frames/{id}/outputs")
public class OutputResource {

    @Inject
    OutputStore outputs;

    @Inject
    FrameProjectService projects;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Blocking
    public OutputListResponse list(@PathParam("id") long id,
                                   @QueryParam("search") String search,
                                   @QueryParam("offset") @DefaultValue("0") int offset,
                                   @QueryParam("limit") @DefaultValue("10") int limit) {
        projects.get(id);
        OutputPage page = outputs.page(id, search, offset, limit);
        return new OutputListResponse(page.total(), page.filtered(), page.offset(), page.limit(),
                page.rows().stream().map(OutputRow::from).collect(Collectors.toList()));
    }

    @GET
    @Path("/{productId}/image")
    @Blocking
    public Response image(@PathParam("id") long id, @PathParam("productId") String productId) {
        StoredOutput output = outputs.find(id, productId)
                .orElseThrow(() -> new FrameProjectNotFoundException(id, productId));
        byte[] bytes = outputs.readImage(id, productId)
                .orElseThrow(() -> new FrameProjectNotFoundException(id, productId));
        return Response.ok(bytes, output.contentType()).build();
    }
}
