package com.talent.sourcing.rest;

import com.talent.sourcing.rest.dto.ErrorResponse;
import com.talent.sourcing.rest.dto.ManualResolutionRequest;
import com.talent.sourcing.review.ManualResolutionQueue;
import com.talent.sourcing.review.PageRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * REST resource for organizations that discovery could not resolve.
 */
@Path("/api/v1/manual-resolutions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Manual Resolution", description = "Queue of unresolved organizations awaiting a human decision")
public class ManualResolutionResource {
    private static final Logger log = LoggerFactory.getLogger(ManualResolutionResource.class);

    private final ManualResolutionQueue queue;

    @Inject
    public ManualResolutionResource(ManualResolutionQueue queue) {
        this.queue = queue;
    }

    /**
     * GET /api/v1/manual-resolutions?page=0&size=20
     */
    @GET
    @Operation(summary = "List pending items")
    public Response getPending(@QueryParam("page") @DefaultValue("0") int page,
                               @QueryParam("size") @DefaultValue("20") int size) {
        try {
            return Response.ok(queue.getPending(PageRequest.of(page, size))).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), "/api/v1/manual-resolutions"))
                    .build();
        }
    }

    /**
     * GET /api/v1/manual-resolutions/count
     */
    @GET
    @Path("/count")
    @Operation(summary = "Count pending items")
    public Response countPending() {
        return Response.ok(Map.of("pending", queue.countPending())).build();
    }

    /**
     * POST /api/v1/manual-resolutions/{id}/resolve
     */
    @POST
    @Path("/{id}/resolve")
    @Operation(summary = "Resolve an item to a canonical organization id")
    public Response resolve(@PathParam("id") String itemId, ManualResolutionRequest request) {
        String path = "/api/v1/manual-resolutions/" + itemId + "/resolve";
        try {
            if (request == null || request.canonicalId() == null || request.canonicalId().isBlank()) {
                throw new IllegalArgumentException("canonicalId is required");
            }
            queue.resolve(itemId, request.canonicalId(), request.reviewerId());
            log.info("manual-resolution.resolved itemId={} canonicalId={}", itemId, request.canonicalId());
            return Response.ok(Map.of("itemId", itemId, "status", "RESOLVED")).build();
        } catch (IllegalArgumentException e) {
            return notFoundOrBadRequest(itemId, e, path);
        } catch (IllegalStateException e) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(e.getMessage(), path, Map.of("itemId", itemId)))
                    .build();
        }
    }

    /**
     * POST /api/v1/manual-resolutions/{id}/dismiss
     */
    @POST
    @Path("/{id}/dismiss")
    @Operation(summary = "Dismiss an item without resolving it")
    public Response dismiss(@PathParam("id") String itemId, ManualResolutionRequest request) {
        String path = "/api/v1/manual-resolutions/" + itemId + "/dismiss";
        try {
            if (request == null) {
                throw new IllegalArgumentException("reviewerId is required");
            }
            queue.dismiss(itemId, request.reviewerId(), request.notes());
            log.info("manual-resolution.dismissed itemId={}", itemId);
            return Response.ok(Map.of("itemId", itemId, "status", "DISMISSED")).build();
        } catch (IllegalArgumentException e) {
            return notFoundOrBadRequest(itemId, e, path);
        } catch (IllegalStateException e) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(e.getMessage(), path, Map.of("itemId", itemId)))
                    .build();
        }
    }

    private Response notFoundOrBadRequest(String itemId, IllegalArgumentException e, String path) {
        if (queue.get(itemId).isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound("Item not found: " + itemId, path))
                    .build();
        }
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(e.getMessage(), path))
                .build();
    }
}
