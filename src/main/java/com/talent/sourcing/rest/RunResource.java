package com.talent.sourcing.rest;

import com.talent.sourcing.pipeline.CollectRequest;
import com.talent.sourcing.pipeline.DiscoveryResult;
import com.talent.sourcing.pipeline.InvalidPaginationRequestException;
import com.talent.sourcing.pipeline.PreviewResult;
import com.talent.sourcing.pipeline.SearchCriteria;
import com.talent.sourcing.pipeline.SessionInactiveException;
import com.talent.sourcing.pipeline.StageConflictException;
import com.talent.sourcing.pipeline.StageOrchestrator;
import com.talent.sourcing.rest.dto.CollectPageRequest;
import com.talent.sourcing.rest.dto.CollectionResponse;
import com.talent.sourcing.rest.dto.CriteriaRequest;
import com.talent.sourcing.rest.dto.ErrorResponse;
import com.talent.sourcing.rest.dto.EvaluateRequest;
import com.talent.sourcing.rest.dto.EvaluationResponse;
import com.talent.sourcing.rest.dto.PreviewRequest;
import com.talent.sourcing.rest.dto.SessionResponse;
import com.talent.sourcing.rest.dto.StartRunRequest;
import com.talent.sourcing.session.SessionNotFoundException;
import com.talent.sourcing.session.SessionStateStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
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
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST resource for sourcing runs.
 *
 * <p>A run is driven stage by stage: {@code POST /runs} discovers the seed organizations,
 * {@code /preview} stores candidate ids, {@code /collect} fetches pages of full records
 * and {@code /evaluate} ranks everything collected so far.</p>
 */
@Path("/api/v1/runs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Sourcing Runs", description = "Start, advance and inspect candidate sourcing runs")
public class RunResource {
    private static final Logger log = LoggerFactory.getLogger(RunResource.class);
    private static final int MAX_LIST_LIMIT = 200;

    private final StageOrchestrator orchestrator;
    private final SessionStateStore sessionStore;

    @Inject
    public RunResource(StageOrchestrator orchestrator, SessionStateStore sessionStore) {
        this.orchestrator = orchestrator;
        this.sessionStore = sessionStore;
    }

    /**
     * POST /api/v1/runs
     */
    @POST
    @Operation(summary = "Start a run", description = "Creates a session and resolves the seed organizations.")
    @APIResponse(responseCode = "201", description = "Run started, discovery completed")
    @APIResponse(responseCode = "400", description = "Invalid request")
    public Response start(StartRunRequest request) {
        return handle("/api/v1/runs", () -> {
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            DiscoveryResult result = orchestrator.startRun(request.toRunRequest());
            return Response.status(Response.Status.CREATED)
                    .entity(SessionResponse.from(sessionStore.read(result.sessionId())))
                    .build();
        });
    }

    /**
     * POST /api/v1/runs/{id}/preview
     */
    @POST
    @Path("/{id}/preview")
    @Operation(summary = "Preview candidates",
            description = "Searches candidates at the discovered organizations and stores their ids. Free.")
    @APIResponse(responseCode = "200", description = "Preview completed")
    @APIResponse(responseCode = "409", description = "Session is not ready for preview")
    public Response preview(@Parameter(description = "Session id") @PathParam("id") String sessionId,
                            PreviewRequest request) {
        return handle("/api/v1/runs/" + sessionId + "/preview", () -> {
            SearchCriteria criteria = CriteriaRequest.toCriteria(request != null ? request.criteria() : null);
            PreviewResult result = request != null && request.nextBatch()
                    ? orchestrator.previewNextBatch(sessionId, criteria)
                    : orchestrator.preview(sessionId, criteria);
            return Response.ok(result).build();
        });
    }

    /**
     * POST /api/v1/runs/{id}/collect
     */
    @POST
    @Path("/{id}/collect")
    @Operation(summary = "Collect a page of records",
            description = "Fetches full records for a page of candidate ids, reusing cached records.")
    @APIResponse(responseCode = "200", description = "Page collected (may contain per-item failures)")
    @APIResponse(responseCode = "400", description = "Page starts beyond the stored candidate ids")
    public Response collect(@Parameter(description = "Session id") @PathParam("id") String sessionId,
                            CollectPageRequest request) {
        return handle("/api/v1/runs/" + sessionId + "/collect", () -> {
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            CollectRequest collect = new CollectRequest(sessionId, request.startIndex(), request.count(),
                    request.bypassCache());
            return Response.ok(CollectionResponse.from(orchestrator.collect(collect))).build();
        });
    }

    /**
     * POST /api/v1/runs/{id}/evaluate
     */
    @POST
    @Path("/{id}/evaluate")
    @Operation(summary = "Evaluate collected candidates",
            description = "Scores every collected candidate against the requirements and completes the run.")
    @APIResponse(responseCode = "200", description = "Candidates ranked")
    public Response evaluate(@Parameter(description = "Session id") @PathParam("id") String sessionId,
                             EvaluateRequest request) {
        return handle("/api/v1/runs/" + sessionId + "/evaluate", () -> {
            if (request == null || request.requirements() == null) {
                throw new IllegalArgumentException("requirements are required");
            }
            return Response.ok(EvaluationResponse.from(
                    orchestrator.evaluateCollected(sessionId, request.requirements().toRequirements()))).build();
        });
    }

    /**
     * GET /api/v1/runs/{id}
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Get a run", description = "Returns the session's progress, organizations and metadata.")
    @APIResponse(responseCode = "200", description = "Session found")
    @APIResponse(responseCode = "404", description = "Session not found")
    public Response get(@Parameter(description = "Session id") @PathParam("id") String sessionId) {
        return handle("/api/v1/runs/" + sessionId,
                () -> Response.ok(SessionResponse.from(sessionStore.read(sessionId))).build());
    }

    /**
     * GET /api/v1/runs?limit=50
     */
    @GET
    @Operation(summary = "List active runs", description = "Active sessions, most recently accessed first.")
    public Response list(@QueryParam("limit") @DefaultValue("50") int limit) {
        return handle("/api/v1/runs", () -> {
            if (limit <= 0 || limit > MAX_LIST_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
            }
            return Response.ok(sessionStore.listActive(limit)).build();
        });
    }

    /**
     * DELETE /api/v1/runs/{id}
     */
    @DELETE
    @Path("/{id}")
    @Operation(summary = "Clear a run", description = "Deactivates the session. Its state stays readable until purged.")
    @APIResponse(responseCode = "204", description = "Session cleared")
    @APIResponse(responseCode = "404", description = "Session not found")
    public Response clear(@Parameter(description = "Session id") @PathParam("id") String sessionId) {
        return handle("/api/v1/runs/" + sessionId, () -> {
            boolean changed = sessionStore.deactivate(sessionId);
            log.info("run.cleared sessionId={} changed={}", sessionId, changed);
            return Response.noContent().build();
        });
    }

    private Response handle(String path, Supplier<Response> action) {
        try {
            return action.get();
        } catch (InvalidPaginationRequestException | IllegalArgumentException e) {
            return error(Response.Status.BAD_REQUEST, ErrorResponse.badRequest(e.getMessage(), path));
        } catch (SessionNotFoundException e) {
            return error(Response.Status.NOT_FOUND, ErrorResponse.notFound(e.getMessage(), path));
        } catch (StageConflictException e) {
            return error(Response.Status.CONFLICT, ErrorResponse.conflict(e.getMessage(), path,
                    Map.of("stage", e.getActual().name())));
        } catch (SessionInactiveException e) {
            return error(Response.Status.GONE, ErrorResponse.gone(e.getMessage(), path));
        } catch (Exception e) {
            log.error("run.request.failed path={} error={}", path, e.getMessage(), e);
            return error(Response.Status.INTERNAL_SERVER_ERROR,
                    ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path));
        }
    }

    private static Response error(Response.Status status, ErrorResponse body) {
        return Response.status(status).entity(body).build();
    }
}
