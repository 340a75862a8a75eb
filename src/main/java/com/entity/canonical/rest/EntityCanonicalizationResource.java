package com.entity.canonical.rest;

import com.entity.canonical.api.EntityResolver;
import com.entity.canonical.api.EntityResolverRegistry;
import com.entity.canonical.api.FitResult;
import com.entity.canonical.core.DuplicateIdentifierException;
import com.entity.canonical.core.MappingLoadException;
import com.entity.canonical.core.model.EntityMention;
import com.entity.canonical.core.model.ResolutionResult;
import com.entity.canonical.health.HealthCheckRegistry;
import com.entity.canonical.health.HealthStatus;
import com.entity.canonical.lock.LockAcquisitionException;
import com.entity.canonical.rest.dto.ErrorResponse;
import com.entity.canonical.rest.dto.FitResponse;
import com.entity.canonical.rest.dto.ResolveRequest;
import com.entity.canonical.rest.dto.ResolveResponse;
import com.entity.canonical.search.BackendUnavailableException;
import com.entity.canonical.search.IndexNotFoundException;
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
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource for resolving mentions and rebuilding synonym indexes.
 *
 * <p>Backend unavailability maps to 503, a missing index to 404, a duplicate
 * record id to 409 and invalid input to 400. Resolution misses are not errors:
 * they return 200 with status {@code UNRESOLVED}.</p>
 */
@Path("/api/v1/entities")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Entity Canonicalization", description = "Resolve mentions and rebuild synonym indexes")
public class EntityCanonicalizationResource {
    private static final Logger log = LoggerFactory.getLogger(EntityCanonicalizationResource.class);

    private final EntityResolverRegistry registry;
    private final HealthCheckRegistry healthChecks;

    @Inject
    public EntityCanonicalizationResource(EntityResolverRegistry registry, HealthCheckRegistry healthChecks) {
        this.registry = registry;
        this.healthChecks = healthChecks;
    }

    /**
     * POST /api/v1/entities/{type}/resolve
     */
    @POST
    @Path("/{type}/resolve")
    @Operation(summary = "Resolve a mention",
            description = "Resolves a mention through the synonym table (exactMatchOnly) or the ranked fuzzy search.")
    @APIResponse(responseCode = "200", description = "Mention processed; see status for the outcome")
    @APIResponse(responseCode = "400", description = "Invalid request")
    @APIResponse(responseCode = "404", description = "Synonym index does not exist (fuzzy path)")
    @APIResponse(responseCode = "503", description = "Search backend unavailable")
    public Response resolve(
            @Parameter(description = "Entity type", required = true) @PathParam("type") String type,
            ResolveRequest request) {
        String path = "/api/v1/entities/" + type + "/resolve";
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.of(ErrorResponse.Code.INVALID_REQUEST, "Request body is required", path))
                    .build();
        }
        try {
            EntityResolver resolver = registry.get(type);
            EntityMention mention = new EntityMention(request.text(), type, request.value());
            int topK = request.topK() != null ? request.topK() : registry.getOptions().getTopK();
            ResolutionResult result = resolver.predict(mention, request.isExactMatchOnly(), topK);
            return Response.ok(ResolveResponse.from(type, request.text(), result)).build();
        } catch (RuntimeException e) {
            return errorResponse("resolve", path, e);
        }
    }

    /**
     * POST /api/v1/entities/{type}/fit?clean=true
     */
    @POST
    @Path("/{type}/fit")
    @Operation(summary = "Rebuild a synonym index",
            description = "Reloads the entity mapping and reindexes it; clean=true recreates the index first.")
    @APIResponse(responseCode = "200", description = "Index rebuilt")
    @APIResponse(responseCode = "400", description = "Mapping missing or invalid")
    @APIResponse(responseCode = "409", description = "Duplicate record id, or another rebuild is running")
    @APIResponse(responseCode = "503", description = "Search backend unavailable")
    public Response fit(
            @Parameter(description = "Entity type", required = true) @PathParam("type") String type,
            @Parameter(description = "Delete and recreate the index first") @QueryParam("clean")
            @DefaultValue("false") boolean clean) {
        String path = "/api/v1/entities/" + type + "/fit";
        try {
            FitResult result = registry.get(type).fit(clean);
            return Response.ok(FitResponse.from(result)).build();
        } catch (RuntimeException e) {
            return errorResponse("fit", path, e);
        }
    }

    /**
     * GET /api/v1/entities/health
     */
    @GET
    @Path("/health")
    @Operation(summary = "Aggregate health of the search backends")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = healthChecks.checkAll();
        Response.Status code = status.status().isServing() ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
        return Response.status(code).entity(status).build();
    }

    private Response errorResponse(String operation, String path, RuntimeException e) {
        ErrorResponse.Code code = codeFor(e);
        String message = e.getMessage();
        switch (code) {
            case BACKEND_UNAVAILABLE -> log.warn("{}.unavailable path={} error={}", operation, path, message);
            case INTERNAL -> {
                log.error("{}.failed path={} error={}", operation, path, message, e);
                message = "An internal error occurred. Check server logs for details.";
            }
            default -> log.debug("{}.rejected path={} code={} error={}", operation, path, code, message);
        }
        return Response.status(code.status()).entity(ErrorResponse.of(code, message, path)).build();
    }

    static ErrorResponse.Code codeFor(RuntimeException e) {
        if (e instanceof BackendUnavailableException) {
            return ErrorResponse.Code.BACKEND_UNAVAILABLE;
        }
        if (e instanceof IndexNotFoundException) {
            return ErrorResponse.Code.INDEX_NOT_FOUND;
        }
        if (e instanceof DuplicateIdentifierException) {
            return ErrorResponse.Code.DUPLICATE_IDENTIFIER;
        }
        if (e instanceof LockAcquisitionException) {
            return ErrorResponse.Code.FIT_IN_PROGRESS;
        }
        if (e instanceof MappingLoadException || e instanceof IllegalArgumentException) {
            return ErrorResponse.Code.INVALID_REQUEST;
        }
        return ErrorResponse.Code.INTERNAL;
    }

    /**
     * HTTP status for an exception raised while resolving or fitting.
     */
    static Response.Status statusFor(RuntimeException e) {
        return Response.Status.fromStatusCode(codeFor(e).status());
    }
}
