package com.contact.resolution.rest;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.api.ResolutionResult;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.health.HealthSnapshot;
import com.contact.resolution.health.HealthStatus;
import com.contact.resolution.rest.dto.ErrorResponse;
import com.contact.resolution.rest.dto.HealthResponse;
import com.contact.resolution.rest.dto.ResolveRequest;
import com.contact.resolution.rest.dto.ResolveResponse;
import com.contact.resolution.rest.security.RequiresRole;
import com.contact.resolution.rest.security.SecurityRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read endpoints: resolve a lookup and report health.
 */
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Contact Resolution", description = "Resolve contacts and inspect tier health")
@SecurityRequirement(name = "apiKey")
@RequiresRole(SecurityRole.VIEWER)
public class ContactResolutionResource {
    private static final Logger log = LoggerFactory.getLogger(ContactResolutionResource.class);

    static final String RESOLVE_PATH = "/api/v1/lookups/resolve";

    private final ContactResolver resolver;

    @Inject
    public ContactResolutionResource(ContactResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * POST /api/v1/lookups/resolve
     */
    @POST
    @Path("/lookups/resolve")
    @Operation(summary = "Resolve a phone number or email address",
            description = "Walks the cache tiers and falls back to the system of record on a full miss.")
    @APIResponse(responseCode = "200", description = "Resolved, or a miss with a null canonicalId")
    @APIResponse(responseCode = "400", description = "Unknown lookup type")
    public Response resolve(ResolveRequest request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("Request body is required", RESOLVE_PATH))
                    .build();
        }
        LookupType type;
        try {
            type = LookupType.fromString(request.type());
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), RESOLVE_PATH))
                    .build();
        }
        try {
            ResolutionResult result = resolver.resolve(request.lookup(), type);
            return Response.ok(ResolveResponse.from(result)).build();
        } catch (RuntimeException e) {
            log.error("resolve.failed type={} lookup={} error={}", type.getPrefix(), request.lookup(),
                    e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.",
                            RESOLVE_PATH))
                    .build();
        }
    }

    /**
     * GET /api/v1/health
     */
    @GET
    @Path("/health")
    @Operation(summary = "Health snapshot",
            description = "Latest drift monitor snapshot with performance counters.")
    @APIResponse(responseCode = "200", description = "OK or WARNING")
    @APIResponse(responseCode = "503", description = "CRITICAL")
    public Response health() {
        HealthSnapshot snapshot = resolver.getHealthSnapshot();
        Response.Status status = snapshot.status() == HealthStatus.Status.CRITICAL
                ? Response.Status.SERVICE_UNAVAILABLE
                : Response.Status.OK;
        return Response.status(status).entity(HealthResponse.from(snapshot)).build();
    }
}
