package com.contact.resolution.rest;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.cache.TierUnavailableException;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.invalidation.InvalidationOutcome;
import com.contact.resolution.rest.dto.ErrorResponse;
import com.contact.resolution.rest.dto.InvalidateRequest;
import com.contact.resolution.rest.dto.InvalidateResponse;
import com.contact.resolution.rest.security.RequiresRole;
import com.contact.resolution.rest.security.SecurityRole;
import com.contact.resolution.store.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
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
 * Operator endpoint for forcing a lookup back to the system of record.
 */
@Path("/api/v1/cache")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Cache Administration", description = "Invalidate cached contact mappings")
@SecurityRequirement(name = "apiKey")
@RequiresRole(SecurityRole.OPERATOR)
public class CacheAdminResource {
    private static final Logger log = LoggerFactory.getLogger(CacheAdminResource.class);

    static final String INVALIDATE_PATH = "/api/v1/cache/invalidate";

    private final ContactResolver resolver;

    @Inject
    public CacheAdminResource(ContactResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * POST /api/v1/cache/invalidate
     */
    @POST
    @Path("/invalidate")
    @Operation(summary = "Invalidate a cached mapping",
            description = "Clears the distributed and local caches for the lookup and marks the "
                    + "authoritative record invalidated so the next resolution consults the system of record.")
    @APIResponse(responseCode = "200", description = "Mapping invalidated")
    @APIResponse(responseCode = "400", description = "Unknown type or lookup normalizes to nothing")
    @APIResponse(responseCode = "401", description = "Missing or invalid API key")
    @APIResponse(responseCode = "403", description = "Requires OPERATOR")
    @APIResponse(responseCode = "500", description = "Storage failure")
    public Response invalidate(InvalidateRequest request) {
        if (request == null) {
            return badRequest("Request body is required");
        }
        LookupType type;
        try {
            type = LookupType.fromString(request.type());
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
        try {
            InvalidationOutcome outcome = resolver.invalidate(type, request.lookup(), request.reason());
            if (!outcome.invalidated()) {
                return badRequest("Lookup '" + request.lookup() + "' is empty after normalization");
            }
            return Response.ok(InvalidateResponse.from(outcome)).build();
        } catch (StorageException | TierUnavailableException e) {
            log.error("invalidate.failed type={} lookup={} error={}", type.getPrefix(), request.lookup(),
                    e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("Invalidation failed: storage unavailable", INVALIDATE_PATH))
                    .build();
        }
    }

    private static Response badRequest(String message) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(message, INVALIDATE_PATH))
                .build();
    }
}
