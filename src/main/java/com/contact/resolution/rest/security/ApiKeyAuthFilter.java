package com.contact.resolution.rest.security;

import com.contact.resolution.rest.dto.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Principal;

/**
 * Authenticates admin API requests by API key.
 *
 * <p>Looks the key up in {@link SecurityConfig}, stores the caller's {@link SecurityRole}
 * as a request property for {@link RoleAuthorizationFilter} and installs a matching
 * {@link SecurityContext}. Missing or unknown keys get {@code 401}.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class ApiKeyAuthFilter implements ContainerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

    public static final String ROLE_PROPERTY = "contact-resolution.security.role";

    private final SecurityConfig securityConfig;

    public ApiKeyAuthFilter(SecurityConfig securityConfig) {
        this.securityConfig = securityConfig;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }
        String path = requestContext.getUriInfo().getPath();
        String apiKey = requestContext.getHeaderString(securityConfig.getApiKeyHeader());
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("auth.rejected reason=missing_api_key path={}", path);
            requestContext.abortWith(unauthorized("Missing API key in header '"
                    + securityConfig.getApiKeyHeader() + "'", path));
            return;
        }

        SecurityRole role = securityConfig.getRoleForKey(apiKey);
        if (role == null) {
            log.warn("auth.rejected reason=invalid_api_key key={} path={}", mask(apiKey), path);
            requestContext.abortWith(unauthorized("Invalid API key", path));
            return;
        }

        requestContext.setProperty(ROLE_PROPERTY, role);
        requestContext.setSecurityContext(new ApiKeySecurityContext(mask(apiKey), role,
                requestContext.getSecurityContext() != null && requestContext.getSecurityContext().isSecure()));
        log.debug("auth.success role={} path={}", role, path);
    }

    private static Response unauthorized(String message, String path) {
        return Response.status(Response.Status.UNAUTHORIZED)
                .entity(new ErrorResponse(401, "Unauthorized", message, path))
                .build();
    }

    static String mask(String key) {
        if (key.length() <= 8) {
            return "****";
        }
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }

    private record ApiKeySecurityContext(String maskedKey, SecurityRole role, boolean secure)
            implements SecurityContext {

        @Override
        public Principal getUserPrincipal() {
            return () -> maskedKey;
        }

        @Override
        public boolean isUserInRole(String roleName) {
            try {
                return role.hasPermission(SecurityRole.fromString(roleName));
            } catch (IllegalArgumentException e) {
                return false;
            }
        }

        @Override
        public boolean isSecure() {
            return secure;
        }

        @Override
        public String getAuthenticationScheme() {
            return "API-KEY";
        }
    }
}
