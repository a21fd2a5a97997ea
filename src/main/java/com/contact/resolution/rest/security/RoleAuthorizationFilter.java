package com.contact.resolution.rest.security;

import com.contact.resolution.rest.dto.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;

/**
 * Enforces {@link RequiresRole} against the role set by {@link ApiKeyAuthFilter}.
 * Callers below the required role get {@code 403}.
 */
@Provider
@Priority(Priorities.AUTHORIZATION)
public class RoleAuthorizationFilter implements ContainerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RoleAuthorizationFilter.class);

    private final SecurityConfig securityConfig;

    @Context
    private ResourceInfo resourceInfo;

    public RoleAuthorizationFilter(SecurityConfig securityConfig) {
        this.securityConfig = securityConfig;
    }

    RoleAuthorizationFilter(SecurityConfig securityConfig, ResourceInfo resourceInfo) {
        this.securityConfig = securityConfig;
        this.resourceInfo = resourceInfo;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }
        RequiresRole requirement = requirement();
        if (requirement == null) {
            return;
        }
        String path = requestContext.getUriInfo().getPath();
        Object caller = requestContext.getProperty(ApiKeyAuthFilter.ROLE_PROPERTY);
        if (!(caller instanceof SecurityRole callerRole) || !callerRole.hasPermission(requirement.value())) {
            log.warn("authz.rejected callerRole={} requiredRole={} path={}", caller, requirement.value(), path);
            requestContext.abortWith(Response.status(Response.Status.FORBIDDEN)
                    .entity(new ErrorResponse(403, "Forbidden",
                            "Requires role " + requirement.value(), path))
                    .build());
        }
    }

    private RequiresRole requirement() {
        if (resourceInfo == null) {
            return null;
        }
        Method method = resourceInfo.getResourceMethod();
        if (method != null && method.isAnnotationPresent(RequiresRole.class)) {
            return method.getAnnotation(RequiresRole.class);
        }
        Class<?> resourceClass = resourceInfo.getResourceClass();
        return resourceClass != null ? resourceClass.getAnnotation(RequiresRole.class) : null;
    }
}
