package tech.idvault.platform.authentication;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;
import tech.idvault.platform.shared.ErrorResponses;

import java.lang.reflect.Method;

/**
 * JAX-RS filter guarding every {@link Secured} resource.
 *
 * Verifies the bearer token exactly once per request and, on success, publishes the
 * typed principal through {@link SessionContext}. Failures abort the request.
 */
@Provider
@Secured
@Priority(Priorities.AUTHENTICATION)
public class AccessGateFilter implements ContainerRequestFilter {

    @Inject
    AccessGate accessGate;

    @Inject
    SessionContext sessionContext;

    @Context
    ResourceInfo resourceInfo;

    @Override
    public void filter(ContainerRequestContext ctx) {
        try {
            AuthenticatedUser user = accessGate.authorize(
                ctx.getHeaderString(HttpHeaders.AUTHORIZATION), requiresAdmin());
            sessionContext.setPrincipal(user);
        } catch (WebApplicationException e) {
            ctx.abortWith(ErrorResponses.from(e));
        }
    }

    private boolean requiresAdmin() {
        Method method = resourceInfo.getResourceMethod();
        if (method != null) {
            Secured onMethod = method.getAnnotation(Secured.class);
            if (onMethod != null) {
                return onMethod.adminOnly();
            }
        }
        Class<?> resourceClass = resourceInfo.getResourceClass();
        if (resourceClass != null) {
            Secured onClass = resourceClass.getAnnotation(Secured.class);
            return onClass != null && onClass.adminOnly();
        }
        return false;
    }
}
