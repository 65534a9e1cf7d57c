package io.github.chirino.social.security;

import io.quarkus.security.identity.SecurityIdentity;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;
import java.io.IOException;
import org.jboss.logging.Logger;

/** Logs every social API call before authentication runs. */
@Provider
@Priority(Priorities.AUTHENTICATION - 1)
public class RequestLoggingFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    @Inject SecurityIdentity identity;

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        String path = requestContext.getUriInfo().getPath();
        if (path.startsWith("/v1/health")) {
            return;
        }
        String authHeader = requestContext.getHeaderString("Authorization");
        LOG.debugf(
                "%s %s, bearer token present: %b",
                requestContext.getMethod(), path, authHeader != null && !authHeader.isEmpty());

        if (identity != null && !identity.isAnonymous()) {
            LOG.debugf("Caller: %s", identity.getPrincipal().getName());
        }
    }
}
