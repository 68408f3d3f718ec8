package tech.idvault.platform.shared;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Renders every exception escaping a resource as an {@link ErrorResponse}.
 *
 * REST exceptions keep their status and short message. Anything else (driver errors,
 * crypto failures, bugs) becomes a generic 500; the detail stays in the server log.
 */
@Provider
public class ApiExceptionMapper implements ExceptionMapper<Exception> {

    private static final Logger LOG = Logger.getLogger(ApiExceptionMapper.class);

    @Override
    public Response toResponse(Exception exception) {
        if (exception instanceof WebApplicationException wae) {
            if (wae.getResponse() != null && wae.getResponse().getStatus() >= 500) {
                LOG.errorf(wae, "Request failed with status %d", wae.getResponse().getStatus());
            }
            return ErrorResponses.from(wae);
        }
        LOG.error("Unhandled exception while processing request", exception);
        return ErrorResponses.internalError();
    }
}
