package tech.idvault.platform.shared;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Builds the JSON error responses shared by the exception mapper and the access gate filter.
 */
public final class ErrorResponses {

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private ErrorResponses() {
    }

    public static Response from(WebApplicationException e) {
        int status = e.getResponse() != null ? e.getResponse().getStatus() : 500;
        String message = e.getMessage() != null ? e.getMessage() : INTERNAL_ERROR_MESSAGE;
        Response.ResponseBuilder builder = Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(codeFor(status), message));
        if (status == Response.Status.UNAUTHORIZED.getStatusCode()) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return builder.build();
    }

    public static Response internalError() {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(codeFor(500), INTERNAL_ERROR_MESSAGE))
            .build();
    }

    static String codeFor(int status) {
        return switch (status) {
            case 400 -> "bad_request";
            case 401 -> "unauthorized";
            case 403 -> "forbidden";
            case 404 -> "not_found";
            case 405 -> "method_not_allowed";
            case 409 -> "conflict";
            case 415 -> "unsupported_media_type";
            default -> status >= 500 ? "internal_error" : "error";
        };
    }
}
