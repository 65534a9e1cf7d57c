package io.github.chirino.social.api;

import io.github.chirino.social.api.dto.ErrorResponse;
import io.github.chirino.social.service.ErrorKind;
import io.github.chirino.social.service.InternalFailureException;
import io.github.chirino.social.service.InvalidStateException;
import io.github.chirino.social.service.ResourceNotFoundException;
import io.github.chirino.social.service.SocialException;
import io.github.chirino.social.service.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.ElementKind;
import jakarta.validation.Path;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps classified engine failures to HTTP statuses and structured JSON error bodies; anything
 * unclassified is logged with its stack trace and returned as a 500.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    static Response.Status statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> Response.Status.BAD_REQUEST;
            case NOT_FOUND -> Response.Status.NOT_FOUND;
            case FORBIDDEN -> Response.Status.FORBIDDEN;
            case INVALID_STATE -> Response.Status.CONFLICT;
            case INTERNAL -> Response.Status.INTERNAL_SERVER_ERROR;
        };
    }

    @ServerExceptionMapper
    public Response handleSocialException(SocialException e) {
        ErrorKind kind = e.getKind();
        Map<String, Object> details = new HashMap<>();
        String message = e.getMessage();
        if (e instanceof ValidationException validation && validation.getField() != null) {
            details.put("field", validation.getField());
        } else if (e instanceof ResourceNotFoundException notFound) {
            details.put("resource", notFound.getResource());
            details.put("id", notFound.getId());
        } else if (e instanceof InvalidStateException invalidState) {
            details.put("resource", invalidState.getResource());
            details.put("state", invalidState.getState());
        } else if (e instanceof InternalFailureException internal) {
            // the cause was logged where it was wrapped
            details.put("operation", internal.getOperation());
            message = "Internal server error";
        }
        if (kind.isRecoverable()) {
            LOG.debugf("Request failed with %s: %s", kind.code(), message);
        }
        ErrorResponse error =
                new ErrorResponse(message, kind.code(), details.isEmpty() ? null : details);
        return Response.status(statusFor(kind))
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }

    @ServerExceptionMapper
    public Response handleConstraintViolation(ConstraintViolationException e) {
        List<Map<String, String>> violations =
                e.getConstraintViolations().stream()
                        .map(
                                v ->
                                        Map.of(
                                                "field", extractFieldName(v),
                                                "message", v.getMessage()))
                        .toList();
        ErrorResponse error =
                new ErrorResponse(
                        "Validation failed",
                        ErrorKind.VALIDATION.code(),
                        Map.of("violations", violations));
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }

    /** The innermost bean property of the violation, skipping method, parameter and list nodes. */
    static String extractFieldName(ConstraintViolation<?> violation) {
        String field = null;
        for (Path.Node node : violation.getPropertyPath()) {
            if (node.getKind() == ElementKind.PROPERTY) {
                field = node.getName();
            }
        }
        return field != null ? field : violation.getPropertyPath().toString();
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        ErrorResponse error =
                new ErrorResponse(
                        "Internal server error",
                        ErrorKind.INTERNAL.code(),
                        Map.of(
                                "message",
                                e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }
}
