/* (C)2026 */
package com.ammann.calibration.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.time.LocalDateTime;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Per-call input errors become 400 responses naming the offending field. Calibration
 * errors are fatal at startup and only surface here if raised later. Unhandled
 * exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof JsonProcessingException json) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    "Malformed request body: " + json.getOriginalMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof ManifestEntryNotFoundException
                || exception instanceof LayerNotFoundException
                || exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof CalibrationException) {
            LOG.errorf("Calibration error on path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR,
                    exception.getMessage(),
                    "CALIBRATION_ERROR",
                    path
            );
        }

        if (exception instanceof SomeThingWentWrongException) {
            LOG.error("Internal failure on path " + path, exception);
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR,
                    exception.getMessage(),
                    "INTERNAL_ERROR",
                    path
            );
        }

        if (exception instanceof WebApplicationException web) {
            Response.Status status = Response.Status.fromStatusCode(web.getResponse().getStatus());
            if (status != null && status.getFamily() == Response.Status.Family.CLIENT_ERROR) {
                return createResponse(status, exception.getMessage(), status.name(), path);
            }
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }


    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse
    {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message)
        {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status)
        {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
