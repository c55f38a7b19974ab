package info.mouts.restaurantservice.exception;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the REST controllers.
 * Uses {@link RestControllerAdvice} to centralize exception handling logic.
 * Maps specific exceptions to appropriate HTTP status codes and formats
 * responses using the Problem Details for HTTP APIs standard (RFC 7807).
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {
    /**
     * Capture {@link ValidationException} and returns HTTP 400 Bad Request.
     * Every broken rule is listed under the {@code violations} property.
     *
     * @param ex      The caught {@link ValidationException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleValidationException(ValidationException ex, WebRequest request) {
        log.warn("Handling ValidationException: {}", ex.getMessage());

        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
        problemDetail.setProperty("violations", ex.getViolations());

        return problemDetail;
    }

    /**
     * Capture {@link MenuItemReferenceException} and returns HTTP 400 Bad Request.
     * The title tells a missing menu item apart from an unavailable one.
     *
     * @param ex      The caught {@link MenuItemReferenceException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MenuItemReferenceException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMenuItemReferenceException(MenuItemReferenceException ex, WebRequest request) {
        log.warn("Handling MenuItemReferenceException ({}): {}", ex.getReason(), ex.getMessage());

        String title = ex.getReason() == MenuItemReferenceException.Reason.NOT_FOUND
                ? "Menu Item Not Found"
                : "Menu Item Unavailable";

        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST, title, ex.getMessage(), request);
        problemDetail.setProperty("menuItemId", ex.getMenuItemId());

        return problemDetail;
    }

    @ExceptionHandler(MenuItemNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleMenuItemNotFoundException(MenuItemNotFoundException ex, WebRequest request) {
        log.warn("Handling MenuItemNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Menu Item Not Found", ex.getMessage(), request);
    }

    /**
     * Capture {@link OrderNotFoundException} and returns HTTP 404 Not Found.
     *
     * @param ex      The caught {@link OrderNotFoundException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(OrderNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleOrderNotFoundException(OrderNotFoundException ex, WebRequest request) {
        log.warn("Handling OrderNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Order Not Found", ex.getMessage(), request);
    }

    /**
     * Capture {@link OrderItemNotFoundException} and returns HTTP 404 Not Found.
     *
     * @param ex      The caught {@link OrderItemNotFoundException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(OrderItemNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleOrderItemNotFoundException(OrderItemNotFoundException ex, WebRequest request) {
        log.warn("Handling OrderItemNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Order Item Not Found", ex.getMessage(), request);
    }

    /**
     * Capture {@link MethodArgumentTypeMismatchException} and returns HTTP 400 Bad
     * Request.
     * This typically occurs when a path variable expected to be a numeric ID
     * cannot be parsed.
     *
     * @param ex      The caught {@link MethodArgumentTypeMismatchException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException ex,
            WebRequest request) {
        log.warn("Handling MethodArgumentTypeMismatchException: {}", ex.getMessage());

        String detail = "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'";
        return problem(HttpStatus.BAD_REQUEST, "Invalid Path Variable", detail, request);
    }

    /**
     * Capture {@link HttpMessageNotReadableException} and returns HTTP 400 Bad
     * Request. Raised for malformed JSON and for enum values outside the
     * accepted set, such as an unknown order status.
     *
     * @param ex      The caught {@link HttpMessageNotReadableException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleHttpMessageNotReadableException(HttpMessageNotReadableException ex,
            WebRequest request) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Malformed Request",
                "The request body could not be read: " + ex.getMostSpecificCause().getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentNotValidException(MethodArgumentNotValidException ex,
            WebRequest request) {
        log.warn("Handling MethodArgumentNotValidException: {}", ex.getMessage());

        List<Map<String, String>> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of("field", error.getField(),
                        "message", String.valueOf(error.getDefaultMessage())))
                .toList();

        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request body failed validation", request);
        problemDetail.setProperty("violations", violations);

        return problemDetail;
    }

    /**
     * Capture {@link IllegalArgumentException} and returns HTTP 400 Bad Request.
     * Raised when a path segment names an unknown menu category.
     *
     * @param ex      The caught {@link IllegalArgumentException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
        log.warn("Handling IllegalArgumentException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Invalid Path Variable", ex.getMessage(), request);
    }

    /**
     * Catches any other unhandled exceptions that may occur during request
     * processing.
     * Returns HTTP 500 Internal Server Error with a generic message to avoid
     * exposing internal details.
     *
     * @param ex      The caught {@link Exception}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception: {}", ex.getMessage(), ex);

        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected internal error occurred.", request);
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setProperty("timestamp", Instant.now());
        problemDetail.setInstance(URI.create(request.getDescription(false)));

        return problemDetail;
    }
}
