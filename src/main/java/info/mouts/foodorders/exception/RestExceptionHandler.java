package info.mouts.foodorders.exception;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import info.mouts.foodorders.dto.ErrorResponseDTO;
import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the REST controllers.
 * Uses {@link RestControllerAdvice} to centralize exception handling logic.
 * Every failure is rendered as an {@link ErrorResponseDTO} envelope carrying
 * the HTTP status, a message and, where useful, a machine-readable code and
 * details.
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {
    private final boolean exposeDetails;

    /**
     * Constructs an instance of {@code RestExceptionHandler}.
     *
     * @param exposeDetails whether unexpected errors reveal their message to
     *                      the client
     */
    public RestExceptionHandler(@Value("${app.errors.expose-details:false}") boolean exposeDetails) {
        this.exposeDetails = exposeDetails;
    }

    /**
     * Capture {@link ApiException} and its subclasses, answering with the
     * status the exception carries.
     *
     * @param ex      The caught {@link ApiException}.
     * @param request The current web request.
     * @return The error envelope.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponseDTO> handleApiException(ApiException ex, WebRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Handling {} on {}: {}", ex.getClass().getSimpleName(), request.getDescription(false),
                    ex.getMessage(), ex);
        } else {
            log.warn("Handling {} on {}: {}", ex.getClass().getSimpleName(), request.getDescription(false),
                    ex.getMessage());
        }

        Object details = null;
        if (ex instanceof InvalidRequestException invalid && !invalid.getFieldErrors().isEmpty()) {
            details = invalid.getFieldErrors();
        }

        return build(ex.getStatus(), ex.getMessage(), ex.getCode(), details);
    }

    /**
     * Capture {@link MethodArgumentNotValidException}, raised when a
     * {@code @Valid} request body fails bean validation, and returns HTTP 400
     * with one entry per offending field.
     *
     * @param ex The caught {@link MethodArgumentNotValidException}.
     * @return The error envelope.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDTO> handleMethodArgumentNotValidException(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.warn("Handling MethodArgumentNotValidException: {}", fieldErrors);

        String message = fieldErrors.isEmpty() ? "Invalid request" : fieldErrors.values().iterator().next();
        return build(HttpStatus.BAD_REQUEST, message, "VALIDATION_ERROR", fieldErrors.isEmpty() ? null : fieldErrors);
    }

    /**
     * Capture {@link HttpMessageNotReadableException} and returns HTTP 400.
     * Occurs on malformed JSON, wrong value types or unknown fields in a patch.
     *
     * @param ex The caught {@link HttpMessageNotReadableException}.
     * @return The error envelope.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDTO> handleHttpMessageNotReadableException(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMostSpecificCause().getMessage());

        return build(HttpStatus.BAD_REQUEST, "Malformed request body", "VALIDATION_ERROR", null);
    }

    /**
     * Capture {@link MethodArgumentTypeMismatchException} and returns HTTP 400
     * Bad Request. This typically occurs when a path variable or request
     * parameter cannot be converted to its declared type.
     *
     * @param ex The caught {@link MethodArgumentTypeMismatchException}.
     * @return The error envelope.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDTO> handleMethodArgumentTypeMismatchException(
            MethodArgumentTypeMismatchException ex) {
        log.warn("Handling MethodArgumentTypeMismatchException: {}", ex.getMessage());

        return build(HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "'",
                "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponseDTO> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Handling MissingServletRequestParameterException: {}", ex.getMessage());

        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponseDTO> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), "METHOD_NOT_ALLOWED", null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponseDTO> handleNoResourceFound(NoResourceFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "Endpoint not found", "NOT_FOUND", null);
    }

    /**
     * Catches any other unhandled exceptions that may occur during request
     * processing. Returns HTTP 500 with a generic message unless detail
     * exposure is switched on.
     *
     * @param ex      The caught {@link Exception}.
     * @param request The current web request.
     * @return The error envelope.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception on {}: {}", request.getDescription(false), ex.getMessage(), ex);

        String message = exposeDetails && ex.getMessage() != null ? ex.getMessage()
                : "An unexpected internal error occurred.";
        return build(HttpStatus.INTERNAL_SERVER_ERROR, message, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ErrorResponseDTO> build(HttpStatus status, String message, String code, Object details) {
        ErrorResponseDTO body = ErrorResponseDTO.builder()
                .message(message)
                .statusCode(status.value())
                .code(code)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
