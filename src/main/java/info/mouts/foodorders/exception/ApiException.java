package info.mouts.foodorders.exception;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * Base class of every exception that maps onto a client-visible error
 * response. Carries the HTTP status and a machine-readable code.
 */
@Getter
public abstract class ApiException extends RuntimeException {
    private final HttpStatus status;
    private final String code;

    protected ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected ApiException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
