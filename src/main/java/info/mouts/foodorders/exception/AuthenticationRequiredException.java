package info.mouts.foodorders.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationRequiredException extends ApiException {
    public AuthenticationRequiredException(String message) {
        super(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_ERROR", message);
    }

    public AuthenticationRequiredException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_ERROR", message, cause);
    }
}
