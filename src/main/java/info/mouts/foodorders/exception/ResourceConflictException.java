package info.mouts.foodorders.exception;

import org.springframework.http.HttpStatus;

public class ResourceConflictException extends ApiException {
    public ResourceConflictException(String message) {
        super(HttpStatus.CONFLICT, "CONFLICT", message);
    }

    protected ResourceConflictException(String code, String message) {
        super(HttpStatus.CONFLICT, code, message);
    }
}
