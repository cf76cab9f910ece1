package info.mouts.foodorders.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * Thrown when a request payload is malformed, misses a required field or
 * names a value outside its allowed range. {@link #getFieldErrors()} maps each
 * offending field to its message.
 */
@Getter
public class InvalidRequestException extends ApiException {
    private final Map<String, String> fieldErrors;

    public InvalidRequestException(String message) {
        this(message, Collections.emptyMap());
    }

    public InvalidRequestException(String field, String message) {
        this(message, Map.of(field, message));
    }

    public InvalidRequestException(String message, Map<String, String> fieldErrors) {
        super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }
}
