package info.mouts.foodorders.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an order number could not be allocated after every retry
 * attempt was spent on conflicting transactions.
 */
public class SequenceAllocationException extends ApiException {
    public SequenceAllocationException(int attempts, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "ALLOCATION_FAILED",
                "Failed to allocate an order number after " + attempts + " attempts", cause);
    }
}
