package info.mouts.foodorders.exception;

/**
 * Thrown by a push-delivery client when the gateway did not accept a message.
 * Never surfaces to API clients; callers log it and carry on.
 */
public class PushDeliveryException extends RuntimeException {
    public PushDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
