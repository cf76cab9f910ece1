package info.mouts.foodorders.exception;

/**
 * Thrown when an order does not exist or is not visible to the caller.
 * Foreign-owned orders are reported the same way as missing ones.
 */
public class OrderNotFoundException extends ResourceNotFoundException {
    public OrderNotFoundException(String orderId) {
        super("Order", orderId);
    }
}
