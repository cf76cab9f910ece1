package info.mouts.foodorders.exception;

import info.mouts.foodorders.domain.OrderStatus;

/**
 * Thrown when a status change is not allowed from the order's current status,
 * including any change requested on a delivered, cancelled or returned order.
 */
public class OrderStateConflictException extends ResourceConflictException {
    public OrderStateConflictException(String orderId, OrderStatus current, OrderStatus requested) {
        super("ILLEGAL_STATUS_TRANSITION", current.isTerminal()
                ? "Order " + orderId + " is already " + current + " and can no longer change status"
                : "Order " + orderId + " cannot move from " + current + " to " + requested);
    }
}
