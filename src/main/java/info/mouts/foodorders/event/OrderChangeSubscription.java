package info.mouts.foodorders.event;

/**
 * Handle of a live subscription on the {@link OrderChangeStream}.
 */
public interface OrderChangeSubscription {
    /**
     * Stops the delivery of changes. Calling it more than once has no further
     * effect.
     *
     * @return {@code true} if this call cancelled the subscription
     */
    boolean cancel();

    boolean isActive();
}
