package info.mouts.foodorders.event;

/**
 * Subscription primitive over committed order changes.
 */
public interface OrderChangeStream {

    /**
     * Opens a subscription over the {@code windowSize} most recent orders by
     * creation time. The current window is delivered first as
     * {@link OrderChangeType#ADDED} changes, followed by every committed
     * change that falls inside the window at the time it happens. Removals
     * are always delivered.
     *
     * @param windowSize number of most recent orders watched
     * @param listener   callback receiving the changes
     * @return the subscription handle
     */
    OrderChangeSubscription subscribe(int windowSize, OrderChangeListener listener);

    /**
     * @return the number of subscriptions not cancelled yet
     */
    int activeSubscriptions();
}
