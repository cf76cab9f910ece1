package info.mouts.foodorders.event;

/**
 * Callback receiving the changes of an {@link OrderChangeSubscription}. It is
 * invoked on the thread that committed the change and must not block.
 */
@FunctionalInterface
public interface OrderChangeListener {
    void onChange(OrderChange change);
}
