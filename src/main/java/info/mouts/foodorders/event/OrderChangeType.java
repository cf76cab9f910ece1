package info.mouts.foodorders.event;

/**
 * Kind of change observed on an order row.
 */
public enum OrderChangeType {
    ADDED,
    MODIFIED,
    REMOVED
}
