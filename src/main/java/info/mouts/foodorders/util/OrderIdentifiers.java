package info.mouts.foodorders.util;

import java.util.UUID;

/**
 * Helpers for building order identifiers.
 */
public final class OrderIdentifiers {
    public static final String SEQUENTIAL_PREFIX = "ORD";

    private OrderIdentifiers() {
    }

    /**
     * Builds the identifier of a sequentially numbered order.
     *
     * @param orderNumber the allocated number
     * @return {@code ORD} followed by the decimal number, e.g. {@code ORD42}
     */
    public static String sequential(long orderNumber) {
        return SEQUENTIAL_PREFIX + orderNumber;
    }

    public static String random() {
        return UUID.randomUUID().toString();
    }
}
