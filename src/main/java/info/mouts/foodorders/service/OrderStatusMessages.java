package info.mouts.foodorders.service;

import java.util.Locale;
import java.util.Map;

import info.mouts.foodorders.domain.OrderStatus;

/**
 * Texts of the notifications sent when an order changes status.
 */
public final class OrderStatusMessages {
    public static final String TITLE = "Order Update";

    private static final Map<String, String> BODIES = Map.ofEntries(
            Map.entry("PENDING", "⏳ Your order is pending confirmation"),
            Map.entry("CONFIRMED", "✅ Your order has been confirmed!"),
            Map.entry("PREPARING", "👨‍🍳 Your order is being prepared"),
            Map.entry("PREPARING_ORDER", "👨‍🍳 Your order is being prepared"),
            Map.entry("READY_FOR_PICKUP", "📦 Your order is ready for pickup!"),
            Map.entry("OUT_FOR_DELIVERY", "🚚 Your order is on the way!"),
            Map.entry("ON_WAY", "🚚 Your order is on the way!"),
            Map.entry("DELIVERED", "✨ Your order has been delivered!"),
            Map.entry("CANCELLED", "❌ Your order has been cancelled"),
            Map.entry("RETURNED", "↩️ Your order has been returned"));

    private OrderStatusMessages() {
    }

    public static String bodyFor(OrderStatus status) {
        return bodyFor(status.name());
    }

    /**
     * @param statusValue a canonical status name or alias
     * @return the message body, or {@code "Order status: <value>"} for values
     *         without a dedicated text
     */
    public static String bodyFor(String statusValue) {
        String body = statusValue == null ? null : BODIES.get(statusValue.trim().toUpperCase(Locale.ROOT));
        return body != null ? body : "Order status: " + statusValue;
    }
}
