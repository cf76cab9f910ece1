package info.mouts.foodorders.event;

import java.math.BigDecimal;
import java.time.Instant;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.domain.OrderStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of an order taken when it changed. Only scalar fields are
 * copied, so the snapshot stays readable after the persistence context that
 * produced it is closed.
 */
@Value
@Builder
public class OrderChange {
    OrderChangeType type;
    String orderId;
    Long orderNumber;
    String userId;
    BigDecimal totalAmount;
    OrderStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static OrderChange of(OrderChangeType type, Order order) {
        return OrderChange.builder()
                .type(type)
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .userId(order.getUserId())
                .totalAmount(order.getTotalAmount())
                .status(order.getStatus())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    public boolean isRemoval() {
        return type == OrderChangeType.REMOVED;
    }
}
