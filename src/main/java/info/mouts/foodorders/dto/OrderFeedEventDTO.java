package info.mouts.foodorders.dto;

import java.math.BigDecimal;
import java.time.Instant;

import info.mouts.foodorders.domain.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a live order feed event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderFeedEventDTO {
    public static final String NEW_ORDER = "new_order";
    public static final String ORDER_UPDATE = "order_update";

    private String type;
    private String id;
    private String orderId;
    private Long orderNumber;
    private BigDecimal totalAmount;
    private OrderStatus status;
    private Instant timestamp;
}
