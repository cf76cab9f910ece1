package info.mouts.foodorders.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import info.mouts.foodorders.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
@Relation(collectionRelation = "orders", itemRelation = "order")
@Schema(description = "Detailed information about an order")
public class OrderResponseDTO extends RepresentationModel<OrderResponseDTO> {
    @Schema(description = "Order identifier", example = "ORD42")
    private String id;

    @Schema(description = "Sequential order number, absent for orders created with their own identifier", example = "42")
    private Long orderNumber;

    @Schema(description = "Principal id of the owner", example = "uid-123")
    private String userId;

    private List<OrderItemResponseDTO> items;

    @Schema(description = "Total amount of the order", example = "19.00")
    private BigDecimal totalAmount;

    @Schema(description = "Delivery location", example = "12 Rue Didouche Mourad, Alger")
    private String deliveryLocation;

    @Schema(description = "Current status of the order", example = "PENDING")
    private OrderStatus status;

    @Schema(description = "Timestamp when the order was created", example = "2025-04-01T12:00:00Z")
    private Instant createdAt;

    @Schema(description = "Timestamp of the last change", example = "2025-04-01T12:05:00Z")
    private Instant updatedAt;
}
