package info.mouts.foodorders.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Details of an item within an order response")
public class OrderItemResponseDTO {
    @Schema(description = "Catalog identifier of the product", example = "p1")
    private String productId;

    @Schema(description = "Display name of the product", example = "Pizza")
    private String name;

    @Schema(description = "Quantity ordered", example = "2")
    private BigDecimal quantity;

    @Schema(description = "Price per unit of the product", example = "9.50")
    private BigDecimal price;
}
