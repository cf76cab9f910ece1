package info.mouts.foodorders.dto;

import java.math.BigDecimal;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Order placed by a client")
public class OrderRequestDTO {
    @Schema(description = "Optional client-chosen identifier, ignored by the sequential submit endpoint", example = "a7d2f9c4-client-order")
    @Size(max = 64, message = "Order ID must be at most 64 characters")
    @Pattern(regexp = "[A-Za-z0-9_-]+", message = "Order ID may only contain letters, digits, '-' and '_'")
    private String orderId;

    @NotNull(message = "Item list cannot be null in order request")
    @NotEmpty(message = "Order must have at least one item in order request")
    @Valid
    private List<OrderItemRequestDTO> items;

    @Schema(description = "Total amount charged for the order", example = "19.00")
    @NotNull(message = "Total amount cannot be null in order request")
    @DecimalMin(value = "0", inclusive = false, message = "Total amount must be positive in order request")
    @Digits(integer = 10, fraction = 2, message = "Total amount supports at most 2 decimal places in order request")
    private BigDecimal totalAmount;

    @Schema(description = "Where the order is delivered", example = "12 Rue Didouche Mourad, Alger")
    @NotBlank(message = "Delivery location cannot be blank in order request")
    private String deliveryLocation;
}
