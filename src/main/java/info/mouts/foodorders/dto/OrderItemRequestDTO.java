package info.mouts.foodorders.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderItemRequestDTO {

    @NotBlank(message = "Product ID cannot be blank in item request")
    private String productId;

    @NotBlank(message = "Product name cannot be blank in item request")
    private String name;

    @NotNull(message = "Quantity cannot be null in item request")
    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be positive in item request")
    @Digits(integer = 7, fraction = 3, message = "Quantity supports at most 3 decimal places in item request")
    private BigDecimal quantity;

    @NotNull(message = "Price cannot be null in item request")
    @DecimalMin(value = "0", inclusive = false, message = "Price must be positive in item request")
    @Digits(integer = 10, fraction = 2, message = "Price supports at most 2 decimal places in item request")
    private BigDecimal price;
}
