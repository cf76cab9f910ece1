package info.mouts.foodorders.dto;

import java.math.BigDecimal;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAnySetter;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial order update. Absent (null) fields are left untouched; present
 * fields follow the same rules as {@link OrderRequestDTO}. Unknown fields are
 * rejected instead of being merged into the order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Partial update of an order")
public class OrderPatchRequestDTO {
    @Size(min = 1, message = "Order must have at least one item in order update")
    @Valid
    private List<OrderItemRequestDTO> items;

    @DecimalMin(value = "0", inclusive = false, message = "Total amount must be positive in order update")
    @Digits(integer = 10, fraction = 2, message = "Total amount supports at most 2 decimal places in order update")
    private BigDecimal totalAmount;

    @Pattern(regexp = "(?s).*\\S.*", message = "Delivery location cannot be blank in order update")
    private String deliveryLocation;

    @Schema(description = "New status, canonical name or accepted alias", example = "CONFIRMED")
    @Pattern(regexp = "(?s).*\\S.*", message = "Status cannot be blank in order update")
    private String status;

    @JsonAnySetter
    void rejectUnknownField(String name, Object value) {
        throw new IllegalArgumentException("Unknown field in order update: " + name);
    }

    public boolean hasStatus() {
        return status != null;
    }

    public boolean isEmpty() {
        return items == null && totalAmount == null && deliveryLocation == null && status == null;
    }
}
