package info.mouts.foodorders.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitOrderRequestDTO {
    @NotNull(message = "Order cannot be null in submit request")
    @Valid
    private OrderRequestDTO order;
}
