package info.mouts.foodorders.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderCreatedResponseDTO {
    private boolean success;
    private String orderId;
}
