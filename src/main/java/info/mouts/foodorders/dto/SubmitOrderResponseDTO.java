package info.mouts.foodorders.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Result of a sequential order submission")
public class SubmitOrderResponseDTO {
    @Schema(example = "true")
    private boolean success;

    @Schema(description = "Sequential order identifier", example = "ORD42")
    private String orderId;

    @Schema(description = "Bare sequential number", example = "42")
    private long orderNumber;
}
