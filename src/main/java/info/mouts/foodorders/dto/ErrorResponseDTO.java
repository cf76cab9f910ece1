package info.mouts.foodorders.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error envelope returned by every failing endpoint")
public class ErrorResponseDTO {
    @Schema(example = "error")
    @Builder.Default
    private String status = "error";

    @Schema(example = "Order not found for ID: ORD42")
    private String message;

    @Schema(example = "404")
    private int statusCode;

    @Schema(example = "NOT_FOUND")
    private String code;

    @Schema(description = "Additional information, e.g. field errors")
    private Object details;
}
