package info.mouts.foodorders.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductPatchRequestDTO {
    @Pattern(regexp = "(?s).*\\S.*", message = "Product name cannot be blank")
    private String name;

    @DecimalMin(value = "0", inclusive = false, message = "Product price must be positive")
    private BigDecimal price;

    private String category;
    private String imageUrl;
    private String description;
    private Boolean inStock;
    private Boolean active;
}
